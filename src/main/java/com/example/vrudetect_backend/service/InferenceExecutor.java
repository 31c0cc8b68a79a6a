package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.engine.Interfaces.DetectionEngine;
import com.example.vrudetect_backend.engine.Interfaces.FrameSource;
import com.example.vrudetect_backend.exception.FrameReadException;
import com.example.vrudetect_backend.exception.InferenceException;
import com.example.vrudetect_backend.exception.InferenceTimeoutException;
import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.FrameImage;
import com.example.vrudetect_backend.model.FrameOutcome;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.model.RawDetection;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the detector for single frames on the shared inference pool, each call bounded by a per-frame deadline.
 * <p>
 * Outcome mapping:
 * <ul>
 *     <li>detector returns: PROCESSED</li>
 *     <li>deadline (armed once the call starts running) fires first: SKIPPED; the call is interrupted when the engine supports it, otherwise abandoned</li>
 *     <li>frame cannot be decoded: SKIPPED, no retry</li>
 *     <li>detector raises: retried with {@link Retry#backoff} exponential backoff, FAILED once retries are used up</li>
 * </ul>
 * Results that arrive after their attempt was settled are logged as stale and dropped.
 */
@Service
public class InferenceExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(InferenceExecutor.class);
    static final String LATENCY_METRIC = "detection.inference.latency";

    private final Executor pool;
    private final TaskScheduler scheduler;
    private final DetectionEngine engine;
    private final MeterRegistry meters;
    private final int maxRetries;
    private final long retryBackoffMs;

    public InferenceExecutor(@Qualifier("inferenceTaskExecutor") Executor pool,
                             @Qualifier("pipelineScheduler") TaskScheduler scheduler,
                             DetectionEngine engine,
                             MeterRegistry meters,
                             PipelineProperties props) {
        this.pool = pool;
        this.scheduler = scheduler;
        this.engine = engine;
        this.meters = meters;
        this.maxRetries = Math.max(0, props.getMaxRetries());
        this.retryBackoffMs = Math.max(0, props.getRetryBackoffMs());
    }

    public DetectionEngine engine() {
        return engine;
    }

    /**
     * Starts detection for one frame. Never blocks; the returned handle settles on the pool or scheduler threads.
     */
    public InFlightFrame submit(FrameSource source, Frame frame, JobConfig config) {
        var flight = new InFlightFrame(frame, System.nanoTime());
        var image = new AtomicReference<FrameImage>();
        var attempts = new AtomicInteger();

        Disposable subscription = Mono.defer(() -> attempt(flight, source, image, config, attempts.incrementAndGet()))
                .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(retryBackoffMs))
                        .filter(InferenceExecutor::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn("inference retry frame={} attempt={} error={}",
                                frame.index(), signal.totalRetries() + 1, String.valueOf(signal.failure())))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .subscribe(
                        detections -> flight.settle(FrameOutcome.processed(frame, detections, attempts.get(), flight.elapsedMs())),
                        error -> onFailure(flight, config, attempts.get(), error));
        flight.bind(subscription);
        return flight;
    }

    /**
     * One detector call. The per-frame deadline is armed when the task starts running on the pool, so time spent
     * queued behind other jobs does not count against it.
     */
    private Mono<List<RawDetection>> attempt(InFlightFrame flight, FrameSource source, AtomicReference<FrameImage> image,
                                             JobConfig config, int number) {
        Frame frame = flight.frame();
        CompletableFuture<List<RawDetection>> call = new CompletableFuture<>();
        AtomicLong startedNanos = new AtomicLong(System.nanoTime());
        AtomicReference<Future<?>> self = new AtomicReference<>();

        FutureTask<Void> task = new FutureTask<>(() -> {
            if (call.isDone()) {
                return;
            }
            startedNanos.set(System.nanoTime());
            ScheduledFuture<?> deadline;
            try {
                deadline = scheduler.schedule(() -> {
                    if (call.completeExceptionally(new InferenceTimeoutException(frame.index(), config.perFrameTimeoutMs()))) {
                        self.get().cancel(engine.supportsCancellation());
                    }
                }, Instant.now().plusMillis(config.perFrameTimeoutMs()));
            } catch (TaskRejectedException e) {
                call.completeExceptionally(new InferenceException("deadline scheduling rejected for frame " + frame.index(), e));
                return;
            }
            try {
                FrameImage img = image.get();
                if (img == null) {
                    img = source.getFrame(frame);
                    image.set(img);
                }
                List<RawDetection> detections = engine.detect(img, config.confidenceThreshold());
                if (!call.complete(detections == null ? List.of() : detections)) {
                    LOGGER.debug("stale result discarded frame={} attempt={} detector={}", frame.index(), number, engine.id());
                }
            } catch (Exception e) {
                if (!call.completeExceptionally(e)) {
                    LOGGER.debug("stale failure discarded frame={} attempt={} error={}", frame.index(), number, e.toString());
                }
            } finally {
                deadline.cancel(false);
            }
        }, null);
        self.set(task);
        flight.beginAttempt(number);
        call.whenComplete((detections, error) -> record(startedNanos.get(), outcomeTag(unwrap(error))));

        try {
            pool.execute(task);
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(new InferenceException("inference pool rejected frame " + frame.index(), e));
        }
        return Mono.fromFuture(call)
                .doOnCancel(() -> task.cancel(engine.supportsCancellation()));
    }

    private void onFailure(InFlightFrame flight, JobConfig config, int attempts, Throwable error) {
        Frame frame = flight.frame();
        Throwable cause = unwrap(error);
        if (flight.isSettled()) {
            LOGGER.debug("attempt settled after frame was abandoned frame={} attempt={}", frame.index(), attempts);
            return;
        }
        if (cause instanceof InferenceTimeoutException) {
            LOGGER.warn("frame timeout frame={} attempt={} timeoutMs={}", frame.index(), attempts, config.perFrameTimeoutMs());
            flight.settle(FrameOutcome.skipped(frame, attempts, flight.elapsedMs(), "TIMEOUT"));
            return;
        }
        if (cause instanceof FrameReadException) {
            LOGGER.warn("frame unreadable frame={} reason={}", ((FrameReadException) cause).getFrameIndex(), cause.getMessage());
            flight.settle(FrameOutcome.skipped(frame, attempts, flight.elapsedMs(), "FRAME_READ_ERROR"));
            return;
        }
        LOGGER.warn("frame failed frame={} attempts={} error={}", frame.index(), attempts, String.valueOf(cause));
        flight.settle(FrameOutcome.failed(frame, attempts, flight.elapsedMs(),
                "INFERENCE_ERROR: " + (cause == null ? "unknown" : cause.getMessage())));
    }

    private static boolean isRetryable(Throwable error) {
        Throwable cause = unwrap(error);
        return !(cause instanceof InferenceTimeoutException)
                && !(cause instanceof FrameReadException)
                && !(cause instanceof CancellationException);
    }

    private void record(long attemptStart, String outcome) {
        Timer.builder(LATENCY_METRIC)
                .tag("detector", engine.id())
                .tag("outcome", outcome)
                .register(meters)
                .record(System.nanoTime() - attemptStart, TimeUnit.NANOSECONDS);
    }

    private static String outcomeTag(Throwable cause) {
        if (cause == null) return "processed";
        if (cause instanceof InferenceTimeoutException) return "timeout";
        if (cause instanceof FrameReadException) return "read_error";
        if (cause instanceof CancellationException) return "cancelled";
        return "error";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
