package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.engine.Interfaces.FrameSource;
import com.example.vrudetect_backend.engine.Interfaces.FrameSourceFactory;
import com.example.vrudetect_backend.exception.SourceUnavailableException;
import com.example.vrudetect_backend.model.DetectionRecord;
import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.FrameOutcome;
import com.example.vrudetect_backend.model.FrameStatus;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.model.JobCounters;
import com.example.vrudetect_backend.model.JobResult;
import com.example.vrudetect_backend.model.JobSnapshot;
import com.example.vrudetect_backend.model.JobState;
import com.example.vrudetect_backend.model.RawDetection;
import com.example.vrudetect_backend.model.ResultSource;
import com.example.vrudetect_backend.model.TrackSummary;
import com.example.vrudetect_backend.sampler.FrameSampler;
import com.example.vrudetect_backend.tracking.CorrelatorSettings;
import com.example.vrudetect_backend.tracking.TrackCorrelator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Drives one job from RUNNING to a terminal state.
 * <p>
 * Frames are dispatched in sampled order with at most {@code maxConcurrency} in flight. Outcomes may settle in any
 * order; they are buffered and correlated strictly by sample position. The total budget is checked before every
 * dispatch and bounds the final wait; once it expires in-flight frames get a short grace period and are then
 * abandoned as SKIPPED.
 */
public class JobSupervisor implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobSupervisor.class);
    private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);
    private static final long ABANDON_DRAIN_SECONDS = 5;

    private final UUID jobId;
    private final String videoKey;
    private final JobConfig config;
    private final TaskRegistry registry;
    private final FrameSourceFactory sources;
    private final InferenceExecutor inference;
    private final DetectionFilter filter;
    private final ResultAggregator aggregator;
    private final SyntheticFallback fallback;
    private final CorrelatorSettings correlatorSettings;
    private final long graceNanos;
    private final Clock clock;

    private final BlockingQueue<Settled> settledQueue = new LinkedBlockingQueue<>();
    private final Map<Integer, InFlightFrame> inFlight = new HashMap<>();
    private final TreeMap<Integer, FrameOutcome> reorderBuffer = new TreeMap<>();
    private final List<DetectionRecord> accepted = new ArrayList<>();
    private final List<Frame> processedFrames = new ArrayList<>();
    private TrackCorrelator correlator;
    private int nextToCorrelate;
    private int readErrors;

    enum StopReason { EXHAUSTED, TIMEOUT, CANCELLED }

    JobSupervisor(UUID jobId, String videoKey, JobConfig config, TaskRegistry registry, FrameSourceFactory sources,
                  InferenceExecutor inference, DetectionFilter filter, ResultAggregator aggregator,
                  SyntheticFallback fallback, CorrelatorSettings correlatorSettings, long gracePeriodMs, Clock clock) {
        this.jobId = jobId;
        this.videoKey = videoKey;
        this.config = config;
        this.registry = registry;
        this.sources = sources;
        this.inference = inference;
        this.filter = filter;
        this.aggregator = aggregator;
        this.fallback = fallback;
        this.correlatorSettings = correlatorSettings;
        this.graceNanos = TimeUnit.MILLISECONDS.toNanos(gracePeriodMs);
        this.clock = clock;
    }

    @Override
    public void run() {
        long startNanos = System.nanoTime();
        try {
            registry.markRunning(jobId).join();
        } catch (RuntimeException e) {
            LOGGER.error("JOB START rejected jobId={} videoKey={}", jobId, videoKey, e);
            return;
        }
        LOGGER.info("JOB START jobId={} videoKey={} stride={} maxFrames={} concurrency={}",
                jobId, videoKey, config.sampleStride(), config.maxFrames(), config.maxConcurrency());

        FrameSource source;
        try {
            source = sources.open(videoKey);
        } catch (SourceUnavailableException e) {
            LOGGER.error("JOB FAIL source unavailable jobId={} videoKey={} reason={}", jobId, e.getVideoKey(), e.getMessage());
            finish(JobState.FAILED, List.of(), "SOURCE_UNAVAILABLE: " + e.getMessage(), startNanos, false);
            return;
        }

        try (source) {
            supervise(source, startNanos);
        } catch (RuntimeException e) {
            LOGGER.error("JOB FAIL internal error jobId={} videoKey={}", jobId, videoKey, e);
            releaseInFlight("INTERNAL_ERROR");
            failInternal(e, startNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("JOB FAIL interrupted jobId={} videoKey={}", jobId, videoKey);
            releaseInFlight("INTERRUPTED");
            failInternal(e, startNanos);
        }
    }

    private void supervise(FrameSource source, long startNanos) throws InterruptedException {
        FrameSampler sampler = config.maxFrames() != null
                ? FrameSampler.byMaxSamples(source.frameCount(), source.fps(), config.maxFrames())
                : FrameSampler.byStride(source.frameCount(), source.fps(), config.sampleStride());
        registry.setFramesTotal(jobId, sampler.size()).join();
        correlator = new TrackCorrelator(correlatorSettings);

        long deadline = startNanos + TimeUnit.MILLISECONDS.toNanos(config.totalTimeoutMs());
        Semaphore permits = new Semaphore(config.maxConcurrency());
        StopReason reason = StopReason.EXHAUSTED;
        int ordinal = 0;

        for (Frame frame : sampler) {
            drain();
            if (cancelRequested()) {
                reason = StopReason.CANCELLED;
                break;
            }
            boolean acquired = false;
            while (!acquired) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                acquired = permits.tryAcquire(Math.min(remaining, POLL_SLICE_NANOS), TimeUnit.NANOSECONDS);
                if (!acquired) {
                    drain();
                }
            }
            if (!acquired) {
                reason = StopReason.TIMEOUT;
                break;
            }
            drain();
            if (cancelRequested()) {
                permits.release();
                reason = StopReason.CANCELLED;
                break;
            }

            registry.frameDispatched(jobId, frame.index()).join();
            InFlightFrame flight = inference.submit(source, frame, config);
            int position = ordinal++;
            inFlight.put(position, flight);
            flight.outcome().whenComplete((outcome, error) -> {
                permits.release();
                settledQueue.offer(new Settled(position, outcome != null
                        ? outcome
                        : FrameOutcome.failed(frame, 0, 0, "INTERNAL: " + error)));
            });
        }

        long waitUntil = reason == StopReason.TIMEOUT ? System.nanoTime() + graceNanos : deadline;
        if (reason == StopReason.CANCELLED) {
            waitUntil = deadline + graceNanos;
        }
        while (!inFlight.isEmpty()) {
            long remaining = waitUntil - System.nanoTime();
            if (remaining <= 0) {
                if (reason == StopReason.EXHAUSTED) {
                    // budget ran out with frames still in flight
                    reason = StopReason.TIMEOUT;
                    waitUntil = System.nanoTime() + graceNanos;
                    continue;
                }
                break;
            }
            Settled s = settledQueue.poll(remaining, TimeUnit.NANOSECONDS);
            if (s != null) {
                handle(s);
            }
        }
        abandonAll(reason == StopReason.CANCELLED ? "CANCELLED" : "JOB_DEADLINE");

        registry.beginFinalizing(jobId, "finalizing: " + reason).join();
        List<TrackSummary> tracks = correlator.finish();

        JobCounters counters = currentCounters();
        if (counters.framesDispatched() > 0 && readErrors == counters.framesDispatched()) {
            finish(JobState.FAILED, tracks, "SOURCE_UNREADABLE: all " + readErrors + " dispatched frames failed to decode",
                    startNanos, false);
            return;
        }
        JobState terminal = switch (reason) {
            case EXHAUSTED -> JobState.COMPLETED;
            case TIMEOUT -> JobState.TIMED_OUT;
            case CANCELLED -> JobState.CANCELLED;
        };
        finish(terminal, tracks, null, startNanos, config.fallbackEnabled());
    }

    private boolean cancelRequested() {
        return Boolean.TRUE.equals(registry.isCancelRequested(jobId).join());
    }

    private void drain() {
        Settled s;
        while ((s = settledQueue.poll()) != null) {
            handle(s);
        }
    }

    private void handle(Settled settled) {
        if (inFlight.remove(settled.position()) == null) {
            return;
        }
        FrameOutcome outcome = settled.outcome();
        if (outcome.status() == FrameStatus.PROCESSED) {
            outcome = outcome.withDetections(filter.apply(outcome.detections(), config));
        } else if ("FRAME_READ_ERROR".equals(outcome.reason())) {
            readErrors++;
        }
        registry.frameSettled(jobId, outcome.frame().index(), outcome.status(), outcome.detections().size()).join();
        LOGGER.debug("frame settled jobId={} frame={} status={} detections={} attempts={} latencyMs={}",
                jobId, outcome.frame().index(), outcome.status(), outcome.detections().size(),
                outcome.attempts(), outcome.latencyMs());

        reorderBuffer.put(settled.position(), outcome);
        while (reorderBuffer.containsKey(nextToCorrelate)) {
            correlate(reorderBuffer.remove(nextToCorrelate));
            nextToCorrelate++;
        }
    }

    private void correlate(FrameOutcome outcome) {
        Frame frame = outcome.frame();
        if (outcome.status() != FrameStatus.PROCESSED) {
            // still a sampled frame: open tracks take a miss
            correlator.correlate(frame, List.of());
            return;
        }
        processedFrames.add(frame);
        boolean synthetic = inference.engine().synthetic();
        for (TrackCorrelator.Assignment a : correlator.correlate(frame, outcome.detections())) {
            RawDetection d = a.detection();
            accepted.add(new DetectionRecord(frame.index(), frame.timestampMs(), d.classLabel(), d.confidence(),
                    d.box(), a.trackId(), synthetic));
        }
    }

    private void abandonAll(String reason) throws InterruptedException {
        if (inFlight.isEmpty()) {
            return;
        }
        LOGGER.warn("abandoning frames jobId={} count={} reason={}", jobId, inFlight.size(), reason);
        for (InFlightFrame flight : List.copyOf(inFlight.values())) {
            flight.abandon(reason);
        }
        while (!inFlight.isEmpty()) {
            Settled s = settledQueue.poll(ABANDON_DRAIN_SECONDS, TimeUnit.SECONDS);
            if (s == null) {
                throw new IllegalStateException("abandoned frames did not settle for job " + jobId);
            }
            handle(s);
        }
    }

    /**
     * Failure path: settles whatever is still in flight without waiting for other threads.
     */
    private void releaseInFlight(String reason) {
        for (InFlightFrame flight : List.copyOf(inFlight.values())) {
            flight.abandon(reason);
        }
        try {
            drain();
        } catch (RuntimeException e) {
            LOGGER.warn("could not account abandoned frames jobId={} pending={}", jobId, inFlight.size(), e);
        }
    }

    private void finish(JobState terminal, List<TrackSummary> tracks, String error, long startNanos,
                        boolean fallbackAllowed) {
        List<TrackSummary> finalTracks = tracks;
        List<DetectionRecord> finalDetections = List.copyOf(accepted);
        ResultSource source = inference.engine().synthetic() ? ResultSource.SYNTHETIC : ResultSource.REAL;

        if (terminal != JobState.FAILED && fallbackAllowed && finalDetections.isEmpty() && !processedFrames.isEmpty()) {
            SyntheticFallback.Fallback f = fallback.generate(List.copyOf(processedFrames));
            finalTracks = f.tracks();
            finalDetections = f.detections();
            source = ResultSource.SYNTHETIC;
            LOGGER.info("JOB FALLBACK jobId={} synthetic detections={}", jobId, finalDetections.size());
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        JobResult result = aggregator.aggregate(new ResultAggregator.Input(jobId, videoKey, terminal, finalTracks,
                finalDetections, currentCounters(), source, elapsedMs, inference.engine().id(), error, clock.instant()));
        registry.finish(jobId, result).join();
    }

    private void failInternal(Exception cause, long startNanos) {
        try {
            JobSnapshot snapshot = registry.status(jobId).join().orElse(null);
            if (snapshot == null || snapshot.state().isTerminal()) {
                return;
            }
            if (snapshot.state() == JobState.RUNNING) {
                registry.beginFinalizing(jobId, "finalizing: internal error").join();
            }
            List<TrackSummary> tracks = correlator != null ? correlator.finish() : List.of();
            finish(JobState.FAILED, tracks, "INTERNAL_ERROR: " + cause.getMessage(), startNanos, false);
        } catch (RuntimeException e) {
            e.addSuppressed(cause);
            LOGGER.error("JOB FAIL could not record failure jobId={}", jobId, e);
        }
    }

    private JobCounters currentCounters() {
        return registry.status(jobId).join().map(JobSnapshot::counters).orElse(JobCounters.empty());
    }

    private record Settled(int position, FrameOutcome outcome) {
    }
}
