package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.config.WorkerExecutorConfig;
import com.example.vrudetect_backend.engine.Interfaces.DetectionEngine;
import com.example.vrudetect_backend.engine.Interfaces.FrameSourceFactory;
import com.example.vrudetect_backend.exception.SourceUnavailableException;
import com.example.vrudetect_backend.model.BoundingBox;
import com.example.vrudetect_backend.model.DetectionRecord;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.model.JobResult;
import com.example.vrudetect_backend.model.JobState;
import com.example.vrudetect_backend.model.ProgressEvent;
import com.example.vrudetect_backend.model.RawDetection;
import com.example.vrudetect_backend.model.ResultSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ConcurrentTaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class JobSupervisorTest {

    private static final String VIDEO = "videos/street.mp4";

    private ExecutorService pool;
    private ScheduledExecutorService scheduled;
    private ThreadPoolTaskExecutor registryLoop;
    private TaskRegistry registry;
    private PipelineProperties props;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(4);
        scheduled = Executors.newScheduledThreadPool(2);
        registryLoop = new WorkerExecutorConfig().registryTaskExecutor();
        registry = new TaskRegistry(registryLoop, Clock.systemUTC());
        props = new PipelineProperties();
        props.setGracePeriodMs(100);
        props.setRetryBackoffMs(5);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        scheduled.shutdownNow();
        registryLoop.shutdown();
    }

    private static JobConfig config(int stride, long perFrameTimeoutMs, long totalTimeoutMs, int concurrency, boolean fallback) {
        return new JobConfig(stride, null, perFrameTimeoutMs, totalTimeoutMs, 0.5, Set.of(), concurrency, fallback);
    }

    private UUID submit(JobConfig config) {
        return registry.submit(VIDEO, config).join().jobId();
    }

    private JobResult run(UUID jobId, JobConfig config, DetectionEngine engine, FrameSourceFactory sources) {
        var inference = new InferenceExecutor(pool, new ConcurrentTaskScheduler(scheduled), engine,
                new SimpleMeterRegistry(), props);
        var factory = new JobSupervisorFactory(registry, sources, inference, new DetectionFilter(props),
                new ResultAggregator(), new SyntheticFallback(props), props, Clock.systemUTC());
        factory.create(jobId, VIDEO, config).run();
        return registry.status(jobId).join().orElseThrow().result();
    }

    private JobResult run(JobConfig config, DetectionEngine engine, FrameSourceFactory sources) {
        return run(submit(config), config, engine, sources);
    }

    private static void assertAccounting(JobResult result) {
        assertThat(result.framesProcessed() + result.framesSkipped() + result.framesFailed())
                .isEqualTo(result.framesDispatched());
        assertThat(result.framesDispatched()).isLessThanOrEqualTo(result.framesTotal());
    }

    private static RawDetection person(double x) {
        return new RawDetection("pedestrian", 0.9, new BoundingBox(x, 100, 60, 120));
    }

    @Test
    void timedOutFramesAreSkippedAndJobCompletes() {
        var source = new FakeFrameSource(121, 30);
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            if (frame.index() == 20 || frame.index() == 30) {
                Thread.sleep(10_000);
            }
            return List.of(person(frame.index()));
        }, true);

        JobResult result = run(config(10, 200, 30_000, 2, true), engine, key -> source);

        assertThat(result.state()).isEqualTo(JobState.COMPLETED);
        assertThat(result.framesTotal()).isEqualTo(13);
        assertThat(result.framesDispatched()).isEqualTo(13);
        assertThat(result.framesProcessed()).isEqualTo(11);
        assertThat(result.framesSkipped()).isEqualTo(2);
        assertThat(result.degraded()).isTrue();
        assertThat(result.source()).isEqualTo(ResultSource.REAL);
        assertThat(result.tracks()).hasSize(1);
        assertThat(result.detections()).hasSize(11)
                .extracting(DetectionRecord::frameIndex)
                .doesNotContain(20, 30);
        assertThat(source.closed).isTrue();
        assertAccounting(result);
    }

    @Test
    void skippedFramesCountTowardTrackGap() {
        Set<Integer> slow = Set.of(10, 20, 30, 40);
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            if (slow.contains(frame.index())) {
                Thread.sleep(10_000);
            }
            return List.of(person(100));
        }, true);

        JobResult result = run(config(10, 150, 30_000, 4, false), engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.state()).isEqualTo(JobState.COMPLETED);
        assertThat(result.framesSkipped()).isEqualTo(4);
        assertThat(result.tracks()).hasSize(2);
        assertThat(result.tracks().get(0).lastSeenFrame()).isZero();
        assertThat(result.tracks().get(1).firstSeenFrame()).isEqualTo(50);
    }

    @Test
    void gapWithinLimitKeepsTrackOpen() {
        Set<Integer> slow = Set.of(10, 20, 30);
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            if (slow.contains(frame.index())) {
                Thread.sleep(10_000);
            }
            return List.of(person(100));
        }, true);

        JobResult result = run(config(10, 150, 30_000, 4, false), engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.framesSkipped()).isEqualTo(3);
        assertThat(result.tracks()).hasSize(1);
        assertThat(result.tracks().get(0).firstSeenFrame()).isZero();
        assertThat(result.tracks().get(0).lastSeenFrame()).isEqualTo(120);
    }

    @Test
    void outOfOrderCompletionDoesNotChangeTracks() {
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            Thread.sleep(Math.max(0, 60 - frame.index() / 2));
            int i = frame.index();
            if (i % 30 == 0) {
                return List.of(person(i * 3), new RawDetection("cyclist", 0.8, new BoundingBox(600 - i, 50, 80, 80)));
            }
            return List.of(person(i * 3));
        }, false);
        var serial = config(10, 5_000, 30_000, 1, false);
        var parallel = config(10, 5_000, 30_000, 4, false);

        JobResult one = run(serial, engine, key -> new FakeFrameSource(121, 30));
        JobResult four = run(parallel, engine, key -> new FakeFrameSource(121, 30));

        assertThat(four.state()).isEqualTo(JobState.COMPLETED);
        assertThat(four.tracks()).isEqualTo(one.tracks());
        assertThat(four.detections()).isEqualTo(one.detections());
        assertThat(four.classCounts()).isEqualTo(one.classCounts());
    }

    @Test
    void cancellationStopsDispatchingAfterObservedFlag() {
        var config = config(10, 5_000, 30_000, 1, true);
        UUID jobId = submit(config);
        var calls = new AtomicInteger();
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            if (calls.incrementAndGet() == 5) {
                registry.requestCancel(jobId).join();
            }
            return List.of(person(frame.index()));
        }, false);

        JobResult result = run(jobId, config, engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.state()).isEqualTo(JobState.CANCELLED);
        assertThat(result.degraded()).isTrue();
        assertThat(result.framesDispatched()).isEqualTo(5);
        assertThat(result.framesProcessed()).isEqualTo(5);
        assertThat(result.detections()).extracting(DetectionRecord::frameIndex).containsExactly(0, 10, 20, 30, 40);
        assertThat(result.tracks()).allSatisfy(t -> assertThat(t.lastSeenFrame()).isLessThanOrEqualTo(40));
        assertAccounting(result);
    }

    @Test
    void cancelBeforeStartDispatchesNothing() {
        var config = config(10, 5_000, 30_000, 2, false);
        UUID jobId = submit(config);
        registry.requestCancel(jobId).join();
        var calls = new AtomicInteger();
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            calls.incrementAndGet();
            return List.of();
        }, false);

        JobResult result = run(jobId, config, engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.state()).isEqualTo(JobState.CANCELLED);
        assertThat(result.framesDispatched()).isZero();
        assertThat(calls.get()).isZero();
    }

    @Test
    void cancelledEmptyRunOnlyFallsBackOnDispatchedFrames() {
        var config = config(10, 5_000, 30_000, 1, true);
        UUID jobId = submit(config);
        var calls = new AtomicInteger();
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            if (calls.incrementAndGet() == 5) {
                registry.requestCancel(jobId).join();
            }
            return List.of();
        }, false);

        JobResult result = run(jobId, config, engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.state()).isEqualTo(JobState.CANCELLED);
        assertThat(result.framesDispatched()).isEqualTo(5);
        assertThat(result.source()).isEqualTo(ResultSource.SYNTHETIC);
        assertThat(result.detections()).isNotEmpty()
                .extracting(DetectionRecord::frameIndex)
                .isSubsetOf(0, 10, 20, 30, 40);
        assertThat(result.tracks()).allSatisfy(t -> assertThat(t.lastSeenFrame()).isLessThanOrEqualTo(40));
    }

    @Test
    void queueingBehindBusyPoolDoesNotCountAgainstFrameTimeout() {
        pool.shutdownNow();
        pool = Executors.newFixedThreadPool(1);
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            Thread.sleep(150);
            return List.of(person(frame.index()));
        }, true);

        JobResult result = run(config(10, 400, 30_000, 4, false), engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.state()).isEqualTo(JobState.COMPLETED);
        assertThat(result.framesDispatched()).isEqualTo(13);
        assertThat(result.framesProcessed()).isEqualTo(13);
        assertThat(result.framesSkipped()).isZero();
        assertAccounting(result);
    }

    @Test
    void totalBudgetExpiryTimesOutWithPartialResult() {
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(frame -> {
            Thread.sleep(100);
            return List.of(person(frame.index()));
        }, true);

        long start = System.nanoTime();
        JobResult result = run(config(10, 5_000, 350, 1, false), engine, key -> new FakeFrameSource(121, 30));
        Duration took = Duration.ofNanos(System.nanoTime() - start);

        assertThat(result.state()).isEqualTo(JobState.TIMED_OUT);
        assertThat(result.degraded()).isTrue();
        assertThat(result.framesDispatched()).isLessThan(13);
        assertThat(result.framesProcessed()).isGreaterThan(0);
        assertThat(took).isLessThan(Duration.ofSeconds(3));
        assertAccounting(result);
    }

    @Test
    void unavailableSourceFailsWithoutFinalizing() {
        var config = config(10, 5_000, 30_000, 2, true);
        UUID jobId = submit(config);
        FrameSourceFactory sources = key -> {
            throw new SourceUnavailableException(key, "VIDEO_NOT_FOUND");
        };

        JobResult result = run(jobId, config, new InferenceExecutorTest.ScriptedEngine(f -> List.of(), false), sources);

        assertThat(result.state()).isEqualTo(JobState.FAILED);
        assertThat(result.error()).startsWith("SOURCE_UNAVAILABLE");
        assertThat(result.detections()).isEmpty();
        assertThat(result.framesDispatched()).isZero();

        List<JobState> states = registry.progress(jobId, 0).join().orElseThrow()
                .map(ProgressEvent::state).collectList().block(Duration.ofSeconds(2));
        assertThat(states).containsExactly(JobState.QUEUED, JobState.RUNNING, JobState.FAILED);
    }

    @Test
    void unreadableVideoFailsAfterFinalizing() {
        Set<Integer> all = new HashSet<>();
        for (int i = 0; i < 41; i++) {
            all.add(i);
        }
        var config = config(10, 5_000, 30_000, 2, true);
        UUID jobId = submit(config);

        JobResult result = run(jobId, config, new InferenceExecutorTest.ScriptedEngine(f -> List.of(), false),
                key -> new FakeFrameSource(41, 25, all));

        assertThat(result.state()).isEqualTo(JobState.FAILED);
        assertThat(result.error()).startsWith("SOURCE_UNREADABLE");
        assertThat(result.framesSkipped()).isEqualTo(5);
        assertThat(result.source()).isEqualTo(ResultSource.REAL);
        assertThat(result.detections()).isEmpty();

        List<JobState> states = registry.progress(jobId, 0).join().orElseThrow()
                .map(ProgressEvent::state).distinct().collectList().block(Duration.ofSeconds(2));
        assertThat(states).containsExactly(JobState.QUEUED, JobState.RUNNING, JobState.FINALIZING, JobState.FAILED);
    }

    @Test
    void emptyRunFallsBackToSyntheticDetections() {
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(f -> List.of(), false);

        JobResult result = run(config(10, 5_000, 30_000, 2, true), engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.state()).isEqualTo(JobState.COMPLETED);
        assertThat(result.source()).isEqualTo(ResultSource.SYNTHETIC);
        assertThat(result.detections()).isNotEmpty().allMatch(DetectionRecord::synthetic);
        assertThat(result.tracks()).allSatisfy(t -> assertThat(t.trackId()).startsWith("synthetic-"));
    }

    @Test
    void emptyRunWithoutFallbackGivesEmptyResult() {
        DetectionEngine engine = new InferenceExecutorTest.ScriptedEngine(f -> List.of(), false);

        JobResult result = run(config(10, 5_000, 30_000, 2, false), engine, key -> new FakeFrameSource(121, 30));

        assertThat(result.state()).isEqualTo(JobState.COMPLETED);
        assertThat(result.source()).isEqualTo(ResultSource.REAL);
        assertThat(result.detections()).isEmpty();
        assertThat(result.tracks()).isEmpty();
        assertThat(result.degraded()).isFalse();
    }

    @Test
    void progressEventsHaveIncreasingSeq() {
        var config = config(10, 5_000, 30_000, 3, false);
        UUID jobId = submit(config);
        run(jobId, config, new InferenceExecutorTest.ScriptedEngine(f -> List.of(person(0)), false),
                key -> new FakeFrameSource(50, 25));

        List<Long> seqs = registry.progress(jobId, 0).join().orElseThrow()
                .map(ProgressEvent::seq).collectList().block(Duration.ofSeconds(2));
        assertThat(seqs).isNotEmpty();
        for (int i = 0; i < seqs.size(); i++) {
            assertThat(seqs.get(i)).isEqualTo(i + 1L);
        }
        var last = new AtomicReference<ProgressEvent>();
        registry.progress(jobId, seqs.size() - 1L).join().orElseThrow().doOnNext(last::set).blockLast(Duration.ofSeconds(2));
        assertThat(last.get().state()).isEqualTo(JobState.COMPLETED);
    }
}
