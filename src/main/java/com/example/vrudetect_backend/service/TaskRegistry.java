package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.model.FrameStatus;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.model.JobCounters;
import com.example.vrudetect_backend.model.JobResult;
import com.example.vrudetect_backend.model.JobSnapshot;
import com.example.vrudetect_backend.model.JobState;
import com.example.vrudetect_backend.model.ProgressEvent;
import com.example.vrudetect_backend.model.SubmitOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Owner of all job state.
 * <p>
 * Every mutation and query runs as a message on the single-threaded {@code registryTaskExecutor}, so job records
 * are never touched concurrently. Callers receive a {@link CompletableFuture}; they must not block on it from that thread.
 * Each state or counter change appends a {@link ProgressEvent} to the job's replaying stream.
 */
@Service
public class TaskRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskRegistry.class);

    private final Executor loop;
    private final Clock clock;
    private final Map<UUID, JobRecord> jobs = new HashMap<>();
    private final Map<String, UUID> activeByVideoKey = new HashMap<>();

    public TaskRegistry(@Qualifier("registryTaskExecutor") Executor loop, Clock clock) {
        this.loop = loop;
        this.clock = clock;
    }

    /**
     * Registers a job, or returns the active job of the same video.
     */
    public CompletableFuture<SubmitOutcome> submit(String videoKey, JobConfig config) {
        return call(() -> {
            UUID existing = activeByVideoKey.get(videoKey);
            if (existing != null) {
                JobRecord job = jobs.get(existing);
                LOGGER.info("JOB DEDUP videoKey={} jobId={} state={}", videoKey, existing, job.state);
                return new SubmitOutcome(existing, false, job.state);
            }
            JobRecord job = new JobRecord(UUID.randomUUID(), videoKey, config, clock.instant());
            jobs.put(job.id, job);
            activeByVideoKey.put(videoKey, job.id);
            emit(job, "QUEUED");
            LOGGER.info("JOB QUEUED jobId={} videoKey={}", job.id, videoKey);
            return new SubmitOutcome(job.id, true, job.state);
        });
    }

    /** Drops a job that never left QUEUED, e.g. when no supervisor could take it. */
    public CompletableFuture<Boolean> discard(UUID jobId) {
        return call(() -> {
            JobRecord job = jobs.get(jobId);
            if (job == null || job.state != JobState.QUEUED) {
                return false;
            }
            jobs.remove(jobId);
            activeByVideoKey.remove(job.videoKey, jobId);
            job.sink.tryEmitComplete();
            return true;
        });
    }

    public CompletableFuture<JobSnapshot> markRunning(UUID jobId) {
        return call(() -> {
            JobRecord job = require(jobId);
            transition(job, JobState.RUNNING);
            job.startedAt = clock.instant();
            emit(job, "RUNNING");
            return job.snapshot();
        });
    }

    public CompletableFuture<Void> setFramesTotal(UUID jobId, int framesTotal) {
        return run(() -> {
            JobRecord job = require(jobId);
            job.counters = job.counters.withFramesTotal(framesTotal);
            emit(job, "frames total " + framesTotal);
        });
    }

    public CompletableFuture<Void> frameDispatched(UUID jobId, int frameIndex) {
        return run(() -> {
            JobRecord job = require(jobId);
            requireActiveRun(job);
            job.counters = job.counters.dispatched();
            emit(job, "frame " + frameIndex + " dispatched");
        });
    }

    public CompletableFuture<Void> frameSettled(UUID jobId, int frameIndex, FrameStatus status, int detections) {
        return run(() -> {
            JobRecord job = require(jobId);
            requireActiveRun(job);
            if (job.counters.framesSettled() >= job.counters.framesDispatched()) {
                throw new IllegalStateException("more frames settled than dispatched for job " + jobId);
            }
            job.counters = job.counters.settled(status, detections);
            emit(job, "frame " + frameIndex + " " + status);
        });
    }

    public CompletableFuture<Void> beginFinalizing(UUID jobId, String reason) {
        return run(() -> {
            JobRecord job = require(jobId);
            transition(job, JobState.FINALIZING);
            emit(job, reason);
        });
    }

    /**
     * Stores the final result and moves the job into the result's terminal state. The progress stream completes
     * after the terminal event.
     */
    public CompletableFuture<Void> finish(UUID jobId, JobResult result) {
        return run(() -> {
            JobRecord job = require(jobId);
            if (!result.state().isTerminal()) {
                throw new IllegalArgumentException("result state must be terminal: " + result.state());
            }
            transition(job, result.state());
            job.result = result;
            job.error = result.error();
            job.finishedAt = clock.instant();
            activeByVideoKey.remove(job.videoKey, jobId);
            emit(job, result.error() != null ? result.error() : result.state().name());
            job.sink.tryEmitComplete();
            LOGGER.info("JOB {} jobId={} processed={} skipped={} failed={} tracks={}",
                    result.state(), jobId, job.counters.framesProcessed(), job.counters.framesSkipped(),
                    job.counters.framesFailed(), result.tracks().size());
        });
    }

    /**
     * Raises the cooperative cancellation flag.
     *
     * @return the job's state, or empty when the job is unknown.
     */
    public CompletableFuture<Optional<JobState>> requestCancel(UUID jobId) {
        return call(() -> {
            JobRecord job = jobs.get(jobId);
            if (job == null) {
                return Optional.empty();
            }
            if (!job.state.isTerminal() && !job.cancelRequested) {
                job.cancelRequested = true;
                LOGGER.info("JOB CANCEL requested jobId={} state={}", jobId, job.state);
            }
            return Optional.of(job.state);
        });
    }

    public CompletableFuture<Boolean> isCancelRequested(UUID jobId) {
        return call(() -> {
            JobRecord job = jobs.get(jobId);
            return job != null && job.cancelRequested;
        });
    }

    public CompletableFuture<Optional<JobSnapshot>> status(UUID jobId) {
        return call(() -> Optional.ofNullable(jobs.get(jobId)).map(JobRecord::snapshot));
    }

    /**
     * Progress stream of a job, replaying every event with {@code seq > afterSeq}.
     */
    public CompletableFuture<Optional<Flux<ProgressEvent>>> progress(UUID jobId, long afterSeq) {
        return call(() -> {
            JobRecord job = jobs.get(jobId);
            if (job == null) {
                return Optional.empty();
            }
            return Optional.of(job.sink.asFlux().filter(e -> e.seq() > afterSeq));
        });
    }

    /**
     * Removes terminal jobs that finished before {@code cutoff}.
     *
     * @return number of evicted jobs.
     */
    public CompletableFuture<Integer> evictTerminalBefore(Instant cutoff) {
        return call(() -> {
            int evicted = 0;
            Iterator<JobRecord> it = jobs.values().iterator();
            while (it.hasNext()) {
                JobRecord job = it.next();
                if (job.state.isTerminal() && job.finishedAt != null && job.finishedAt.isBefore(cutoff)) {
                    it.remove();
                    evicted++;
                }
            }
            return evicted;
        });
    }

    private void transition(JobRecord job, JobState next) {
        if (!job.state.canTransitionTo(next)) {
            throw new IllegalStateException("illegal transition " + job.state + " -> " + next + " for job " + job.id);
        }
        job.state = next;
    }

    private static void requireActiveRun(JobRecord job) {
        if (job.state != JobState.RUNNING && job.state != JobState.FINALIZING) {
            throw new IllegalStateException("job " + job.id + " is not running (state=" + job.state + ")");
        }
    }

    private JobRecord require(UUID jobId) {
        JobRecord job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("unknown job " + jobId);
        }
        return job;
    }

    private void emit(JobRecord job, String message) {
        job.seq++;
        var event = new ProgressEvent(job.id, job.seq, job.state, job.counters, clock.instant(), message);
        Sinks.EmitResult emitted = job.sink.tryEmitNext(event);
        if (emitted.isFailure()) {
            LOGGER.warn("progress emit failed jobId={} seq={} result={}", job.id, job.seq, emitted);
        }
    }

    private <T> CompletableFuture<T> call(Supplier<T> work) {
        try {
            return CompletableFuture.supplyAsync(work, loop);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("task registry is shut down", e));
        }
    }

    private CompletableFuture<Void> run(Runnable work) {
        try {
            return CompletableFuture.runAsync(work, loop);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("task registry is shut down", e));
        }
    }

    private static final class JobRecord {
        private final UUID id;
        private final String videoKey;
        private final JobConfig config;
        private final Instant createdAt;
        private final Sinks.Many<ProgressEvent> sink = Sinks.many().replay().all();
        private JobState state = JobState.QUEUED;
        private JobCounters counters = JobCounters.empty();
        private Instant startedAt;
        private Instant finishedAt;
        private long seq;
        private boolean cancelRequested;
        private String error;
        private JobResult result;

        private JobRecord(UUID id, String videoKey, JobConfig config, Instant createdAt) {
            this.id = id;
            this.videoKey = videoKey;
            this.config = config;
            this.createdAt = createdAt;
        }

        private JobSnapshot snapshot() {
            return new JobSnapshot(id, videoKey, config, state, counters, createdAt, startedAt, finishedAt,
                    seq, cancelRequested, error, result);
        }
    }
}
