package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.dto.web.SubmitDetectionRequest;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.model.JobSnapshot;
import com.example.vrudetect_backend.model.JobState;
import com.example.vrudetect_backend.model.ProgressEvent;
import com.example.vrudetect_backend.model.SubmitOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Entry point for detection jobs: validates submissions, hands new jobs to a supervisor thread and answers
 * status, progress, cancel and result queries from the task registry.
 */
@Service
public class DetectionJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectionJobService.class);

    private final JobConfigValidator validator;
    private final TaskRegistry registry;
    private final JobSupervisorFactory supervisors;
    private final Executor supervisorExecutor;
    private final PipelineProperties props;
    private final Clock clock;

    public DetectionJobService(JobConfigValidator validator,
                               TaskRegistry registry,
                               JobSupervisorFactory supervisors,
                               @Qualifier("supervisorTaskExecutor") Executor supervisorExecutor,
                               PipelineProperties props,
                               Clock clock) {
        this.validator = validator;
        this.registry = registry;
        this.supervisors = supervisors;
        this.supervisorExecutor = supervisorExecutor;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Submits a job, or returns the active job for the same video.
     *
     * @throws com.example.vrudetect_backend.exception.ConfigException when the request is invalid.
     * @throws IllegalStateException when no supervisor slot is available.
     */
    public SubmitOutcome submit(SubmitDetectionRequest request) {
        JobConfig config = validator.resolve(request);
        String videoKey = request.videoKey().trim();
        SubmitOutcome outcome = registry.submit(videoKey, config).join();
        if (!outcome.created()) {
            return outcome;
        }
        try {
            supervisorExecutor.execute(supervisors.create(outcome.jobId(), videoKey, config));
        } catch (TaskRejectedException e) {
            registry.discard(outcome.jobId()).join();
            LOGGER.warn("JOB REJECTED supervisor pool saturated jobId={} videoKey={}", outcome.jobId(), videoKey);
            throw new IllegalStateException("SUPERVISOR_POOL_SATURATED", e);
        }
        return outcome;
    }

    public Optional<JobSnapshot> status(UUID jobId) {
        return registry.status(jobId).join();
    }

    public Optional<JobState> cancel(UUID jobId) {
        return registry.requestCancel(jobId).join();
    }

    public Optional<Flux<ProgressEvent>> progress(UUID jobId, long afterSeq) {
        return registry.progress(jobId, Math.max(0L, afterSeq)).join();
    }

    @Scheduled(fixedDelayString = "${detection.job.retention-sweep-ms:60000}")
    public void evictExpiredResults() {
        var cutoff = clock.instant().minus(Duration.ofMinutes(Math.max(0, props.getResultRetentionMinutes())));
        int evicted = registry.evictTerminalBefore(cutoff).join();
        if (evicted > 0) {
            LOGGER.info("RETENTION evicted={} cutoff={}", evicted, cutoff);
        }
    }
}
