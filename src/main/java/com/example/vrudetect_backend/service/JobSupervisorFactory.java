package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.engine.Interfaces.FrameSourceFactory;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.tracking.CorrelatorSettings;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Wires the shared pipeline collaborators into one {@link JobSupervisor} per job.
 */
@Component
public class JobSupervisorFactory {
    private final TaskRegistry registry;
    private final FrameSourceFactory sources;
    private final InferenceExecutor inference;
    private final DetectionFilter filter;
    private final ResultAggregator aggregator;
    private final SyntheticFallback fallback;
    private final PipelineProperties props;
    private final Clock clock;

    public JobSupervisorFactory(TaskRegistry registry,
                                FrameSourceFactory sources,
                                InferenceExecutor inference,
                                DetectionFilter filter,
                                ResultAggregator aggregator,
                                SyntheticFallback fallback,
                                PipelineProperties props,
                                Clock clock) {
        this.registry = registry;
        this.sources = sources;
        this.inference = inference;
        this.filter = filter;
        this.aggregator = aggregator;
        this.fallback = fallback;
        this.props = props;
        this.clock = clock;
    }

    public JobSupervisor create(UUID jobId, String videoKey, JobConfig config) {
        var settings = new CorrelatorSettings(props.getMinIou(), props.getMaxGap(), props.getEmaAlpha(), null);
        return new JobSupervisor(jobId, videoKey, config, registry, sources, inference, filter, aggregator,
                fallback, settings, Math.max(0, props.getGracePeriodMs()), clock);
    }
}
