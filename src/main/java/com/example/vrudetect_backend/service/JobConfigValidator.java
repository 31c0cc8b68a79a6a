package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.dto.web.SubmitDetectionRequest;
import com.example.vrudetect_backend.exception.ConfigException;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.sampler.FrameSampler;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a submission into an effective {@link JobConfig}: omitted fields take configured defaults and invalid
 * values are rejected with a {@link ConfigException} before a job is created.
 */
@Component
public class JobConfigValidator {
    private final PipelineProperties props;

    public JobConfigValidator(PipelineProperties props) {
        this.props = props;
    }

    public JobConfig resolve(SubmitDetectionRequest req) {
        if (req == null || req.videoKey() == null || req.videoKey().isBlank()) {
            throw new ConfigException("videoKey is required");
        }
        if (req.sampleStride() != null && req.maxFrames() != null) {
            throw new ConfigException("sampleStride and maxFrames are mutually exclusive");
        }
        Integer stride = req.sampleStride();
        Integer maxFrames = req.maxFrames();
        if (maxFrames != null) {
            FrameSampler.validateMaxSamples(maxFrames);
        } else {
            stride = stride != null ? stride : props.getDefaultStride();
            FrameSampler.validateStride(stride);
        }

        long perFrame = req.perFrameTimeoutMs() != null ? req.perFrameTimeoutMs() : props.getPerFrameTimeoutMs();
        if (perFrame <= 0) {
            throw new ConfigException("perFrameTimeoutMs must be > 0 (got " + perFrame + ")");
        }
        long total = req.totalTimeoutMs() != null ? req.totalTimeoutMs() : props.getTotalTimeoutMs();
        if (total <= 0) {
            throw new ConfigException("totalTimeoutMs must be > 0 (got " + total + ")");
        }

        double threshold = req.confidenceThreshold() != null ? req.confidenceThreshold() : props.getConfidenceThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ConfigException("confidenceThreshold must be within [0, 1] (got " + threshold + ")");
        }

        int concurrency = req.maxConcurrency() != null ? req.maxConcurrency() : props.getMaxConcurrency();
        if (concurrency < 1 || concurrency > props.getMaxConcurrencyLimit()) {
            throw new ConfigException("maxConcurrency must be within [1, " + props.getMaxConcurrencyLimit()
                    + "] (got " + concurrency + ")");
        }

        Set<String> classes = new LinkedHashSet<>();
        if (req.targetClasses() != null) {
            for (String c : req.targetClasses()) {
                if (c != null && !c.isBlank()) {
                    classes.add(c.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        boolean fallback = req.fallbackEnabled() != null ? req.fallbackEnabled() : props.isFallbackEnabled();
        return new JobConfig(maxFrames != null ? null : stride, maxFrames, perFrame, total, threshold, classes,
                concurrency, fallback);
    }
}
