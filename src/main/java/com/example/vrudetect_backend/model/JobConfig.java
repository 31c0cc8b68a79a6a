package com.example.vrudetect_backend.model;

import java.util.Set;

/**
 * Effective, validated configuration of one detection job.
 *
 * @param sampleStride        frame stride, or {@code null} when {@code maxFrames} drives sampling.
 * @param maxFrames           upper bound on sampled frames, or {@code null} in stride mode.
 * @param perFrameTimeoutMs   budget for a single detector invocation.
 * @param totalTimeoutMs      budget for the whole job, takes precedence over frame budgets.
 * @param confidenceThreshold minimum detector confidence to accept.
 * @param targetClasses       classes to keep; empty keeps every class.
 * @param maxConcurrency      frames of this job in flight at once.
 * @param fallbackEnabled     substitute synthetic detections when nothing is found.
 */
public record JobConfig(Integer sampleStride,
                        Integer maxFrames,
                        long perFrameTimeoutMs,
                        long totalTimeoutMs,
                        double confidenceThreshold,
                        Set<String> targetClasses,
                        int maxConcurrency,
                        boolean fallbackEnabled) {

    public JobConfig {
        targetClasses = targetClasses == null ? Set.of() : Set.copyOf(targetClasses);
    }

    public boolean acceptsClass(String classLabel) {
        return targetClasses.isEmpty() || targetClasses.contains(classLabel);
    }
}
