package com.example.vrudetect_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record SubmitDetectionRequest(
        @NotBlank @Size(max = 512) String videoKey,
        Integer sampleStride,
        Integer maxFrames,
        Long perFrameTimeoutMs,
        Long totalTimeoutMs,
        Double confidenceThreshold,
        List<String> targetClasses,
        Integer maxConcurrency,
        Boolean fallbackEnabled
) {}
