package com.example.vrudetect_backend.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Final, immutable report of a detection job. Produced exactly once per job, for every terminal state.
 */
public record JobResult(UUID jobId,
                        String videoKey,
                        JobState state,
                        List<TrackSummary> tracks,
                        List<DetectionRecord> detections,
                        Map<String, Integer> classCounts,
                        ConfidenceHistogram confidenceHistogram,
                        int framesTotal,
                        int framesDispatched,
                        int framesProcessed,
                        int framesSkipped,
                        int framesFailed,
                        boolean degraded,
                        ResultSource source,
                        long elapsedMs,
                        String detectorId,
                        String error,
                        Instant finishedAt) {

    public JobResult {
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        detections = detections == null ? List.of() : List.copyOf(detections);
        classCounts = classCounts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classCounts));
        confidenceHistogram = confidenceHistogram == null ? ConfidenceHistogram.empty() : confidenceHistogram;
    }
}
