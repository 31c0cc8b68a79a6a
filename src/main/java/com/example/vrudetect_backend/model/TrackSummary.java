package com.example.vrudetect_backend.model;

import java.util.List;

/**
 * Immutable view of a closed track as reported in a {@link JobResult}.
 */
public record TrackSummary(String trackId,
                           String classLabel,
                           int firstSeenFrame,
                           int lastSeenFrame,
                           double smoothedConfidence,
                           List<TrackObservation> history) {

    public TrackSummary {
        history = history == null ? List.of() : List.copyOf(history);
    }
}
