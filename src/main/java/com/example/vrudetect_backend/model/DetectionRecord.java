package com.example.vrudetect_backend.model;

/**
 * Accepted detection as reported in a {@link JobResult}, linked to the track that absorbed it.
 */
public record DetectionRecord(int frameIndex,
                              long timestampMs,
                              String classLabel,
                              double confidence,
                              BoundingBox box,
                              String trackId,
                              boolean synthetic) {
}
