package com.example.vrudetect_backend.model;

/**
 * One matched detection in a track's history.
 */
public record TrackObservation(int frameIndex, long timestampMs, BoundingBox box, double confidence) {
}
