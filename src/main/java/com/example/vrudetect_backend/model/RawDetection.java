package com.example.vrudetect_backend.model;

/**
 * Single detector output for one frame. Consumed by the correlator, never persisted on its own.
 */
public record RawDetection(String classLabel, double confidence, BoundingBox box) {
}
