package com.example.vrudetect_backend.model;

/**
 * Detection counts per confidence bucket: high above 0.8, medium from 0.5 to 0.8, low below 0.5.
 */
public record ConfidenceHistogram(int high, int medium, int low) {

    public static ConfidenceHistogram empty() {
        return new ConfidenceHistogram(0, 0, 0);
    }

    public ConfidenceHistogram add(double confidence) {
        if (confidence > 0.8) {
            return new ConfidenceHistogram(high + 1, medium, low);
        }
        if (confidence >= 0.5) {
            return new ConfidenceHistogram(high, medium + 1, low);
        }
        return new ConfidenceHistogram(high, medium, low + 1);
    }

    public int total() {
        return high + medium + low;
    }
}
