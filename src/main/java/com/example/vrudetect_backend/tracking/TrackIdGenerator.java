package com.example.vrudetect_backend.tracking;

/**
 * Hands out class-prefixed track ids from one monotonically increasing sequence shared by all classes.
 * One generator per job, so ids are unique within a job and identical across reruns of the same input.
 */
public final class TrackIdGenerator {
    private final String prefix;
    private long next = 1;

    public TrackIdGenerator(String prefix) {
        this.prefix = prefix == null || prefix.isBlank() ? "" : prefix + "-";
    }

    public Issued next(String classLabel) {
        long seq = next++;
        return new Issued(prefix + classLabel + "-" + seq, seq);
    }

    public record Issued(String trackId, long sequence) {
    }
}
