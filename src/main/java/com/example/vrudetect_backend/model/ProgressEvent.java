package com.example.vrudetect_backend.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable progress notification. {@code seq} starts at 1 and increases by one per job.
 */
public record ProgressEvent(UUID jobId,
                            long seq,
                            JobState state,
                            JobCounters counters,
                            Instant timestamp,
                            String message) {
}
