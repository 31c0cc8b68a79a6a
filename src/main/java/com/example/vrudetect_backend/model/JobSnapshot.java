package com.example.vrudetect_backend.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time copy of a job as held by the task registry.
 *
 * @param result final report, {@code null} until the job is terminal.
 * @param lastSeq seq of the most recent progress event.
 */
public record JobSnapshot(UUID jobId,
                          String videoKey,
                          JobConfig config,
                          JobState state,
                          JobCounters counters,
                          Instant createdAt,
                          Instant startedAt,
                          Instant finishedAt,
                          long lastSeq,
                          boolean cancelRequested,
                          String error,
                          JobResult result) {

    public long elapsedMs(Instant now) {
        Instant from = startedAt != null ? startedAt : createdAt;
        Instant to = finishedAt != null ? finishedAt : now;
        return Math.max(0L, to.toEpochMilli() - from.toEpochMilli());
    }
}
