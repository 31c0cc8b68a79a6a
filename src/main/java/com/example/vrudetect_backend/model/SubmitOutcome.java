package com.example.vrudetect_backend.model;

import java.util.UUID;

/**
 * Answer to a submission. {@code created} is {@code false} when an active job for the same video was returned.
 */
public record SubmitOutcome(UUID jobId, boolean created, JobState state) {
}
