package com.example.vrudetect_backend.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Detection job lifecycle. FAILED is reachable straight from RUNNING only when the source cannot be opened.
 */
public enum JobState {
    QUEUED,
    RUNNING,
    FINALIZING,
    COMPLETED,
    TIMED_OUT,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobState next) {
        return allowedNext().contains(next);
    }

    private Set<JobState> allowedNext() {
        return switch (this) {
            case QUEUED -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(FINALIZING, FAILED);
            case FINALIZING -> EnumSet.of(COMPLETED, TIMED_OUT, FAILED, CANCELLED);
            default -> EnumSet.noneOf(JobState.class);
        };
    }
}
