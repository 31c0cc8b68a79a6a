package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.FrameOutcome;

import reactor.core.Disposable;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a frame handed to the {@link InferenceExecutor}. The outcome future settles exactly once.
 */
public final class InFlightFrame {
    private final Frame frame;
    private final long startedNanos;
    private final CompletableFuture<FrameOutcome> outcome = new CompletableFuture<>();
    private volatile Disposable subscription;
    private volatile int attempts;

    InFlightFrame(Frame frame, long startedNanos) {
        this.frame = frame;
        this.startedNanos = startedNanos;
    }

    public Frame frame() {
        return frame;
    }

    public CompletableFuture<FrameOutcome> outcome() {
        return outcome;
    }

    public boolean isSettled() {
        return outcome.isDone();
    }

    /**
     * Settles the frame as SKIPPED unless it already settled. The detection pipeline is disposed, which cancels a
     * running attempt and any pending retry; a result that still arrives is discarded.
     *
     * @return {@code true} when this call settled the frame.
     */
    public boolean abandon(String reason) {
        boolean settled = outcome.complete(FrameOutcome.skipped(frame, attempts, elapsedMs(), reason));
        Disposable current = subscription;
        if (settled && current != null) {
            current.dispose();
        }
        return settled;
    }

    boolean settle(FrameOutcome result) {
        return outcome.complete(result);
    }

    void bind(Disposable subscription) {
        this.subscription = subscription;
        if (outcome.isDone()) {
            subscription.dispose();
        }
    }

    void beginAttempt(int number) {
        this.attempts = number;
    }

    long elapsedMs() {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
