package com.example.vrudetect_backend.model;

import java.util.List;

/**
 * Settled result of one dispatched frame.
 *
 * @param frame      frame the outcome belongs to.
 * @param status     accounting bucket.
 * @param detections accepted detections; empty unless {@code PROCESSED}.
 * @param attempts   detector invocations made.
 * @param latencyMs  wall time from dispatch to settlement.
 * @param reason     short reason code for skipped or failed frames.
 */
public record FrameOutcome(Frame frame,
                           FrameStatus status,
                           List<RawDetection> detections,
                           int attempts,
                           long latencyMs,
                           String reason) {

    public FrameOutcome {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }

    public static FrameOutcome processed(Frame frame, List<RawDetection> detections, int attempts, long latencyMs) {
        return new FrameOutcome(frame, FrameStatus.PROCESSED, detections, attempts, latencyMs, null);
    }

    public static FrameOutcome skipped(Frame frame, int attempts, long latencyMs, String reason) {
        return new FrameOutcome(frame, FrameStatus.SKIPPED, List.of(), attempts, latencyMs, reason);
    }

    public static FrameOutcome failed(Frame frame, int attempts, long latencyMs, String reason) {
        return new FrameOutcome(frame, FrameStatus.FAILED, List.of(), attempts, latencyMs, reason);
    }

    public FrameOutcome withDetections(List<RawDetection> filtered) {
        return new FrameOutcome(frame, status, filtered, attempts, latencyMs, reason);
    }
}
