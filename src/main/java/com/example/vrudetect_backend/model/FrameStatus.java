package com.example.vrudetect_backend.model;

/**
 * Accounting bucket of a dispatched frame.
 */
public enum FrameStatus {
    /** Detector returned in time; detections (possibly none) were accepted. */
    PROCESSED,
    /** Inference timed out, the frame could not be read, or it was abandoned at job end. */
    SKIPPED,
    /** Detector raised on every attempt. */
    FAILED
}
