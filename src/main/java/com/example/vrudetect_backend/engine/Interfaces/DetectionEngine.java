package com.example.vrudetect_backend.engine.Interfaces;

import com.example.vrudetect_backend.model.FrameImage;
import com.example.vrudetect_backend.model.RawDetection;

import java.util.List;

/**
 * Pluggable detection capability invoked once per sampled frame.
 */
public interface DetectionEngine {

    /**
     * Runs detection on one frame.
     *
     * @param frame               decoded frame.
     * @param confidenceThreshold minimum confidence the caller is interested in.
     * @return detections in detector order; never {@code null}.
     * @throws Exception when the detector fails; the caller retries.
     */
    List<RawDetection> detect(FrameImage frame, double confidenceThreshold) throws Exception;

    /** Identifier reported in job results, e.g. {@code http:yolov8n}. */
    String id();

    /**
     * Whether an in-flight {@link #detect} call reacts to thread interruption. When {@code false} a timed-out call
     * is abandoned and its late result discarded.
     */
    default boolean supportsCancellation() {
        return false;
    }

    /** Whether this engine produces placeholder output rather than real model inference. */
    default boolean synthetic() {
        return false;
    }
}
