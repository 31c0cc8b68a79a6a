package com.example.vrudetect_backend.exception;

/**
 * The frame source could not decode the frame at a given index.
 */
public class FrameReadException extends RuntimeException {
    private final int frameIndex;

    public FrameReadException(int frameIndex, String message) {
        super(message);
        this.frameIndex = frameIndex;
    }

    public FrameReadException(int frameIndex, String message, Throwable cause) {
        super(message, cause);
        this.frameIndex = frameIndex;
    }

    public int getFrameIndex() {
        return frameIndex;
    }
}
