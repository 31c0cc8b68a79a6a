package com.example.vrudetect_backend.exception;

/**
 * The detection capability raised while processing a frame.
 */
public class InferenceException extends RuntimeException {
    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
