package com.example.vrudetect_backend.exception;

public class InferenceTimeoutException extends RuntimeException {
    public InferenceTimeoutException(int frameIndex, long timeoutMs) {
        super("Inference for frame " + frameIndex + " exceeded " + timeoutMs + "ms");
    }
}
