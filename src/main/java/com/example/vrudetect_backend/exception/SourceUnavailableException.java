package com.example.vrudetect_backend.exception;

/**
 * The video behind a key cannot be opened at all. Fatal for the job.
 */
public class SourceUnavailableException extends RuntimeException {
    private final String videoKey;

    public SourceUnavailableException(String videoKey, String message) {
        super(message);
        this.videoKey = videoKey;
    }

    public SourceUnavailableException(String videoKey, String message, Throwable cause) {
        super(message, cause);
        this.videoKey = videoKey;
    }

    public String getVideoKey() {
        return videoKey;
    }
}
