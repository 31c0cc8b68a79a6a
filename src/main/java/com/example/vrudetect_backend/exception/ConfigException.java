package com.example.vrudetect_backend.exception;

/**
 * Invalid submission parameters. Raised before a job is registered, so nothing is ever partially processed.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
