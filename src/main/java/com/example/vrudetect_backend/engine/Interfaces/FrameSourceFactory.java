package com.example.vrudetect_backend.engine.Interfaces;

import com.example.vrudetect_backend.exception.SourceUnavailableException;

public interface FrameSourceFactory {

    /**
     * Opens the video identified by {@code videoKey}.
     *
     * @throws SourceUnavailableException when the video cannot be opened at all.
     */
    FrameSource open(String videoKey);
}
