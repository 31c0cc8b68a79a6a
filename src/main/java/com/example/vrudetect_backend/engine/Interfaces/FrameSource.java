package com.example.vrudetect_backend.engine.Interfaces;

import com.example.vrudetect_backend.exception.FrameReadException;
import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.FrameImage;

/**
 * Random-access view of an opened video. Implementations must allow concurrent {@link #getFrame} calls.
 */
public interface FrameSource extends AutoCloseable {

    int frameCount();

    double fps();

    /**
     * Decodes a single frame.
     *
     * @throws FrameReadException when the frame cannot be read; the job continues without it.
     */
    FrameImage getFrame(Frame frame);

    @Override
    default void close() {
    }
}
