package com.example.vrudetect_backend.model;

/**
 * Decoded frame handed to a detection engine.
 *
 * @param frame  sampled frame position.
 * @param data   encoded image bytes (PNG for the ffmpeg source).
 * @param width  image width in pixels.
 * @param height image height in pixels.
 */
public record FrameImage(Frame frame, byte[] data, int width, int height) {

    public int index() {
        return frame.index();
    }
}
