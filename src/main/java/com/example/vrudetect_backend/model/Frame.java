package com.example.vrudetect_backend.model;

/**
 * Sampled frame position.
 *
 * @param index       zero-based frame index in the source video.
 * @param timestampMs presentation time derived from the source fps.
 */
public record Frame(int index, long timestampMs) {
}
