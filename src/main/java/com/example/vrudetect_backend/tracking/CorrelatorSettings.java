package com.example.vrudetect_backend.tracking;

/**
 * Tuning of the {@link TrackCorrelator}.
 *
 * @param minIou    minimum IoU for a detection to continue a track.
 * @param maxGap    consecutive sampled frames a track may go unmatched before it is closed.
 * @param emaAlpha  weight of the newest detection in the smoothed confidence.
 * @param idPrefix  optional prefix prepended to every track id, e.g. {@code synthetic}.
 */
public record CorrelatorSettings(double minIou, int maxGap, double emaAlpha, String idPrefix) {

    public static CorrelatorSettings defaults() {
        return new CorrelatorSettings(0.3, 3, 0.5, null);
    }
}
