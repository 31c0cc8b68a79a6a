package com.example.vrudetect_backend.tracking;

import com.example.vrudetect_backend.model.BoundingBox;
import com.example.vrudetect_backend.model.TrackObservation;
import com.example.vrudetect_backend.model.TrackSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Persistent object identity built by the {@link TrackCorrelator}. Mutable while open, frozen once closed.
 * Confined to the thread that owns the correlator.
 */
public final class Track {
    private final String trackId;
    private final long sequence;
    private final String classLabel;
    private final int firstSeenFrame;
    private final List<TrackObservation> history = new ArrayList<>();
    private int lastSeenFrame;
    private double smoothedConfidence;
    private int missedFrames;
    private boolean closed;

    Track(String trackId, long sequence, String classLabel, TrackObservation first) {
        this.trackId = trackId;
        this.sequence = sequence;
        this.classLabel = classLabel;
        this.firstSeenFrame = first.frameIndex();
        this.lastSeenFrame = first.frameIndex();
        this.smoothedConfidence = first.confidence();
        this.history.add(first);
    }

    void update(TrackObservation observation, double alpha) {
        ensureOpen();
        history.add(observation);
        smoothedConfidence = alpha * observation.confidence() + (1.0 - alpha) * smoothedConfidence;
        lastSeenFrame = observation.frameIndex();
        missedFrames = 0;
    }

    /**
     * Registers a correlated frame without a match.
     *
     * @return {@code true} when the gap now exceeds {@code maxGap} and the track was closed.
     */
    boolean miss(int maxGap) {
        ensureOpen();
        missedFrames++;
        if (missedFrames > maxGap) {
            closed = true;
        }
        return closed;
    }

    void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Track " + trackId + " is closed");
        }
    }

    public String getTrackId() {
        return trackId;
    }

    public long getSequence() {
        return sequence;
    }

    public String getClassLabel() {
        return classLabel;
    }

    public int getFirstSeenFrame() {
        return firstSeenFrame;
    }

    public int getLastSeenFrame() {
        return lastSeenFrame;
    }

    public double getSmoothedConfidence() {
        return smoothedConfidence;
    }

    public BoundingBox getLastBox() {
        return history.get(history.size() - 1).box();
    }

    public int getMissedFrames() {
        return missedFrames;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<TrackObservation> getHistory() {
        return List.copyOf(history);
    }

    public TrackSummary toSummary() {
        return new TrackSummary(trackId, classLabel, firstSeenFrame, lastSeenFrame, smoothedConfidence, history);
    }
}
