package com.example.vrudetect_backend.tracking;

import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.RawDetection;
import com.example.vrudetect_backend.model.TrackObservation;
import com.example.vrudetect_backend.model.TrackSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Greedy IoU correlator that turns per-frame detections into persistent tracks.
 * <p>
 * Frames must arrive in strictly increasing index order. For each frame every (detection, open track) pair of the
 * same class with IoU at or above {@link CorrelatorSettings#minIou()} is a candidate; candidates are assigned
 * highest IoU first, ties broken by higher detection confidence, then smaller detection x, then older track,
 * then detection position. Leftover detections open new tracks; open tracks that stay unmatched for more than
 * {@link CorrelatorSettings#maxGap()} consecutive sampled frames are closed. Sampled frames that produced no
 * detector result must still be passed in, with no detections.
 * <p>
 * Not thread-safe: one instance belongs to one job supervisor.
 */
public final class TrackCorrelator {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrackCorrelator.class);

    private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
            .comparingDouble(Candidate::iou).reversed()
            .thenComparing(Comparator.comparingDouble(Candidate::confidence).reversed())
            .thenComparingDouble(Candidate::x)
            .thenComparingLong(Candidate::trackSequence)
            .thenComparingInt(Candidate::detectionPosition);

    private final CorrelatorSettings settings;
    private final TrackIdGenerator ids;
    private final List<Track> open = new ArrayList<>();
    private final List<Track> closed = new ArrayList<>();
    private int lastFrameIndex = -1;
    private boolean finished;

    public TrackCorrelator(CorrelatorSettings settings) {
        this.settings = settings == null ? CorrelatorSettings.defaults() : settings;
        this.ids = new TrackIdGenerator(this.settings.idPrefix());
    }

    /**
     * Correlates the detections of one frame.
     *
     * @param frame      frame the detections belong to; its index must exceed the previous one.
     * @param detections detections of that frame, in detector order.
     * @return one assignment per detection, in the same order.
     */
    public List<Assignment> correlate(Frame frame, List<RawDetection> detections) {
        Objects.requireNonNull(frame, "frame");
        if (finished) {
            throw new IllegalStateException("correlator already finished");
        }
        if (frame.index() <= lastFrameIndex) {
            throw new IllegalArgumentException("frames must be correlated in increasing index order: "
                    + frame.index() + " after " + lastFrameIndex);
        }
        lastFrameIndex = frame.index();
        List<RawDetection> input = detections == null ? List.of() : detections;

        List<Candidate> candidates = new ArrayList<>();
        for (int d = 0; d < input.size(); d++) {
            RawDetection det = input.get(d);
            for (Track track : open) {
                if (!track.getClassLabel().equals(det.classLabel())) {
                    continue;
                }
                double iou = det.box().iou(track.getLastBox());
                if (iou >= settings.minIou()) {
                    candidates.add(new Candidate(d, track, iou, det.confidence(), det.box().x(), track.getSequence()));
                }
            }
        }
        candidates.sort(CANDIDATE_ORDER);

        Track[] matchedTrack = new Track[input.size()];
        List<Track> matchedTracks = new ArrayList<>();
        for (Candidate c : candidates) {
            if (matchedTrack[c.detectionPosition()] != null || matchedTracks.contains(c.track())) {
                continue;
            }
            matchedTrack[c.detectionPosition()] = c.track();
            matchedTracks.add(c.track());
        }

        List<Assignment> assignments = new ArrayList<>(input.size());
        List<Track> spawned = new ArrayList<>();
        for (int d = 0; d < input.size(); d++) {
            RawDetection det = input.get(d);
            TrackObservation observation = new TrackObservation(frame.index(), frame.timestampMs(), det.box(), det.confidence());
            Track track = matchedTrack[d];
            if (track != null) {
                track.update(observation, settings.emaAlpha());
                assignments.add(new Assignment(det, track.getTrackId(), false));
            } else {
                TrackIdGenerator.Issued issued = ids.next(det.classLabel());
                Track created = new Track(issued.trackId(), issued.sequence(), det.classLabel(), observation);
                spawned.add(created);
                assignments.add(new Assignment(det, created.getTrackId(), true));
                LOGGER.trace("track open id={} frame={} conf={}", created.getTrackId(), frame.index(), det.confidence());
            }
        }

        Iterator<Track> it = open.iterator();
        while (it.hasNext()) {
            Track track = it.next();
            if (matchedTracks.contains(track)) {
                continue;
            }
            if (track.miss(settings.maxGap())) {
                it.remove();
                closed.add(track);
                LOGGER.trace("track closed id={} lastSeen={} frame={}", track.getTrackId(), track.getLastSeenFrame(), frame.index());
            }
        }
        open.addAll(spawned);
        return assignments;
    }

    /**
     * Closes every open track and returns all tracks ordered by first appearance, then creation order.
     */
    public List<TrackSummary> finish() {
        if (!finished) {
            for (Track track : open) {
                track.close();
                closed.add(track);
            }
            open.clear();
            finished = true;
        }
        return closed.stream()
                .sorted(Comparator.comparingInt(Track::getFirstSeenFrame).thenComparingLong(Track::getSequence))
                .map(Track::toSummary)
                .toList();
    }

    public List<Track> openTracks() {
        return List.copyOf(open);
    }

    public List<Track> closedTracks() {
        return List.copyOf(closed);
    }

    public int trackCount() {
        return open.size() + closed.size();
    }

    /**
     * Track a detection was attached to.
     *
     * @param detection the detection.
     * @param trackId   id of the matched or newly created track.
     * @param newTrack  whether the detection opened the track.
     */
    public record Assignment(RawDetection detection, String trackId, boolean newTrack) {
    }

    private record Candidate(int detectionPosition, Track track, double iou, double confidence, double x, long trackSequence) {
    }
}
