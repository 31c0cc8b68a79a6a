package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.model.BoundingBox;
import com.example.vrudetect_backend.model.DetectionRecord;
import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.TrackObservation;
import com.example.vrudetect_backend.model.TrackSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Placeholder detections for jobs that found nothing. Every record is flagged synthetic and sits on its own
 * {@code synthetic-} track so it can never be mistaken for model output.
 * <p>
 * Records are only placed on frames the detector actually processed: the i-th record lands on the first processed
 * frame at or after index {@code (i + 1) * 30}, or on the last processed frame when none is that late.
 */
@Component
public class SyntheticFallback {
    static final String TRACK_PREFIX = "synthetic-";
    static final String CLASS_LABEL = "pedestrian";

    private final PipelineProperties props;

    public SyntheticFallback(PipelineProperties props) {
        this.props = props;
    }

    public Fallback generate(List<Frame> processedFrames) {
        if (processedFrames.isEmpty()) {
            return new Fallback(List.of(), List.of());
        }
        int count = Math.max(1, props.getSyntheticCount());
        List<DetectionRecord> detections = new ArrayList<>(count);
        List<TrackSummary> tracks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Frame frame = placement(processedFrames, (i + 1) * 30);
            double confidence = 0.75 + i * 0.05;
            var box = new BoundingBox(100 + i * 50, 50 + i * 25, 80 + i * 10, 150 + i * 20);
            String trackId = TRACK_PREFIX + CLASS_LABEL + "-" + (i + 1);

            detections.add(new DetectionRecord(frame.index(), frame.timestampMs(), CLASS_LABEL, confidence, box, trackId, true));
            tracks.add(new TrackSummary(trackId, CLASS_LABEL, frame.index(), frame.index(), confidence,
                    List.of(new TrackObservation(frame.index(), frame.timestampMs(), box, confidence))));
        }
        return new Fallback(tracks, detections);
    }

    private static Frame placement(List<Frame> processedFrames, int targetIndex) {
        for (Frame frame : processedFrames) {
            if (frame.index() >= targetIndex) {
                return frame;
            }
        }
        return processedFrames.get(processedFrames.size() - 1);
    }

    public record Fallback(List<TrackSummary> tracks, List<DetectionRecord> detections) {
    }
}
