package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.model.ConfidenceHistogram;
import com.example.vrudetect_backend.model.DetectionRecord;
import com.example.vrudetect_backend.model.JobCounters;
import com.example.vrudetect_backend.model.JobResult;
import com.example.vrudetect_backend.model.JobState;
import com.example.vrudetect_backend.model.ResultSource;
import com.example.vrudetect_backend.model.TrackSummary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Assembles the immutable {@link JobResult} from tracks, accepted detections and final counters.
 */
@Component
public class ResultAggregator {

    public JobResult aggregate(Input in) {
        Map<String, Integer> classCounts = new TreeMap<>();
        for (TrackSummary track : in.tracks()) {
            classCounts.merge(track.classLabel(), 1, Integer::sum);
        }
        ConfidenceHistogram histogram = ConfidenceHistogram.empty();
        for (DetectionRecord d : in.detections()) {
            histogram = histogram.add(d.confidence());
        }
        JobCounters c = in.counters();
        boolean degraded = in.state() == JobState.TIMED_OUT
                || in.state() == JobState.CANCELLED
                || c.framesSkipped() + c.framesFailed() > 0;

        return new JobResult(in.jobId(), in.videoKey(), in.state(), in.tracks(), in.detections(), classCounts,
                histogram, c.framesTotal(), c.framesDispatched(), c.framesProcessed(), c.framesSkipped(),
                c.framesFailed(), degraded, in.source(), in.elapsedMs(), in.detectorId(), in.error(), in.finishedAt());
    }

    /**
     * Everything known about a job at finalization.
     */
    public record Input(UUID jobId,
                        String videoKey,
                        JobState state,
                        List<TrackSummary> tracks,
                        List<DetectionRecord> detections,
                        JobCounters counters,
                        ResultSource source,
                        long elapsedMs,
                        String detectorId,
                        String error,
                        Instant finishedAt) {

        public Input {
            tracks = tracks == null ? List.of() : tracks;
            detections = detections == null ? List.of() : detections;
            counters = counters == null ? JobCounters.empty() : counters;
        }
    }
}
