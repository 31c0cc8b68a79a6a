package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.model.BoundingBox;
import com.example.vrudetect_backend.model.DetectionRecord;
import com.example.vrudetect_backend.model.JobCounters;
import com.example.vrudetect_backend.model.JobResult;
import com.example.vrudetect_backend.model.JobState;
import com.example.vrudetect_backend.model.ResultSource;
import com.example.vrudetect_backend.model.TrackSummary;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();
    private static final BoundingBox BOX = new BoundingBox(0, 0, 10, 10);

    private static TrackSummary track(String id, String cls) {
        return new TrackSummary(id, cls, 0, 0, 0.9, List.of());
    }

    private static DetectionRecord detection(String cls, double conf, String trackId) {
        return new DetectionRecord(0, 0, cls, conf, BOX, trackId, false);
    }

    private JobResult aggregate(JobState state, JobCounters counters, List<TrackSummary> tracks, List<DetectionRecord> dets) {
        return aggregator.aggregate(new ResultAggregator.Input(UUID.randomUUID(), "videos/a.mp4", state, tracks, dets,
                counters, ResultSource.REAL, 1234, "http:yolov8n", null, Instant.EPOCH));
    }

    @Test
    void countsTracksPerClassSortedByClass() {
        var result = aggregate(JobState.COMPLETED, new JobCounters(3, 3, 3, 0, 0, 3),
                List.of(track("pedestrian-1", "pedestrian"), track("cyclist-2", "cyclist"), track("pedestrian-3", "pedestrian")),
                List.of(detection("pedestrian", 0.9, "pedestrian-1"), detection("cyclist", 0.6, "cyclist-2"),
                        detection("pedestrian", 0.3, "pedestrian-3")));

        assertThat(result.classCounts()).containsExactly(
                entry("cyclist", 1),
                entry("pedestrian", 2));
        assertThat(result.confidenceHistogram().high()).isEqualTo(1);
        assertThat(result.confidenceHistogram().medium()).isEqualTo(1);
        assertThat(result.confidenceHistogram().low()).isEqualTo(1);
        assertThat(result.degraded()).isFalse();
        assertThat(result.framesProcessed()).isEqualTo(3);
    }

    @Test
    void skippedFramesMarkResultDegraded() {
        var result = aggregate(JobState.COMPLETED, new JobCounters(13, 13, 11, 2, 0, 0), List.of(), List.of());

        assertThat(result.degraded()).isTrue();
        assertThat(result.framesSkipped()).isEqualTo(2);
    }

    @Test
    void timeoutAndCancelAreDegraded() {
        assertThat(aggregate(JobState.TIMED_OUT, JobCounters.empty(), List.of(), List.of()).degraded()).isTrue();
        assertThat(aggregate(JobState.CANCELLED, JobCounters.empty(), List.of(), List.of()).degraded()).isTrue();
    }

    @Test
    void emptyResultIsStructurallyValid() {
        var result = aggregate(JobState.FAILED, JobCounters.empty(), null, null);

        assertThat(result.tracks()).isEmpty();
        assertThat(result.detections()).isEmpty();
        assertThat(result.classCounts()).isEmpty();
        assertThat(result.confidenceHistogram().total()).isZero();
    }
}
