package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.model.BoundingBox;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.model.RawDetection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionFilterTest {

    private PipelineProperties props;
    private DetectionFilter filter;

    @BeforeEach
    void setUp() {
        props = new PipelineProperties();
        filter = new DetectionFilter(props);
    }

    private static JobConfig config(double threshold, Set<String> classes) {
        return new JobConfig(5, null, 1000, 10_000, threshold, classes, 2, true);
    }

    private static RawDetection det(String cls, double conf, double x) {
        return new RawDetection(cls, conf, new BoundingBox(x, 0, 100, 100));
    }

    @Test
    void dropsDetectionsBelowThreshold() {
        var out = filter.apply(List.of(det("pedestrian", 0.4, 0), det("cyclist", 0.6, 500)), config(0.5, Set.of()));

        assertThat(out).extracting(RawDetection::classLabel).containsExactly("cyclist");
    }

    @Test
    void keepsOnlyTargetClasses() {
        var out = filter.apply(List.of(det("pedestrian", 0.9, 0), det("cyclist", 0.9, 500)),
                config(0.5, Set.of("cyclist")));

        assertThat(out).extracting(RawDetection::classLabel).containsExactly("cyclist");
    }

    @Test
    void appliesPerClassMinimum() {
        props.setClassMinConfidence(Map.of("scooter_rider", 0.8));

        var out = filter.apply(List.of(det("scooter_rider", 0.7, 0), det("pedestrian", 0.7, 500)),
                config(0.5, Set.of()));

        assertThat(out).extracting(RawDetection::classLabel).containsExactly("pedestrian");
    }

    @Test
    void suppressesOverlappingBoxesOfSameClass() {
        var weak = det("pedestrian", 0.6, 10);
        var strong = det("pedestrian", 0.9, 0);
        var other = det("cyclist", 0.7, 5);

        var out = filter.apply(List.of(weak, strong, other), config(0.5, Set.of()));

        assertThat(out).containsExactly(strong, other);
    }

    @Test
    void keepsSeparatedBoxesInDetectorOrder() {
        var a = det("pedestrian", 0.6, 0);
        var b = det("pedestrian", 0.9, 400);

        assertThat(filter.apply(List.of(a, b), config(0.5, Set.of()))).containsExactly(a, b);
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        assertThat(filter.apply(List.of(), config(0.5, Set.of()))).isEmpty();
        assertThat(filter.apply(null, config(0.5, Set.of()))).isEmpty();
    }
}
