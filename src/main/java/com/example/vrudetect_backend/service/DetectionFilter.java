package com.example.vrudetect_backend.service;

import com.example.vrudetect_backend.config.PipelineProperties;
import com.example.vrudetect_backend.model.JobConfig;
import com.example.vrudetect_backend.model.RawDetection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-frame cleanup of raw detector output before correlation: confidence floors, class filter and per-class
 * non-maximum suppression. Surviving detections keep their detector order.
 */
@Component
public class DetectionFilter {
    private final PipelineProperties props;

    public DetectionFilter(PipelineProperties props) {
        this.props = props;
    }

    public List<RawDetection> apply(List<RawDetection> detections, JobConfig config) {
        if (detections == null || detections.isEmpty()) {
            return List.of();
        }
        Map<String, Double> classMin = props.getClassMinConfidence() == null ? Map.of() : props.getClassMinConfidence();

        Map<String, List<Integer>> byClass = new LinkedHashMap<>();
        for (int i = 0; i < detections.size(); i++) {
            RawDetection d = detections.get(i);
            if (d == null || d.confidence() < config.confidenceThreshold() || !config.acceptsClass(d.classLabel())) {
                continue;
            }
            Double floor = classMin.get(d.classLabel());
            if (floor != null && d.confidence() < floor) {
                continue;
            }
            byClass.computeIfAbsent(d.classLabel(), k -> new ArrayList<>()).add(i);
        }

        boolean[] keep = new boolean[detections.size()];
        for (List<Integer> positions : byClass.values()) {
            for (int i : suppress(detections, positions)) {
                keep[i] = true;
            }
        }
        List<RawDetection> out = new ArrayList<>();
        for (int i = 0; i < detections.size(); i++) {
            if (keep[i]) {
                out.add(detections.get(i));
            }
        }
        return out;
    }

    private List<Integer> suppress(List<RawDetection> detections, List<Integer> positions) {
        List<Integer> order = new ArrayList<>(positions);
        // stable sort keeps detector order for equal confidence
        order.sort(Comparator.comparingDouble((Integer i) -> detections.get(i).confidence()).reversed());
        List<Integer> kept = new ArrayList<>();
        for (int candidate : order) {
            boolean overlaps = false;
            for (int k : kept) {
                if (detections.get(candidate).box().iou(detections.get(k).box()) > props.getNmsIou()) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
