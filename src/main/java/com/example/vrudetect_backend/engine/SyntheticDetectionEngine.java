package com.example.vrudetect_backend.engine;

import com.example.vrudetect_backend.engine.Interfaces.DetectionEngine;
import com.example.vrudetect_backend.model.BoundingBox;
import com.example.vrudetect_backend.model.FrameImage;
import com.example.vrudetect_backend.model.RawDetection;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Placeholder detector for environments without a model. Output is seeded by frame index, so reruns are identical.
 */
public class SyntheticDetectionEngine implements DetectionEngine {
    static final List<String> CLASSES = List.of("pedestrian", "cyclist", "motorcyclist", "wheelchair_user", "scooter_rider");
    private static final int DEFAULT_WIDTH = 1280;
    private static final int DEFAULT_HEIGHT = 720;

    private final long seed;

    public SyntheticDetectionEngine(long seed) {
        this.seed = seed;
    }

    @Override
    public List<RawDetection> detect(FrameImage frame, double confidenceThreshold) {
        Random rnd = new Random(seed * 31 + frame.index());
        int width = frame.width() > 0 ? frame.width() : DEFAULT_WIDTH;
        int height = frame.height() > 0 ? frame.height() : DEFAULT_HEIGHT;

        int count = rnd.nextInt(4);
        List<RawDetection> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String label = CLASSES.get(rnd.nextInt(CLASSES.size()));
            double confidence = 0.5 + rnd.nextDouble() * 0.45;
            double x = rnd.nextDouble() * width * 0.8;
            double y = rnd.nextDouble() * height * 0.8;
            double w = width * (0.1 + rnd.nextDouble() * 0.2);
            double h = height * (0.1 + rnd.nextDouble() * 0.2);
            if (confidence >= confidenceThreshold) {
                out.add(new RawDetection(label, confidence, new BoundingBox(x, y, w, h)));
            }
        }
        return out;
    }

    @Override
    public String id() {
        return "synthetic";
    }

    @Override
    public boolean synthetic() {
        return true;
    }
}
