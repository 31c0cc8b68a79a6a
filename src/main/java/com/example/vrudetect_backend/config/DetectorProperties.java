package com.example.vrudetect_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "detector")
public class DetectorProperties {
    /** {@code http} for the inference sidecar, {@code synthetic} for placeholder detections. */
    private String mode = "http";
    private String baseUrl = "http://127.0.0.1:8001";
    private String model = "yolov8n";
    private long timeoutSeconds = 20;
    // COCO labels from the sidecar mapped onto VRU classes
    private Map<String, String> labelMap = new LinkedHashMap<>(Map.of(
            "person", "pedestrian",
            "bicycle", "cyclist",
            "motorcycle", "motorcyclist"
    ));

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public Map<String, String> getLabelMap() {
        return labelMap;
    }

    public void setLabelMap(Map<String, String> labelMap) {
        this.labelMap = labelMap;
    }
}
