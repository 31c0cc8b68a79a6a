package com.example.vrudetect_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body returned by the inference sidecar for {@code POST /v1/detect}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetectorResponse(
        @JsonProperty("model") String model,
        @JsonProperty("detections") List<Item> detections,
        @JsonProperty("inference_ms") Double inferenceMs
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            @JsonProperty("label") String label,
            @JsonProperty("confidence") Double confidence,
            @JsonProperty("bbox") Box bbox
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Box(
            @JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("width") double width,
            @JsonProperty("height") double height
    ) {}
}
