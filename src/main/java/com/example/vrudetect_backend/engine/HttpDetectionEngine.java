package com.example.vrudetect_backend.engine;

import com.example.vrudetect_backend.config.DetectorProperties;
import com.example.vrudetect_backend.dto.DetectorResponse;
import com.example.vrudetect_backend.engine.Interfaces.DetectionEngine;
import com.example.vrudetect_backend.exception.InferenceException;
import com.example.vrudetect_backend.model.BoundingBox;
import com.example.vrudetect_backend.model.FrameImage;
import com.example.vrudetect_backend.model.RawDetection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sends each frame to the model sidecar over HTTP. Blocking on the response reacts to interruption, so timed-out
 * calls are cancelled rather than abandoned.
 */
public class HttpDetectionEngine implements DetectionEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpDetectionEngine.class);

    private final WebClient client;
    private final String model;
    private final Duration timeout;
    private final Map<String, String> labelMap;

    public HttpDetectionEngine(WebClient client, DetectorProperties props) {
        this.client = client;
        this.model = props.getModel();
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        this.labelMap = props.getLabelMap() == null ? Map.of() : Map.copyOf(props.getLabelMap());
    }

    @Override
    public List<RawDetection> detect(FrameImage frame, double confidenceThreshold) {
        var form = new LinkedMultiValueMap<String, Object>();
        form.add("image", new ByteArrayResource(frame.data()) {
            @Override
            public String getFilename() {
                return "frame-" + frame.index() + ".png";
            }
        });
        if (model != null && !model.isBlank()) {
            form.add("model", model);
        }
        form.add("confidence", String.format(Locale.ROOT, "%.3f", confidenceThreshold));
        form.add("frame_index", String.valueOf(frame.index()));

        long start = System.currentTimeMillis();
        DetectorResponse response = client.post()
                .uri("/v1/detect")
                .body(BodyInserters.fromMultipartData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(body -> new InferenceException("Detector error " + resp.statusCode() + ": " + body)))
                .bodyToMono(DetectorResponse.class)
                .timeout(timeout)
                .block();

        if (response == null) {
            throw new InferenceException("Empty response from detector for frame " + frame.index());
        }
        List<RawDetection> out = new ArrayList<>();
        if (response.detections() != null) {
            for (DetectorResponse.Item item : response.detections()) {
                if (item == null || item.bbox() == null || item.label() == null || item.confidence() == null) {
                    continue;
                }
                String label = normalizeLabel(item.label());
                DetectorResponse.Box b = item.bbox();
                out.add(new RawDetection(label, item.confidence(), new BoundingBox(b.x(), b.y(), b.width(), b.height())));
            }
        }
        LOGGER.debug("Detector frame={} detections={} in {} ms (model={})",
                frame.index(), out.size(), System.currentTimeMillis() - start, response.model());
        return out;
    }

    private String normalizeLabel(String raw) {
        String key = raw.trim().toLowerCase(Locale.ROOT);
        return labelMap.getOrDefault(key, key);
    }

    @Override
    public String id() {
        return "http:" + (model == null || model.isBlank() ? "default" : model);
    }

    @Override
    public boolean supportsCancellation() {
        return true;
    }
}
