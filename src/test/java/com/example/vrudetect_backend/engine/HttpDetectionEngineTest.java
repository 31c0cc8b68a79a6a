package com.example.vrudetect_backend.engine;

import com.example.vrudetect_backend.config.DetectorProperties;
import com.example.vrudetect_backend.exception.InferenceException;
import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.FrameImage;
import com.example.vrudetect_backend.model.RawDetection;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpDetectionEngineTest {

    private static final FrameImage IMAGE = new FrameImage(new Frame(30, 1000), new byte[]{(byte) 0x89, 'P', 'N', 'G'}, 640, 480);

    private static WebClient client(ExchangeFunction exchange) {
        return WebClient.builder().baseUrl("http://detector.local").exchangeFunction(exchange).build();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    @Test
    void mapsDetectorLabelsAndBoxes() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        ExchangeFunction exchange = request -> {
            seen.set(request);
            return Mono.just(json(HttpStatus.OK, """
                    {"model":"yolov8n","inference_ms":12.5,"detections":[
                      {"label":"person","confidence":0.91,"bbox":{"x":10,"y":20,"width":30,"height":60}},
                      {"label":"Bicycle","confidence":0.72,"bbox":{"x":100,"y":20,"width":50,"height":40}},
                      {"label":"scooter_rider","confidence":0.66,"bbox":{"x":300,"y":20,"width":20,"height":50}},
                      {"label":"dog","confidence":0.5}
                    ]}
                    """));
        };

        var engine = new HttpDetectionEngine(client(exchange), new DetectorProperties());
        List<RawDetection> out = engine.detect(IMAGE, 0.4);

        assertThat(seen.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(seen.get().url().getPath()).isEqualTo("/v1/detect");
        assertThat(out).extracting(RawDetection::classLabel).containsExactly("pedestrian", "cyclist", "scooter_rider");
        assertThat(out.get(0).confidence()).isEqualTo(0.91);
        assertThat(out.get(0).box().height()).isEqualTo(60.0);
    }

    @Test
    void emptyDetectionListIsValid() {
        var engine = new HttpDetectionEngine(
                client(request -> Mono.just(json(HttpStatus.OK, "{\"model\":\"yolov8n\",\"detections\":[]}"))),
                new DetectorProperties());

        assertThat(engine.detect(IMAGE, 0.5)).isEmpty();
    }

    @Test
    void errorStatusRaisesInferenceException() {
        var engine = new HttpDetectionEngine(
                client(request -> Mono.just(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"loading\"}"))),
                new DetectorProperties());

        InferenceException ex = assertThrows(InferenceException.class, () -> engine.detect(IMAGE, 0.5));
        assertThat(ex.getMessage()).contains("503");
    }

    @Test
    void reportsModelAndCancellation() {
        var props = new DetectorProperties();
        props.setModel("yolov8s");
        var engine = new HttpDetectionEngine(client(request -> Mono.empty()), props);

        assertThat(engine.id()).isEqualTo("http:yolov8s");
        assertThat(engine.supportsCancellation()).isTrue();
        assertThat(engine.synthetic()).isFalse();
    }
}
