package com.example.vrudetect_backend.config;

import com.example.vrudetect_backend.engine.HttpDetectionEngine;
import com.example.vrudetect_backend.engine.Interfaces.DetectionEngine;
import com.example.vrudetect_backend.engine.SyntheticDetectionEngine;
import com.example.vrudetect_backend.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Locale;

@Configuration
public class EngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public DetectionEngine detectionEngine(DetectorProperties props,
                                           @Qualifier("detectorWebClient") WebClient detectorWebClient,
                                           @Value("${detector.synthetic-seed:42}") long syntheticSeed) {
        String mode = props.getMode() == null ? "http" : props.getMode().trim().toLowerCase(Locale.ROOT);
        DetectionEngine engine = switch (mode) {
            case "http" -> new HttpDetectionEngine(detectorWebClient, props);
            case "synthetic" -> new SyntheticDetectionEngine(syntheticSeed);
            default -> throw new ConfigException("Unknown detector.mode: " + props.getMode());
        };
        LOGGER.info("Detection engine wired: mode={} id={}", mode, engine.id());
        return engine;
    }
}
