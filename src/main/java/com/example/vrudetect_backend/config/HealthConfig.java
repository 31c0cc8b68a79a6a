package com.example.vrudetect_backend.config;

import com.example.vrudetect_backend.service.Interfaces.StorageService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Files;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin) {
        return () -> {
            try {
                var p = new ProcessBuilder(ffmpegBin, "-version")
                        .redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
                if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                    return Health.up().withDetail("ffmpeg", "ok").build();
                }
                p.destroyForcibly();
                return Health.down().withDetail("ffmpeg", "exit " + (p.isAlive() ? "timeout" : p.exitValue())).build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.down(e).withDetail("ffmpeg", "interrupted").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            }
        };
    }

    @Bean
    public HealthIndicator detectorHealth(DetectorProperties props,
                                          @Qualifier("detectorWebClient") WebClient detector) {
        return () -> {
            if ("synthetic".equalsIgnoreCase(props.getMode())) {
                return Health.up().withDetail("detector", "synthetic").build();
            }
            try {
                // lichte check: GET /health
                detector.get().uri("/health")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("detector", "ok").withDetail("model", props.getModel()).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("detector", "unreachable").build();
            }
        };
    }

    @Bean
    public HealthIndicator storageHealth(StorageService storage) {
        return () -> {
            var root = storage.rootRaw();
            if (Files.isDirectory(root) && Files.isReadable(root)) {
                return Health.up().withDetail("raw", root.toString()).build();
            }
            return Health.down().withDetail("raw", root.toString()).withDetail("reason", "not readable").build();
        };
    }
}
