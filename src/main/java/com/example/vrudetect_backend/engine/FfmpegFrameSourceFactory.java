package com.example.vrudetect_backend.engine;

import com.example.vrudetect_backend.engine.Interfaces.FrameSource;
import com.example.vrudetect_backend.engine.Interfaces.FrameSourceFactory;
import com.example.vrudetect_backend.exception.SourceUnavailableException;
import com.example.vrudetect_backend.exception.StorageException;
import com.example.vrudetect_backend.service.Interfaces.StorageService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Opens uploaded videos from raw storage and probes them with {@code ffprobe}.
 */
@Component
public class FfmpegFrameSourceFactory implements FrameSourceFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameSourceFactory.class);
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(60);

    private final StorageService storageService;
    private final ObjectMapper mapper;
    private final String ffmpegBin;
    private final String ffprobeBin;
    private final Duration frameTimeout;

    public FfmpegFrameSourceFactory(StorageService storageService,
                                    ObjectMapper mapper,
                                    @Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
                                    @Value("${ffprobe.binary:ffprobe}") String ffprobeBin,
                                    @Value("${ffmpeg.frame-timeout-seconds:30}") long frameTimeoutSeconds) {
        this.storageService = storageService;
        this.mapper = mapper;
        this.ffmpegBin = ffmpegBin;
        this.ffprobeBin = ffprobeBin;
        this.frameTimeout = Duration.ofSeconds(Math.max(1, frameTimeoutSeconds));
    }

    @Override
    public FrameSource open(String videoKey) {
        Path video;
        try {
            video = storageService.resolveRaw(videoKey);
        } catch (StorageException e) {
            throw new SourceUnavailableException(videoKey, "VIDEO_KEY_INVALID: " + e.getMessage(), e);
        }
        if (!storageService.existsInRaw(videoKey)) {
            throw new SourceUnavailableException(videoKey, "VIDEO_NOT_FOUND: " + videoKey);
        }

        JsonNode stream = probe(videoKey, video);
        double fps = parseRate(stream.path("avg_frame_rate").asText(null));
        if (fps <= 0) {
            fps = parseRate(stream.path("r_frame_rate").asText(null));
        }
        int frameCount = stream.path("nb_frames").asInt(0);
        if (frameCount <= 0) {
            frameCount = stream.path("nb_read_packets").asInt(0);
        }
        int width = stream.path("width").asInt(0);
        int height = stream.path("height").asInt(0);
        if (frameCount <= 0) {
            throw new SourceUnavailableException(videoKey, "VIDEO_HAS_NO_FRAMES: " + videoKey);
        }
        LOGGER.info("FrameSource opened videoKey={} frames={} fps={} size={}x{}", videoKey, frameCount, fps, width, height);
        return new FfmpegFrameSource(ffmpegBin, video, frameCount, fps, width, height, frameTimeout);
    }

    private JsonNode probe(String videoKey, Path video) {
        List<String> cmd = List.of(
                ffprobeBin, "-v", "error",
                "-select_streams", "v:0",
                "-count_packets",
                "-show_entries", "stream=width,height,avg_frame_rate,r_frame_rate,nb_frames,nb_read_packets",
                "-of", "json",
                video.toAbsolutePath().toString()
        );
        Process p = null;
        try {
            p = new ProcessBuilder(cmd).redirectError(ProcessBuilder.Redirect.DISCARD).start();
            byte[] out;
            try (InputStream in = p.getInputStream()) {
                out = in.readAllBytes();
            }
            if (!p.waitFor(PROBE_TIMEOUT.toSeconds(), TimeUnit.SECONDS) || p.exitValue() != 0) {
                throw new SourceUnavailableException(videoKey, "FFPROBE_FAILED: " + videoKey);
            }
            JsonNode streams = mapper.readTree(out).path("streams");
            if (!streams.isArray() || streams.isEmpty()) {
                throw new SourceUnavailableException(videoKey, "NO_VIDEO_STREAM: " + videoKey);
            }
            return streams.get(0);
        } catch (IOException e) {
            throw new SourceUnavailableException(videoKey, "FFPROBE_FAILED: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(videoKey, "FFPROBE_INTERRUPTED", e);
        } finally {
            if (p != null && p.isAlive()) {
                p.destroyForcibly();
            }
        }
    }

    static double parseRate(String rate) {
        if (rate == null || rate.isBlank()) {
            return 0.0;
        }
        try {
            int slash = rate.indexOf('/');
            if (slash < 0) {
                return Double.parseDouble(rate);
            }
            double num = Double.parseDouble(rate.substring(0, slash));
            double den = Double.parseDouble(rate.substring(slash + 1));
            return den == 0 ? 0.0 : num / den;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
