package com.example.vrudetect_backend.engine;

import com.example.vrudetect_backend.engine.Interfaces.FrameSource;
import com.example.vrudetect_backend.exception.FrameReadException;
import com.example.vrudetect_backend.model.Frame;
import com.example.vrudetect_backend.model.FrameImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Extracts single frames as PNG by piping {@code ffmpeg} output. Each call spawns its own process, so concurrent
 * reads are safe.
 */
public class FfmpegFrameSource implements FrameSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameSource.class);

    private final String ffmpegBin;
    private final Path video;
    private final int frameCount;
    private final double fps;
    private final int width;
    private final int height;
    private final Duration timeout;

    public FfmpegFrameSource(String ffmpegBin, Path video, int frameCount, double fps, int width, int height, Duration timeout) {
        this.ffmpegBin = ffmpegBin;
        this.video = video;
        this.frameCount = frameCount;
        this.fps = fps;
        this.width = width;
        this.height = height;
        this.timeout = timeout;
    }

    @Override
    public int frameCount() {
        return frameCount;
    }

    @Override
    public double fps() {
        return fps;
    }

    @Override
    public FrameImage getFrame(Frame frame) {
        List<String> cmd = List.of(
                ffmpegBin, "-hide_banner", "-nostats", "-v", "error",
                "-i", video.toAbsolutePath().toString(),
                "-vf", "select=eq(n\\," + frame.index() + ")",
                "-vsync", "0",
                "-frames:v", "1",
                "-f", "image2pipe",
                "-vcodec", "png",
                "-"
        );
        Process p = null;
        try {
            p = new ProcessBuilder(cmd).redirectError(ProcessBuilder.Redirect.DISCARD).start();
            byte[] png;
            try (InputStream in = p.getInputStream()) {
                png = in.readAllBytes();
            }
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new FrameReadException(frame.index(), "ffmpeg frame extract timed out after " + timeout.toMillis() + "ms");
            }
            if (p.exitValue() != 0 || png.length == 0) {
                throw new FrameReadException(frame.index(), "ffmpeg frame extract failed exit=" + p.exitValue() + " bytes=" + png.length);
            }
            LOGGER.trace("frame extracted video={} index={} bytes={}", video.getFileName(), frame.index(), png.length);
            return new FrameImage(frame, png, width, height);
        } catch (IOException e) {
            throw new FrameReadException(frame.index(), "ffmpeg frame extract failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FrameReadException(frame.index(), "frame extract interrupted", e);
        } finally {
            if (p != null && p.isAlive()) {
                p.destroyForcibly();
            }
        }
    }
}
