package com.example.vrudetect_backend.sampler;

import com.example.vrudetect_backend.exception.ConfigException;
import com.example.vrudetect_backend.model.Frame;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Deterministic, finite and restartable sequence of sampled frames.
 * <p>
 * Frame {@code 0} is always part of the sequence; the last frame is added when the video is longer than one
 * stride. In max-samples mode the stride is derived so that no more than {@code maxSamples} frames are produced.
 * Every call to {@link #iterator()} starts over from frame {@code 0}.
 */
public final class FrameSampler implements Iterable<Frame> {
    private final int frameCount;
    private final double fps;
    private final int stride;
    private final int size;

    private FrameSampler(int frameCount, double fps, int stride) {
        this.frameCount = Math.max(0, frameCount);
        this.fps = fps;
        this.stride = stride;
        this.size = computeSize(this.frameCount, stride);
    }

    /**
     * Samples every {@code stride}-th frame.
     *
     * @throws ConfigException when {@code stride <= 0}.
     */
    public static FrameSampler byStride(int frameCount, double fps, int stride) {
        validateStride(stride);
        return new FrameSampler(frameCount, fps, stride);
    }

    /**
     * Samples at most {@code maxSamples} frames spread evenly over the video.
     *
     * @throws ConfigException when {@code maxSamples <= 0}.
     */
    public static FrameSampler byMaxSamples(int frameCount, double fps, int maxSamples) {
        validateMaxSamples(maxSamples);
        return new FrameSampler(frameCount, fps, strideForMaxSamples(frameCount, maxSamples));
    }

    public static void validateStride(int stride) {
        if (stride <= 0) {
            throw new ConfigException("sampleStride must be > 0 (got " + stride + ")");
        }
    }

    public static void validateMaxSamples(int maxSamples) {
        if (maxSamples <= 0) {
            throw new ConfigException("maxFrames must be > 0 (got " + maxSamples + ")");
        }
    }

    static int strideForMaxSamples(int frameCount, int maxSamples) {
        if (frameCount <= 1 || maxSamples >= frameCount) {
            return 1;
        }
        if (maxSamples == 1) {
            // one sample: only frame 0, the stride just has to reach past the end
            return frameCount;
        }
        long span = frameCount - 1L;
        long divisor = maxSamples - 1L;
        return (int) ((span + divisor - 1) / divisor);
    }

    private static int computeSize(int frameCount, int stride) {
        if (frameCount == 0) {
            return 0;
        }
        int last = frameCount - 1;
        int regular = last / stride + 1;
        boolean lastIncluded = last % stride == 0;
        return (!lastIncluded && frameCount > stride) ? regular + 1 : regular;
    }

    public int size() {
        return size;
    }

    public int stride() {
        return stride;
    }

    public int frameCount() {
        return frameCount;
    }

    /** Materializes the sequence; mostly useful for logging and fallbacks. */
    public List<Frame> toList() {
        List<Frame> frames = new ArrayList<>(size);
        for (Frame frame : this) {
            frames.add(frame);
        }
        return frames;
    }

    @Override
    public Iterator<Frame> iterator() {
        return new Iterator<>() {
            private int produced = 0;

            @Override
            public boolean hasNext() {
                return produced < size;
            }

            @Override
            public Frame next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                long candidate = (long) produced * stride;
                int index = candidate > frameCount - 1 ? frameCount - 1 : (int) candidate;
                produced++;
                return new Frame(index, timestampMs(index));
            }
        };
    }

    private long timestampMs(int index) {
        if (fps <= 0.0 || Double.isNaN(fps)) {
            return 0L;
        }
        return Math.round(index * 1000.0 / fps);
    }
}
