package com.example.vrudetect_backend.model;

/**
 * Frame accounting for a job. {@code processed + skipped + failed} never exceeds {@code dispatched}.
 */
public record JobCounters(int framesTotal,
                          int framesDispatched,
                          int framesProcessed,
                          int framesSkipped,
                          int framesFailed,
                          int detectionsFound) {

    public static JobCounters empty() {
        return new JobCounters(0, 0, 0, 0, 0, 0);
    }

    public JobCounters withFramesTotal(int total) {
        return new JobCounters(total, framesDispatched, framesProcessed, framesSkipped, framesFailed, detectionsFound);
    }

    public JobCounters dispatched() {
        return new JobCounters(framesTotal, framesDispatched + 1, framesProcessed, framesSkipped, framesFailed, detectionsFound);
    }

    public JobCounters settled(FrameStatus status, int detections) {
        return switch (status) {
            case PROCESSED -> new JobCounters(framesTotal, framesDispatched, framesProcessed + 1, framesSkipped, framesFailed, detectionsFound + detections);
            case SKIPPED -> new JobCounters(framesTotal, framesDispatched, framesProcessed, framesSkipped + 1, framesFailed, detectionsFound);
            case FAILED -> new JobCounters(framesTotal, framesDispatched, framesProcessed, framesSkipped, framesFailed + 1, detectionsFound);
        };
    }

    public int framesSettled() {
        return framesProcessed + framesSkipped + framesFailed;
    }
}
