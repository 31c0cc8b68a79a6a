package com.example.vrudetect_backend.dto.web;

import com.example.vrudetect_backend.model.JobSnapshot;
import com.example.vrudetect_backend.model.JobState;

import java.time.Instant;
import java.util.UUID;

public record JobStatusResponse(
        UUID jobId,
        String videoKey,
        JobState state,
        int framesProcessed,
        int framesTotal,
        int framesDispatched,
        int framesSkipped,
        int framesFailed,
        int detectionsFound,
        long elapsedMs,
        long lastSeq,
        boolean cancelRequested,
        String error
) {
    public static JobStatusResponse from(JobSnapshot s, Instant now) {
        var c = s.counters();
        return new JobStatusResponse(s.jobId(), s.videoKey(), s.state(),
                c.framesProcessed(), c.framesTotal(), c.framesDispatched(), c.framesSkipped(), c.framesFailed(),
                c.detectionsFound(), s.elapsedMs(now), s.lastSeq(), s.cancelRequested(), s.error());
    }
}
