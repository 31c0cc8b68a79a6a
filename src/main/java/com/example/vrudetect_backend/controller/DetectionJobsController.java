package com.example.vrudetect_backend.controller;

import com.example.vrudetect_backend.dto.web.CancelResponse;
import com.example.vrudetect_backend.dto.web.JobStatusResponse;
import com.example.vrudetect_backend.dto.web.SubmitDetectionRequest;
import com.example.vrudetect_backend.dto.web.SubmitDetectionResponse;
import com.example.vrudetect_backend.exception.ConfigException;
import com.example.vrudetect_backend.model.JobResult;
import com.example.vrudetect_backend.model.ProgressEvent;
import com.example.vrudetect_backend.service.DetectionJobService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.UUID;

@RestController
@RequestMapping("/v1/detection/jobs")
public class DetectionJobsController {
    private final DetectionJobService jobs;
    private final Clock clock;

    public DetectionJobsController(DetectionJobService jobs, Clock clock) {
        this.jobs = jobs;
        this.clock = clock;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmitDetectionResponse submit(@Valid @RequestBody SubmitDetectionRequest req) {
        try {
            var outcome = jobs.submit(req);
            return new SubmitDetectionResponse(outcome.jobId(), outcome.created(), outcome.state());
        } catch (ConfigException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (IllegalStateException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "SUPERVISOR_POOL_SATURATED");
        }
    }

    @GetMapping("/{jobId}")
    public JobStatusResponse status(@PathVariable UUID jobId) {
        var snapshot = jobs.status(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        return JobStatusResponse.from(snapshot, clock.instant());
    }

    @GetMapping(value = "/{jobId}/progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ProgressEvent>> progress(@PathVariable UUID jobId,
                                                         @RequestParam(defaultValue = "0") long afterSeq) {
        return jobs.progress(jobId, afterSeq)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"))
                .map(e -> ServerSentEvent.<ProgressEvent>builder()
                        .id(String.valueOf(e.seq()))
                        .event(e.state().isTerminal() ? "terminal" : "progress")
                        .data(e)
                        .build());
    }

    @PostMapping("/{jobId}/cancel")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CancelResponse cancel(@PathVariable UUID jobId) {
        var state = jobs.cancel(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        return new CancelResponse(jobId, !state.isTerminal(), state);
    }

    @GetMapping("/{jobId}/result")
    public JobResult result(@PathVariable UUID jobId) {
        var snapshot = jobs.status(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        if (!snapshot.state().isTerminal() || snapshot.result() == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "RESULT_NOT_READY");
        }
        return snapshot.result();
    }
}
