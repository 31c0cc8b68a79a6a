package com.example.vrudetect_backend.dto.web;

import com.example.vrudetect_backend.model.JobState;

import java.util.UUID;

public record SubmitDetectionResponse(UUID jobId, boolean created, JobState state) {}
