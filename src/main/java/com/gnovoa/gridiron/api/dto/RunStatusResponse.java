package com.gnovoa.gridiron.api.dto;

import com.gnovoa.gridiron.runner.RunnerState;

import java.time.Instant;
import java.util.Map;

public record RunStatusResponse(
        String runId,
        RunnerState state,
        int years,
        Long seed,
        int yearIndex,
        int currentYear,
        Instant startedAt,
        Instant finishedAt,
        String message,
        Map<String, String> ws
) {}
