package com.gnovoa.gridiron.runner;

import java.time.Instant;

/**
 * @param yearIndex 1-based index of the year being simulated, 0 before the first season starts
 * @param currentYear league year being simulated, or the start year once the run is done
 */
public record RunnerStatus(
        String runId,
        RunnerState state,
        int years,
        Long seed,
        int yearIndex,
        int currentYear,
        Instant startedAt,
        Instant finishedAt,
        String message
) {}
