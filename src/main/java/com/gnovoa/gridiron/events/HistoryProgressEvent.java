package com.gnovoa.gridiron.events;

import com.gnovoa.gridiron.history.HistoryPhase;
import com.gnovoa.gridiron.runner.RunnerState;

import java.time.Instant;
import java.util.Map;

/**
 * Progress of one history run, pushed to its subscribers.
 *
 * @param phase null once the run has left the simulation loop
 */
public record HistoryProgressEvent(
        String runId,
        Instant occurredAt,
        RunnerState state,
        int yearIndex,
        int totalYears,
        HistoryPhase phase,
        Map<String, Object> data
) {}
