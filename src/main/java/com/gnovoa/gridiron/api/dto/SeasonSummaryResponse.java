package com.gnovoa.gridiron.api.dto;

import java.util.List;

public record SeasonSummaryResponse(
        int year,
        String championTeamId,
        String championName,
        String championRecord,
        String runnerUpTeamId,
        String runnerUpName,
        List<String> playoffTeamIds,
        List<String> draftOrder
) {}
