package com.gnovoa.gridiron.api.dto;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;

import java.util.List;

public record TeamTableResponse(
        String runId,
        int year,
        List<TeamRow> teams
) {
    /** Cap figures are in thousands. */
    public record TeamRow(
            String teamId,
            String name,
            Conference conference,
            Division division,
            int allTimeWins,
            int allTimeLosses,
            int allTimeTies,
            int championships,
            Integer lastChampionshipYear,
            int rosterSize,
            long capUsage,
            long capSpace,
            String headCoach
    ) {}
}
