package com.gnovoa.gridiron.api.dto;

import com.gnovoa.gridiron.model.ScheduleStrategy;

import java.util.List;

public record LeagueScheduleResponse(
        String runId,
        int year,
        ScheduleStrategy strategy,
        List<WeekItem> weeks
) {
    public record WeekItem(int week, List<Matchup> games, List<String> byeTeams) {}
    public record Matchup(String gameId, String homeTeam, String awayTeam) {}
}
