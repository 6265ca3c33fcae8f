package com.gnovoa.gridiron.runner;

import com.gnovoa.gridiron.api.dto.LeagueScheduleResponse;
import com.gnovoa.gridiron.api.dto.RunStatusResponse;
import com.gnovoa.gridiron.api.dto.SeasonSummaryResponse;
import com.gnovoa.gridiron.api.dto.TeamTableResponse;
import com.gnovoa.gridiron.history.HistoryResult;
import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.SeasonSchedule;
import com.gnovoa.gridiron.model.Team;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Component
public final class RunnerFacade {

    private final HistoryRunRegistry registry;

    public RunnerFacade(HistoryRunRegistry registry) {
        this.registry = registry;
    }

    public RunStatusResponse start(Integer years, Long seed) {
        return status(registry.start(years, seed).runId());
    }

    public RunStatusResponse status(String runId) {
        RunnerStatus st = registry.runner(runId).status();
        return new RunStatusResponse(
                st.runId(),
                st.state(),
                st.years(),
                st.seed(),
                st.yearIndex(),
                st.currentYear(),
                st.startedAt(),
                st.finishedAt(),
                st.message(),
                Map.of("progress", "/ws/history/runs/" + st.runId())
        );
    }

    public RunStatusResponse cancel(String runId) {
        registry.runner(runId).cancel();
        return status(runId);
    }

    public List<SeasonSummaryResponse> seasons(String runId) {
        HistoryResult result = finished(runId);
        LeagueState league = result.finalState();
        return result.summaries().stream()
                .map(s -> new SeasonSummaryResponse(
                        s.year(),
                        s.championTeamId(),
                        nameOf(league, s.championTeamId()),
                        s.championRecord().toString(),
                        s.runnerUpTeamId(),
                        nameOf(league, s.runnerUpTeamId()),
                        s.playoffTeamIds(),
                        s.draftOrder()
                ))
                .toList();
    }

    /** The schedule of the start year, which the history run leaves unplayed. */
    public LeagueScheduleResponse schedule(String runId) {
        LeagueState league = finished(runId).finalState();
        SeasonSchedule schedule = league.schedule();

        List<LeagueScheduleResponse.WeekItem> weeks = new ArrayList<>();
        for (int week = 1; week <= SeasonSchedule.WEEKS; week++) {
            int w = week;
            var games = schedule.gamesInWeek(week).stream()
                    .map(g -> new LeagueScheduleResponse.Matchup(g.gameId(), nameOf(league, g.homeTeamId()), nameOf(league, g.awayTeamId())))
                    .toList();
            var byes = schedule.byeWeeks().entrySet().stream()
                    .filter(e -> e.getValue() == w)
                    .map(e -> nameOf(league, e.getKey()))
                    .toList();
            weeks.add(new LeagueScheduleResponse.WeekItem(week, games, byes));
        }
        return new LeagueScheduleResponse(runId, schedule.year(), schedule.strategy(), weeks);
    }

    /** Franchises ordered by championships, then all-time wins. */
    public TeamTableResponse teams(String runId) {
        LeagueState league = finished(runId).finalState();
        var rows = league.teams().values().stream()
                .sorted(Comparator.comparingInt(Team::championships).reversed()
                        .thenComparing(Comparator.comparingInt((Team t) -> t.allTimeRecord().wins()).reversed())
                        .thenComparing(Team::teamId))
                .map(t -> {
                    Coach head = league.coaches().get(t.staff().headCoachId());
                    return new TeamTableResponse.TeamRow(
                            t.teamId(),
                            t.fullName(),
                            t.conference(),
                            t.division(),
                            t.allTimeRecord().wins(),
                            t.allTimeRecord().losses(),
                            t.allTimeRecord().ties(),
                            t.championships(),
                            t.lastChampionshipYear(),
                            t.rosterSize(),
                            t.finances() == null ? 0 : t.finances().capUsage(),
                            t.finances() == null ? 0 : t.finances().capSpace(),
                            head == null ? null : head.fullName()
                    );
                })
                .toList();
        return new TeamTableResponse(runId, league.year(), rows);
    }

    /**
     * @throws IllegalStateException if the run has not completed successfully
     */
    private HistoryResult finished(String runId) {
        HistoryRunner runner = registry.runner(runId);
        HistoryResult result = runner.result();
        if (result == null) {
            throw new IllegalStateException("Run " + runId + " is " + runner.status().state() + ", no history yet");
        }
        return result;
    }

    private static String nameOf(LeagueState league, String teamId) {
        if (teamId == null) return null;
        Team t = league.team(teamId);
        return t == null ? teamId : t.fullName();
    }
}
