package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.draft.DraftOrder;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.SeasonSchedule;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.playoffs.PlayoffBracket;
import com.gnovoa.gridiron.schedule.DivisionFinishOrder;
import com.gnovoa.gridiron.sim.TeamStrength;
import com.gnovoa.gridiron.standings.LeagueStandings;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One season of the league: schedule, regular season, standings, playoffs and the resulting draft
 * order. Teams are expected to start with empty current records.
 */
public final class SeasonCycle {

    private final LeagueEngine engine;

    public SeasonCycle(LeagueEngine engine) {
        this.engine = engine;
    }

    /**
     * @param previous how every team finished in its division last season; drives the rotating
     *     schedule matchups
     */
    public SeasonOutcome play(LeagueState state, DivisionFinishOrder previous) {
        List<Team> teams = List.copyOf(state.teams().values());
        SeasonSchedule schedule = engine.schedules().generate(teams, previous, state.year());

        LeagueState played = engine.seasons().simulateRegularSeason(state.withSchedule(schedule));
        LeagueStandings standings = engine.standings().calculate(
                played.year(), played.schedule().games(), played.teams().values());

        Map<String, TeamStrength> strengths = engine.strengths().computeAll(played);
        PlayoffBracket bracket = engine.playoffSimulator().playOut(engine.playoffs().seed(standings), strengths);

        DraftOrder order = engine.draftOrders().calculate(standings, bracket, played.teams().values());
        return new SeasonOutcome(withSeeds(played, bracket), standings, bracket, order);
    }

    private static LeagueState withSeeds(LeagueState state, PlayoffBracket bracket) {
        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            int seed = bracket.seedOf(t.teamId());
            teams.put(t.teamId(), t.withPlayoffSeed(seed > 0 ? seed : null));
        }
        return state.withTeams(teams);
    }
}
