package com.gnovoa.gridiron.sim;

import com.gnovoa.gridiron.model.Injury;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.ScheduledGame;
import com.gnovoa.gridiron.model.SeasonSchedule;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plays every game of the state's schedule week by week.
 *
 * <p>Updates current team records and applies in-season injuries; injured players heal one week
 * per played week.
 */
public final class SeasonSimulator {

    static final double INJURY_CHANCE_PER_TEAM_GAME = 0.12;
    static final double TURNOVER_INJURY_BUMP = 0.02;
    private static final String[] INJURIES = {"Hamstring", "Ankle", "Knee", "Shoulder", "Concussion", "Ribs"};

    private final RandomSource rnd;
    private final QuickGameSimulator games;
    private final TeamStrengthCalculator strengths;

    public SeasonSimulator(RandomSource rnd, QuickGameSimulator games, TeamStrengthCalculator strengths) {
        this.rnd = rnd;
        this.games = games;
        this.strengths = strengths;
    }

    public LeagueState simulateRegularSeason(LeagueState state) {
        SeasonSchedule schedule = state.schedule();
        if (schedule == null) throw new IllegalStateException("No schedule for year " + state.year());

        Map<String, TeamStrength> strengthByTeam = strengths.computeAll(state);
        Map<String, TeamRecord> records = new LinkedHashMap<>();
        for (Team t : state.teams().values()) records.put(t.teamId(), t.currentRecord());
        Map<String, Player> players = new LinkedHashMap<>(state.players());

        List<ScheduledGame> played = new ArrayList<>(schedule.games().size());
        for (int week = 1; week <= SeasonSchedule.WEEKS; week++) {
            for (ScheduledGame game : schedule.gamesInWeek(week)) {
                if (game.completed()) {
                    played.add(game);
                    continue;
                }
                GameResult r = games.simulate(strengthByTeam.get(game.homeTeamId()), strengthByTeam.get(game.awayTeamId()));
                played.add(game.withResult(r.homeScore(), r.awayScore()));

                records.compute(game.homeTeamId(), (id, rec) -> rec.withGame(r.homeScore(), r.awayScore()));
                records.compute(game.awayTeamId(), (id, rec) -> rec.withGame(r.awayScore(), r.homeScore()));

                rollInjury(state.team(game.homeTeamId()), r.boxScore().homeTurnovers(), players);
                rollInjury(state.team(game.awayTeamId()), r.boxScore().awayTurnovers(), players);
            }
            healOneWeek(players);
        }

        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) teams.put(t.teamId(), t.withCurrentRecord(records.get(t.teamId())));

        return state.withSchedule(schedule.withGames(played)).withTeams(teams).withPlayers(players);
    }

    private void rollInjury(Team team, int turnovers, Map<String, Player> players) {
        if (team == null || team.rosterPlayerIds().isEmpty()) return;
        if (!rnd.chance(INJURY_CHANCE_PER_TEAM_GAME + turnovers * TURNOVER_INJURY_BUMP)) return;

        String playerId = rnd.pick(team.rosterPlayerIds());
        Player p = players.get(playerId);
        if (p == null) return;
        int weeks = rnd.nextIntInclusive(1, 6);
        String what = INJURIES[rnd.nextIntInclusive(0, INJURIES.length - 1)];
        players.put(playerId, p.withInjury(new Injury(what, Math.max(weeks, p.injury().weeksRemaining()))));
    }

    private static void healOneWeek(Map<String, Player> players) {
        for (var e : players.entrySet()) {
            Injury injury = e.getValue().injury();
            if (!injury.isInjured()) continue;
            int left = injury.weeksRemaining() - 1;
            e.setValue(e.getValue().withInjury(left <= 0 ? Injury.NONE : new Injury(injury.description(), left)));
        }
    }
}
