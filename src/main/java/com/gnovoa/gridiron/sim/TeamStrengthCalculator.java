package com.gnovoa.gridiron.sim;

import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.CoachRole;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.Team;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Derives offense/defense strength from the best eleven players on each side of the ball plus a
 * coaching modifier. Pure: no randomness, so it can be precomputed once per season.
 */
public final class TeamStrengthCalculator {

    public static final double MIN_STRENGTH = 20.0;
    public static final double MAX_STRENGTH = 95.0;
    static final double EMPTY_SIDE_RATING = 40.0;
    static final int STARTERS_PER_SIDE = 11;

    public Map<String, TeamStrength> computeAll(LeagueState state) {
        Map<String, TeamStrength> out = new LinkedHashMap<>();
        for (Team team : state.teams().values()) {
            out.put(team.teamId(), compute(team, state.players(), state.coaches()));
        }
        return out;
    }

    public TeamStrength compute(Team team, Map<String, Player> players, Map<String, Coach> coaches) {
        List<Player> roster = new ArrayList<>();
        for (String id : team.rosterPlayerIds()) {
            Player p = players.get(id);
            if (p != null) roster.add(p);
        }

        double offense = starterAverage(roster, Position::isOffense);
        double defense = starterAverage(roster, Position::isDefense);

        double headCoach = modifier(coaches.get(team.staff().headCoachId()));
        offense += headCoach + modifier(coaches.get(team.staff().coachFor(CoachRole.OFFENSIVE_COORDINATOR)));
        defense += headCoach + modifier(coaches.get(team.staff().coachFor(CoachRole.DEFENSIVE_COORDINATOR)));

        return new TeamStrength(team.teamId(), clamp(offense), clamp(defense));
    }

    private static double starterAverage(List<Player> roster, Predicate<Position> side) {
        return roster.stream()
                .filter(p -> side.test(p.position()))
                .sorted(Comparator.comparingInt(Player::overall).reversed())
                .limit(STARTERS_PER_SIDE)
                .mapToInt(Player::overall)
                .average()
                .orElse(EMPTY_SIDE_RATING);
    }

    private static double modifier(Coach coach) {
        if (coach == null) return 0.0;
        return (coach.attributes().gameDayIq() - 50) * 0.05;
    }

    private static double clamp(double v) {
        return Math.max(MIN_STRENGTH, Math.min(MAX_STRENGTH, v));
    }
}
