package com.gnovoa.gridiron.schedule;

import com.gnovoa.gridiron.model.ScheduledGame;
import com.gnovoa.gridiron.model.SeasonSchedule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Checks the 17-games-plus-one-bye shape of a season schedule. */
public final class ScheduleValidator {

    /**
     * @return human-readable violations; empty when the schedule is valid
     */
    public List<String> validate(SeasonSchedule schedule, Collection<String> teamIds) {
        List<String> problems = new ArrayList<>();
        Set<String> known = new HashSet<>(teamIds);
        Map<String, Integer> games = new HashMap<>();
        Set<String> weekSlots = new HashSet<>();

        for (ScheduledGame g : schedule.games()) {
            if (g.week() < 1 || g.week() > SeasonSchedule.WEEKS) {
                problems.add(g.gameId() + " is in week " + g.week());
            }
            if (g.homeTeamId().equals(g.awayTeamId())) {
                problems.add(g.homeTeamId() + " plays itself in week " + g.week());
            }
            for (String team : List.of(g.homeTeamId(), g.awayTeamId())) {
                if (!known.contains(team)) problems.add("Unknown team " + team + " in " + g.gameId());
                games.merge(team, 1, Integer::sum);
                if (!weekSlots.add(team + "#" + g.week())) {
                    problems.add(team + " plays twice in week " + g.week());
                }
                Integer bye = schedule.byeWeekOf(team);
                if (bye != null && bye == g.week()) {
                    problems.add(team + " plays during its bye week " + bye);
                }
            }
        }

        for (String team : known) {
            int count = games.getOrDefault(team, 0);
            if (count != SeasonSchedule.GAMES_PER_TEAM) {
                problems.add(team + " has " + count + " games");
            }
            Integer bye = schedule.byeWeekOf(team);
            if (bye == null || bye < 1 || bye > SeasonSchedule.WEEKS) {
                problems.add(team + " has no bye week");
            }
        }
        return problems;
    }

    public boolean isValid(SeasonSchedule schedule, Collection<String> teamIds) {
        return validate(schedule, teamIds).isEmpty();
    }
}
