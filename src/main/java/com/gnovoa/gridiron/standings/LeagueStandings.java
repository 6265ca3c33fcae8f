package com.gnovoa.gridiron.standings;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;
import com.gnovoa.gridiron.schedule.DivisionFinishOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Ordered standings of one season. Every list is best first. */
public record LeagueStandings(
        int year,
        Map<String, TeamStanding> byTeam,
        Map<Conference, Map<Division, List<String>>> divisions,
        Map<Conference, List<String>> conferences
) {
    public static final int DIVISION_WINNER_SEEDS = 4;
    public static final int WILD_CARDS = 3;

    public TeamStanding standing(String teamId) {
        TeamStanding s = byTeam.get(teamId);
        if (s == null) throw new IllegalArgumentException("Unknown team " + teamId);
        return s;
    }

    public List<String> division(Conference conference, Division division) {
        return divisions.getOrDefault(conference, Map.of()).getOrDefault(division, List.of());
    }

    public List<String> conference(Conference conference) {
        return conferences.getOrDefault(conference, List.of());
    }

    /** Division winners of a conference, ordered by the tiebreak chain. */
    public List<String> divisionWinners(Conference conference) {
        List<TeamStanding> winners = new ArrayList<>();
        for (List<String> div : divisions.getOrDefault(conference, Map.of()).values()) {
            if (!div.isEmpty()) winners.add(byTeam.get(div.get(0)));
        }
        winners.sort(StandingsOrder.BEST_FIRST);
        return winners.stream().map(TeamStanding::teamId).toList();
    }

    /**
     * Playoff field of a conference in seed order: division winners are seeds 1 to 4 whatever their
     * record, then the three best remaining teams.
     */
    public List<String> playoffSeeds(Conference conference) {
        List<String> seeds = new ArrayList<>(divisionWinners(conference));
        for (String teamId : conference(conference)) {
            if (seeds.size() >= DIVISION_WINNER_SEEDS + WILD_CARDS) break;
            if (!seeds.contains(teamId)) seeds.add(teamId);
        }
        return Collections.unmodifiableList(seeds);
    }

    public List<String> playoffTeams() {
        List<String> all = new ArrayList<>();
        for (Conference c : Conference.values()) all.addAll(playoffSeeds(c));
        return all;
    }

    public DivisionFinishOrder divisionFinishOrder() {
        List<List<String>> lists = new ArrayList<>();
        for (Map<Division, List<String>> byDivision : divisions.values()) lists.addAll(byDivision.values());
        return DivisionFinishOrder.fromDivisionLists(lists);
    }
}
