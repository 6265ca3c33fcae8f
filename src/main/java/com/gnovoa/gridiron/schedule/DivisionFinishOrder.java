package com.gnovoa.gridiron.schedule;

import com.gnovoa.gridiron.model.Conference;
import com.gnovoa.gridiron.model.Division;
import com.gnovoa.gridiron.model.Team;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Previous-year finishing place (0 = division winner) of every team inside its division.
 * Seeds the standings-based games of the next schedule.
 */
public record DivisionFinishOrder(Map<String, Integer> finishByTeam) {

    public DivisionFinishOrder {
        finishByTeam = Collections.unmodifiableMap(new LinkedHashMap<>(finishByTeam));
    }

    public Integer finishOf(String teamId) {
        return finishByTeam.get(teamId);
    }

    /** Builds the order from ordered division lists, winners first. */
    public static DivisionFinishOrder fromDivisionLists(Collection<List<String>> divisions) {
        Map<String, Integer> finish = new LinkedHashMap<>();
        for (List<String> division : divisions) {
            for (int i = 0; i < division.size(); i++) finish.put(division.get(i), i);
        }
        return new DivisionFinishOrder(finish);
    }

    /**
     * Orders each division by current record (win%, then point differential, then id). A league
     * that has not played yet falls back to id order.
     */
    public static DivisionFinishOrder fromTeamRecords(Collection<Team> teams) {
        Map<String, List<Team>> byDivision = new LinkedHashMap<>();
        for (Conference conf : Conference.values()) {
            for (Division div : Division.values()) byDivision.put(conf + "-" + div, new ArrayList<>());
        }
        for (Team t : teams) {
            byDivision.computeIfAbsent(t.conference() + "-" + t.division(), k -> new ArrayList<>()).add(t);
        }

        Comparator<Team> order = Comparator
                .comparingDouble((Team t) -> t.currentRecord().winPercentage()).reversed()
                .thenComparing(Comparator.comparingInt((Team t) -> t.currentRecord().pointDifferential()).reversed())
                .thenComparing(Team::teamId);

        List<List<String>> lists = new ArrayList<>();
        for (List<Team> division : byDivision.values()) {
            division.sort(order);
            lists.add(division.stream().map(Team::teamId).toList());
        }
        return fromDivisionLists(lists);
    }
}
