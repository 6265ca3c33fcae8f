package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.contracts.CapCalculator;
import com.gnovoa.gridiron.model.DraftPick;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.schedule.ScheduleValidator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks on a league between cycles: team count, roster limits, cap bookkeeping, the
 * schedule shape and complete draft rounds.
 */
public final class LeagueInvariants {

    public static final int TEAM_COUNT = 32;

    private final int rosterLimit;
    private final CapCalculator cap = new CapCalculator();
    private final ScheduleValidator scheduleValidator = new ScheduleValidator();

    public LeagueInvariants(int rosterLimit) {
        this.rosterLimit = rosterLimit;
    }

    /** Every broken invariant, described; empty when the league is sound. */
    public List<String> violations(LeagueState state) {
        List<String> problems = new ArrayList<>();

        if (state.teams().size() != TEAM_COUNT) {
            problems.add("League has " + state.teams().size() + " teams, expected " + TEAM_COUNT);
        }

        Map<String, String> rosteredBy = new HashMap<>();
        for (Team t : state.teams().values()) {
            if (t.rosterSize() > rosterLimit) {
                problems.add(t.teamId() + " carries " + t.rosterSize() + " players, limit is " + rosterLimit);
            }
            for (String id : t.rosterPlayerIds()) {
                if (!state.players().containsKey(id)) problems.add(t.teamId() + " rosters unknown player " + id);
                String other = rosteredBy.put(id, t.teamId());
                if (other != null) problems.add(id + " is on the rosters of " + other + " and " + t.teamId());
            }
            if (t.finances() != null) {
                long expected = cap.capUsage(t.teamId(), state.contracts().values(), t.finances().year());
                if (expected != t.finances().capUsage()) {
                    problems.add(t.teamId() + " reports cap usage " + t.finances().capUsage() + " but its contracts sum to " + expected);
                }
            }
        }

        if (state.schedule() != null) {
            problems.addAll(scheduleValidator.validate(state.schedule(), state.teams().keySet()));
        }

        Map<Integer, List<String>> picksByRound = new LinkedHashMap<>();
        for (DraftPick p : state.draftPicks()) {
            picksByRound.computeIfAbsent(p.round(), r -> new ArrayList<>()).add(p.currentTeamId());
        }
        for (var e : picksByRound.entrySet()) {
            Set<String> owners = new HashSet<>(e.getValue());
            if (e.getValue().size() != owners.size() || !owners.equals(state.teams().keySet())) {
                problems.add("Draft round " + e.getKey() + " does not give every team exactly one pick");
            }
        }
        return problems;
    }

    /**
     * @throws IllegalStateException listing every violation, if there is any
     */
    public void verify(LeagueState state) {
        List<String> problems = violations(state);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("League " + state.year() + " breaks " + problems.size()
                    + " invariant(s): " + String.join("; ", problems));
        }
    }
}
