package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamFinances;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes every team's cap picture for the upcoming league year from the final contract set.
 * Overages are reported as negative space, not corrected.
 */
public final class FinanceStage implements OffseasonStage {

    @Override
    public String name() { return "finance"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();
        int year = ctx.draftYear();
        long cap = ctx.settings().salaryCap();

        Map<String, List<Contract>> byTeam = new HashMap<>();
        for (Contract c : state.contracts().values()) {
            if (c.teamId() != null) byTeam.computeIfAbsent(c.teamId(), k -> new ArrayList<>()).add(c);
        }
        Map<String, Long> deadCap = new HashMap<>();
        for (Release r : step.report().releases()) deadCap.merge(r.teamId(), r.deadCap(), Long::sum);

        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            Collection<Contract> own = byTeam.getOrDefault(t.teamId(), List.of());
            long usage = ctx.cap().capUsage(t.teamId(), own, year);
            long dead = deadCap.getOrDefault(t.teamId(), 0L);
            TeamFinances finances = new TeamFinances(
                    year,
                    cap,
                    usage,
                    dead,
                    cap - usage - dead,
                    ctx.cap().futureCommitment(t.teamId(), own, year, 1),
                    ctx.cap().futureCommitment(t.teamId(), own, year, 2),
                    ctx.cap().futureCommitment(t.teamId(), own, year, 3));
            teams.put(t.teamId(), t.withFinances(finances));
        }
        return new OffseasonStep(state.withTeams(teams), step.report());
    }
}
