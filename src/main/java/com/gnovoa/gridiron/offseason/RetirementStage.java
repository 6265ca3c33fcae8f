package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.SkillTier;
import com.gnovoa.gridiron.model.Team;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Retires players and removes them from players, contracts and every roster in the same step.
 *
 * <p>No player under 28 retires while signed. Odds climb steeply with age, are lower for quarterbacks and kickers,
 * higher for running backs, and lower for better players. Unsigned veterans are likely to walk away.
 */
public final class RetirementStage implements OffseasonStage {

    static final int MIN_RETIREMENT_AGE = 28;
    static final int UNSIGNED_VETERAN_AGE = 26;
    static final double UNSIGNED_VETERAN_FLOOR = 0.5;

    @Override
    public String name() { return "retirement"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();

        List<String> retired = new ArrayList<>();
        for (Player p : state.players().values()) {
            if (ctx.rnd().chance(retirementChance(p))) retired.add(p.playerId());
        }
        if (retired.isEmpty()) return step;

        Set<String> gone = new HashSet<>(retired);

        Map<String, Player> players = new LinkedHashMap<>(state.players());
        players.keySet().removeAll(gone);

        Map<String, Contract> contracts = new LinkedHashMap<>();
        for (Contract c : state.contracts().values()) {
            if (!gone.contains(c.playerId())) contracts.put(c.contractId(), c);
        }

        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            List<String> roster = t.rosterPlayerIds().stream().filter(id -> !gone.contains(id)).toList();
            teams.put(t.teamId(), roster.size() == t.rosterSize() ? t : t.withRoster(roster));
        }

        LeagueState next = state.withPlayers(players).withContracts(contracts).withTeams(teams);
        return new OffseasonStep(next, step.report().withRetirements(retired));
    }

    /** Probability that the player retires this offseason. */
    public static double retirementChance(Player p) {
        double chance = careerEndChance(p);
        if (!p.isSigned() && p.age() >= UNSIGNED_VETERAN_AGE) chance = Math.max(chance, UNSIGNED_VETERAN_FLOOR);
        return Math.min(1.0, chance);
    }

    static double careerEndChance(Player p) {
        int age = p.age();
        if (age < MIN_RETIREMENT_AGE) return 0.0;

        double chance;
        if (age >= 40) chance = 0.85;
        else if (age >= 38) chance = 0.6;
        else if (age >= 36) chance = 0.35;
        else if (age >= 34) chance = 0.2;
        else if (age >= 32) chance = 0.1;
        else if (age >= 30) chance = 0.04;
        else chance = 0.01;

        if (p.position() == Position.QB) chance *= 0.6;
        else if (p.position() == Position.K || p.position() == Position.P) chance *= 0.5;
        else if (p.position() == Position.RB) chance *= 1.4;

        SkillTier tier = p.tier();
        if (tier == SkillTier.ELITE) chance *= 0.5;
        else if (tier == SkillTier.STARTER) chance *= 0.7;
        else if (tier == SkillTier.FRINGE) chance *= 1.3;

        return chance;
    }
}
