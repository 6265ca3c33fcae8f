package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.contracts.SalaryScale;
import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.SkillTier;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.sim.RandomSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * AI free agency over every unsigned, unrostered player, best first.
 *
 * <p>Teams bid when they are short at the player's position or thin overall and still have cap
 * room; the highest bid wins. A contract that does not fit under the winner's cap becomes a
 * one-year minimum deal, and a player even that cannot be fitted stays unsigned.
 */
public final class FreeAgencyStage implements OffseasonStage {

    static final int THIN_ROSTER = 50;
    static final long MIN_CAP_ROOM_TO_BID = 1000;

    @Override
    public String name() { return "free-agency"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();
        RandomSource rnd = ctx.rnd();
        int year = ctx.draftYear();
        long cap = ctx.settings().salaryCap();
        int rosterLimit = ctx.settings().rosterLimit();

        Set<String> rostered = new HashSet<>();
        Map<String, List<String>> rosters = new LinkedHashMap<>();
        Map<String, Map<Position, Integer>> depth = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            rosters.put(t.teamId(), new ArrayList<>(t.rosterPlayerIds()));
            Map<Position, Integer> counts = new EnumMap<>(Position.class);
            for (String id : t.rosterPlayerIds()) {
                rostered.add(id);
                Player p = state.players().get(id);
                if (p != null) counts.merge(p.position(), 1, Integer::sum);
            }
            depth.put(t.teamId(), counts);
        }

        Map<String, Long> capUsage = ctx.cap().capUsageByTeam(rosters.keySet(), state.contracts().values(), year);

        List<Player> pool = state.players().values().stream()
                .filter(p -> !p.isSigned() && !rostered.contains(p.playerId()))
                .sorted(Comparator.comparingInt((Player p) -> p.tier().rank()).reversed()
                        .thenComparing(Comparator.comparingInt(Player::overall).reversed())
                        .thenComparing(Player::playerId))
                .toList();

        Map<String, Player> players = new LinkedHashMap<>(state.players());
        Map<String, Contract> contracts = new LinkedHashMap<>(state.contracts());
        List<Signing> signings = new ArrayList<>();

        for (Player fa : pool) {
            if (fa.age() > 36 && fa.tier() == SkillTier.FRINGE) continue;
            if (fa.age() > 38 && fa.tier() != SkillTier.ELITE) continue;

            String winner = null;
            int bestBid = Integer.MIN_VALUE;
            for (var e : rosters.entrySet()) {
                String teamId = e.getKey();
                int size = e.getValue().size();
                int need = fa.position().idealCount() - depth.get(teamId).getOrDefault(fa.position(), 0);
                if (need <= 0 && size >= THIN_ROSTER) continue;
                if (cap - capUsage.get(teamId) <= MIN_CAP_ROOM_TO_BID) continue;

                int rosterNeed = size < rosterLimit ? (rosterLimit - size) * 2 : 0;
                int bid = Math.max(0, need) * 10 + rosterNeed + rnd.nextIntInclusive(0, 10);
                if (bid > bestBid) {
                    bestBid = bid;
                    winner = teamId;
                }
            }
            if (winner == null) continue;

            long room = cap - capUsage.get(winner);
            Contract contract = ctx.contracts().generateContract(fa, winner, year);
            boolean minimum = false;
            if (contract.capHitFor(year) > room) {
                if (SalaryScale.minimumSalary(fa.experience()) > room) continue;
                contract = ctx.contracts().minimumContract(fa, winner, year);
                minimum = true;
            }

            long hit = contract.capHitFor(year);
            contracts.put(contract.contractId(), contract);
            players.put(fa.playerId(), fa.withContract(contract.contractId()));
            rosters.get(winner).add(fa.playerId());
            depth.get(winner).merge(fa.position(), 1, Integer::sum);
            capUsage.merge(winner, hit, Long::sum);
            signings.add(new Signing(fa.playerId(), winner, contract.contractId(), hit, minimum));
        }

        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            List<String> roster = rosters.get(t.teamId());
            teams.put(t.teamId(), roster.size() == t.rosterSize() ? t : t.withRoster(roster));
        }

        LeagueState next = state.withPlayers(players).withContracts(contracts).withTeams(teams);
        return new OffseasonStep(next, step.report().withSignings(signings));
    }
}
