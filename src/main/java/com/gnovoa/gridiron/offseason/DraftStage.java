package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.draft.DraftPickFactory;
import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.DraftInfo;
import com.gnovoa.gridiron.model.DraftPick;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.Prospect;
import com.gnovoa.gridiron.model.RosterNeeds;
import com.gnovoa.gridiron.model.Team;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AI draft over the upcoming year's class.
 *
 * <p>Each pick weighs the scouting grade of the best remaining prospects against the team's
 * positional need, plus a little noise. Drafted players sign four-year rookie-scale deals; everyone
 * left on the board enters the league as an unsigned UDFA.
 */
public final class DraftStage implements OffseasonStage {

    static final int NEED_WEIGHT = 15;
    static final int NO_NEED_PENALTY = -10;

    private final DraftPickFactory pickFactory;

    public DraftStage(DraftPickFactory pickFactory) {
        this.pickFactory = pickFactory;
    }

    @Override
    public String name() { return "draft"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();
        int year = ctx.draftYear();

        List<Prospect> available = new ArrayList<>(draftClassFor(state, ctx));
        List<DraftPick> picks = pickFactory.createPicks(ctx.draftOrder(), year, ctx.settings().draftRounds());

        Map<String, Player> players = new LinkedHashMap<>(state.players());
        Map<String, Contract> contracts = new LinkedHashMap<>(state.contracts());
        Map<String, List<String>> rosters = new LinkedHashMap<>();
        Map<String, List<Player>> rosterPlayers = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            rosters.put(t.teamId(), new ArrayList<>(t.rosterPlayerIds()));
            List<Player> current = new ArrayList<>();
            for (String id : t.rosterPlayerIds()) {
                Player p = players.get(id);
                if (p != null) current.add(p);
            }
            rosterPlayers.put(t.teamId(), current);
        }

        List<DraftPick> executed = new ArrayList<>(picks.size());
        for (DraftPick pick : picks) {
            String teamId = pick.currentTeamId();
            if (!rosters.containsKey(teamId) || available.isEmpty()) {
                executed.add(pick);
                continue;
            }

            Map<Position, Integer> needs = RosterNeeds.deficits(rosterPlayers.get(teamId));
            Prospect chosen = available.remove(choose(available, needs, ctx));

            Player rookie = chosen.toPlayer(new DraftInfo(year, pick.round(), pick.overallPick(), teamId));
            Contract contract = ctx.contracts().rookieContract(rookie, teamId, year, pick.overallPick(), pick.round());
            rookie = rookie.withContract(contract.contractId());

            players.put(rookie.playerId(), rookie);
            contracts.put(contract.contractId(), contract);
            rosters.get(teamId).add(rookie.playerId());
            rosterPlayers.get(teamId).add(rookie);
            executed.add(pick.withSelection(rookie.playerId()));
        }

        List<String> udfas = new ArrayList<>(available.size());
        for (Prospect p : available) {
            Player udfa = p.toPlayer(null);
            players.put(udfa.playerId(), udfa);
            udfas.add(udfa.playerId());
        }

        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) teams.put(t.teamId(), t.withRoster(rosters.get(t.teamId())));

        LeagueState next = state.withPlayers(players)
                .withContracts(contracts)
                .withTeams(teams)
                .withDraftPicks(executed)
                .withDraftClass(List.of());
        return new OffseasonStep(next, step.report().withDraft(executed, udfas));
    }

    /** The class stored on the state when it belongs to this draft, otherwise a newly generated one. */
    private static List<Prospect> draftClassFor(LeagueState state, OffseasonContext ctx) {
        List<Prospect> stored = state.draftClass();
        if (!stored.isEmpty() && stored.get(0).draftYear() == ctx.draftYear()) return stored;
        return ctx.draftClasses().generateDraftClass(ctx.draftYear());
    }

    private static int choose(List<Prospect> available, Map<Position, Integer> needs, OffseasonContext ctx) {
        int window = Math.min(available.size(), ctx.settings().prospectsConsidered());
        int best = 0;
        int bestScore = Integer.MIN_VALUE;
        for (int i = 0; i < window; i++) {
            Prospect p = available.get(i);
            int need = needs.getOrDefault(p.position(), 0);
            int score = p.ceiling().draftGrade()
                    + (need > 0 ? need * NEED_WEIGHT : NO_NEED_PENALTY)
                    + ctx.rnd().nextIntInclusive(-5, 5);
            if (score > bestScore) {
                bestScore = score;
                best = i;
            }
        }
        return best;
    }
}
