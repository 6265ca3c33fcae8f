package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts every contract down a year. A contract reaching zero is voided: its player becomes
 * unsigned, leaves the roster and is reported as a new free agent. Contracts of players who no
 * longer exist are voided silently.
 */
public final class ContractExpirationStage implements OffseasonStage {

    private static final Logger log = LoggerFactory.getLogger(ContractExpirationStage.class);

    @Override
    public String name() { return "contract-expiration"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();

        Map<String, Contract> contracts = new LinkedHashMap<>();
        Map<String, Player> players = new LinkedHashMap<>(state.players());
        List<String> voided = new ArrayList<>();
        List<String> freeAgents = new ArrayList<>();
        Set<String> leaving = new HashSet<>();

        for (Contract c : state.contracts().values()) {
            Player p = players.get(c.playerId());
            if (p == null) {
                log.debug("Voiding contract {} of missing player {}", c.contractId(), c.playerId());
                voided.add(c.contractId());
                continue;
            }
            int left = c.yearsRemaining() - 1;
            if (left > 0) {
                contracts.put(c.contractId(), c.withYearsRemaining(left));
                continue;
            }
            voided.add(c.contractId());
            if (c.contractId().equals(p.contractId())) {
                players.put(p.playerId(), p.unsigned());
                freeAgents.add(p.playerId());
                leaving.add(p.playerId());
            }
        }

        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            if (leaving.isEmpty()) {
                teams.put(t.teamId(), t);
                continue;
            }
            List<String> roster = t.rosterPlayerIds().stream().filter(id -> !leaving.contains(id)).toList();
            teams.put(t.teamId(), roster.size() == t.rosterSize() ? t : t.withRoster(roster));
        }

        LeagueState next = state.withContracts(contracts).withPlayers(players).withTeams(teams);
        return new OffseasonStep(next, step.report().withExpirations(voided, freeAgents));
    }
}
