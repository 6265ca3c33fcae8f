package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.generators.PlayerConstraints;
import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Position;
import com.gnovoa.gridiron.model.RosterNeeds;
import com.gnovoa.gridiron.model.SkillTier;
import com.gnovoa.gridiron.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Brings every roster to exactly the roster limit.
 *
 * <p>First drops ids that no longer point at a player signed to this team. Rosters over the limit
 * cut their least valuable players (tier, then overall), releasing the contracts; the unamortised
 * bonus is charged as dead cap. Short rosters are filled with generated players at the positions
 * they lack.
 */
public final class RosterMaintenanceStage implements OffseasonStage {

    private static final Logger log = LoggerFactory.getLogger(RosterMaintenanceStage.class);

    static final double BACKUP_FILL_CHANCE = 0.2;

    private static final Comparator<Player> MOST_VALUABLE_FIRST = Comparator
            .comparingInt((Player p) -> p.tier().rank()).reversed()
            .thenComparing(Comparator.comparingInt(Player::overall).reversed())
            .thenComparing(Player::playerId);

    @Override
    public String name() { return "roster-maintenance"; }

    @Override
    public OffseasonStep apply(OffseasonStep step, OffseasonContext ctx) {
        LeagueState state = step.state();
        int year = ctx.draftYear();
        int limit = ctx.settings().rosterLimit();

        Map<String, Player> players = new LinkedHashMap<>(state.players());
        Map<String, Contract> contracts = new LinkedHashMap<>(state.contracts());
        Map<String, Team> teams = new LinkedHashMap<>();
        List<Release> releases = new ArrayList<>();
        List<String> generated = new ArrayList<>();

        for (Team team : state.teams().values()) {
            List<Player> roster = validRoster(team, players, contracts);

            if (roster.size() > limit) {
                roster.sort(MOST_VALUABLE_FIRST);
                for (Player cut : new ArrayList<>(roster.subList(limit, roster.size()))) {
                    Contract c = contracts.remove(cut.contractId());
                    long dead = c == null ? 0 : c.remainingProration(year);
                    players.put(cut.playerId(), cut.unsigned());
                    releases.add(new Release(cut.playerId(), team.teamId(), cut.contractId(), dead));
                }
                roster = new ArrayList<>(roster.subList(0, limit));
            }

            if (roster.size() < limit) {
                Map<Position, Integer> needs = new LinkedHashMap<>(RosterNeeds.deficits(roster));
                int filler = 0;
                while (roster.size() < limit) {
                    Position pos = nextNeed(needs);
                    if (pos == null) pos = RosterNeeds.FILLER_ROTATION.get(filler++ % RosterNeeds.FILLER_ROTATION.size());
                    SkillTier tier = ctx.rnd().chance(BACKUP_FILL_CHANCE) ? SkillTier.BACKUP : SkillTier.FRINGE;

                    Player p = ctx.players().generatePlayer(PlayerConstraints.of(pos, tier, 22, 28));
                    Contract c = ctx.contracts().generateContract(p, team.teamId(), year);
                    p = p.withContract(c.contractId());
                    players.put(p.playerId(), p);
                    contracts.put(c.contractId(), c);
                    roster.add(p);
                    generated.add(p.playerId());
                }
            }

            teams.put(team.teamId(), team.withRoster(roster.stream().map(Player::playerId).toList()));
        }

        if (!releases.isEmpty() || !generated.isEmpty()) {
            log.debug("Roster maintenance {}: {} cut, {} generated", year, releases.size(), generated.size());
        }

        LeagueState next = state.withPlayers(players).withContracts(contracts).withTeams(teams);
        return new OffseasonStep(next, step.report().withRosterMaintenance(releases, generated));
    }

    /** Roster ids that resolve to a player whose contract is with this team; duplicates dropped. */
    private static List<Player> validRoster(Team team, Map<String, Player> players, Map<String, Contract> contracts) {
        List<Player> roster = new ArrayList<>();
        for (String id : new LinkedHashSet<>(team.rosterPlayerIds())) {
            Player p = players.get(id);
            if (p == null || !p.isSigned()) continue;
            Contract c = contracts.get(p.contractId());
            if (c == null || !team.teamId().equals(c.teamId())) continue;
            roster.add(p);
        }
        return roster;
    }

    private static Position nextNeed(Map<Position, Integer> needs) {
        for (var e : needs.entrySet()) {
            if (e.getValue() > 0) {
                e.setValue(e.getValue() - 1);
                return e.getKey();
            }
        }
        return null;
    }
}
