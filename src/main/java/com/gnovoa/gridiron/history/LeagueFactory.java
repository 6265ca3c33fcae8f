package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.catalog.TeamDefinition;
import com.gnovoa.gridiron.generators.ContractGenerator.RosterContracts;
import com.gnovoa.gridiron.generators.PlayerConstraints;
import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.CoachRole;
import com.gnovoa.gridiron.model.CoachingStaff;
import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamFinances;
import com.gnovoa.gridiron.model.TeamRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a brand-new league: a full signed roster and a three-man staff for every franchise, a
 * small pool of unemployed coaches and unsigned veterans, and each team's opening cap picture.
 */
public final class LeagueFactory {

    private static final Logger log = LoggerFactory.getLogger(LeagueFactory.class);

    static final int FREE_AGENT_POOL = 40;
    static final int UNEMPLOYED_COACHES_PER_ROLE = 4;

    private final LeagueEngine engine;

    public LeagueFactory(LeagueEngine engine) {
        this.engine = engine;
    }

    /**
     * @param year first league year; contracts start here
     * @throws IllegalArgumentException if no teams are given
     */
    public LeagueState create(List<TeamDefinition> definitions, int year) {
        if (definitions.isEmpty()) throw new IllegalArgumentException("A league needs teams");

        Map<String, Player> players = new LinkedHashMap<>();
        Map<String, Contract> contracts = new LinkedHashMap<>();
        Map<String, Coach> coaches = new LinkedHashMap<>();
        Map<String, Team> teams = new LinkedHashMap<>();

        for (TeamDefinition def : definitions) {
            List<Player> roster = engine.players().generateRoster(def.teamId());
            RosterContracts signed = engine.contracts().generateRosterContracts(roster, def.teamId(), year);
            signed.updatedPlayers().forEach(p -> players.put(p.playerId(), p));
            signed.contracts().forEach(c -> contracts.put(c.contractId(), c));

            CoachingStaff staff = CoachingStaff.VACANT;
            for (CoachRole role : CoachRole.values()) {
                Coach coach = engine.coaches().generateCoach(role, def.teamId(), year);
                coaches.put(coach.coachId(), coach);
                staff = staff.with(role, coach.coachId());
            }

            long usage = engine.cap().capUsage(def.teamId(), signed.contracts(), year);
            long salaryCap = engine.settings().salaryCap();
            TeamFinances finances = new TeamFinances(year, salaryCap, usage, 0, salaryCap - usage,
                    engine.cap().futureCommitment(def.teamId(), signed.contracts(), year, 1),
                    engine.cap().futureCommitment(def.teamId(), signed.contracts(), year, 2),
                    engine.cap().futureCommitment(def.teamId(), signed.contracts(), year, 3));

            teams.put(def.teamId(), new Team(def.teamId(), def.city(), def.nickname(), def.abbreviation(),
                    def.conference(), def.division(), signed.updatedPlayers().stream().map(Player::playerId).toList(),
                    TeamRecord.EMPTY, TeamRecord.EMPTY, 0, null, null, finances, staff));
        }

        for (CoachRole role : CoachRole.values()) {
            for (int i = 0; i < UNEMPLOYED_COACHES_PER_ROLE; i++) {
                Coach coach = engine.coaches().generateCoach(role, null, year);
                coaches.put(coach.coachId(), coach);
            }
        }
        for (int i = 0; i < FREE_AGENT_POOL; i++) {
            Player p = engine.players().generatePlayer(PlayerConstraints.of(null, null, 24, 33));
            players.put(p.playerId(), p);
        }

        log.info("Created league {} with {} teams, {} players and {} coaches", year, teams.size(), players.size(), coaches.size());
        return new LeagueState(year, teams, players, contracts, coaches, List.of(), List.of(), null, List.of());
    }
}
