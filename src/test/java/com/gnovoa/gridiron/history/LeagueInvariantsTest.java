package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.TestLeagues;
import com.gnovoa.gridiron.draft.DraftOrder;
import com.gnovoa.gridiron.draft.DraftPickFactory;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamFinances;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeagueInvariantsTest {

    private static LeagueState league;
    private final LeagueInvariants invariants = new LeagueInvariants(53);

    @BeforeAll
    static void buildLeague() {
        league = TestLeagues.league(4, 2025);
    }

    private static LeagueState replace(Team team) {
        Map<String, Team> teams = new LinkedHashMap<>(league.teams());
        teams.put(team.teamId(), team);
        return league.withTeams(teams);
    }

    private static List<Team> teams() {
        return new ArrayList<>(league.teams().values());
    }

    @Test
    @DisplayName("A freshly created league is sound")
    void freshLeagueIsSound() {
        assertThat(invariants.violations(league)).isEmpty();
    }

    @Test
    @DisplayName("A missing team is reported")
    void teamCount() {
        Map<String, Team> teams = new LinkedHashMap<>(league.teams());
        teams.remove(teams().get(0).teamId());

        assertThat(invariants.violations(league.withTeams(teams))).anyMatch(v -> v.contains("31 teams"));
    }

    @Test
    @DisplayName("Oversized rosters, unknown players and doubly rostered players are reported")
    void rosterProblems() {
        Team first = teams().get(0);
        Team second = teams().get(1);
        List<String> roster = new ArrayList<>(first.rosterPlayerIds());
        roster.add(second.rosterPlayerIds().get(0));
        roster.add("player-unknown");

        List<String> problems = invariants.violations(replace(first.withRoster(roster)));

        assertThat(problems).anyMatch(v -> v.contains("carries 55 players"));
        assertThat(problems).anyMatch(v -> v.contains("unknown player player-unknown"));
        assertThat(problems).anyMatch(v -> v.contains("is on the rosters of"));
    }

    @Test
    @DisplayName("Cap usage that disagrees with the contracts is reported and verify throws")
    void capMismatch() {
        Team first = teams().get(0);
        TeamFinances f = first.finances();
        TeamFinances wrong = new TeamFinances(f.year(), f.salaryCap(), f.capUsage() + 1, f.deadCap(), f.capSpace() - 1,
                f.nextYearCommitted(), f.twoYearsOutCommitted(), f.threeYearsOutCommitted());
        LeagueState broken = replace(first.withFinances(wrong));

        assertThat(invariants.violations(broken)).anyMatch(v -> v.contains("reports cap usage"));
        assertThatThrownBy(() -> invariants.verify(broken)).isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("invariant");
    }

    @Test
    @DisplayName("A draft round missing a team is reported")
    void incompleteDraftRound() {
        LeagueState withPicks = league.withDraftPicks(new DraftPickFactory().createPicks(
                new DraftOrder(2026, teams().stream().skip(1).map(Team::teamId).toList(), List.of()),
                2026, 1));

        assertThat(invariants.violations(withPicks)).anyMatch(v -> v.contains("Draft round 1"));
    }
}
