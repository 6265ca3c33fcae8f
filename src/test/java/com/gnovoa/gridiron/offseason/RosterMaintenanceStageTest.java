package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.Contract;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Player;
import com.gnovoa.gridiron.model.Team;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RosterMaintenanceStageTest {

    private final RosterMaintenanceStage stage = new RosterMaintenanceStage();

    /** Moves the first {@code count} players of {@code from} to {@code to}, contracts included. */
    private static LeagueState transfer(LeagueState s, String from, String to, int count) {
        Team source = s.team(from);
        Team target = s.team(to);
        List<String> moved = source.rosterPlayerIds().subList(0, count);

        Map<String, Contract> contracts = new LinkedHashMap<>(s.contracts());
        for (String id : moved) {
            Contract c = contracts.get(s.player(id).contractId());
            contracts.put(c.contractId(), OffseasonFixture.movedTo(c, to));
        }
        List<String> bigger = new ArrayList<>(target.rosterPlayerIds());
        bigger.addAll(moved);

        Map<String, Team> teams = new LinkedHashMap<>(s.teams());
        teams.put(from, source.withRoster(source.rosterPlayerIds().subList(count, source.rosterSize())));
        teams.put(to, target.withRoster(bigger));
        return s.withTeams(teams).withContracts(contracts);
    }

    @Test
    @DisplayName("Oversized rosters are cut and short rosters filled to exactly the limit")
    void everyRosterEndsAtLimit() {
        OffseasonFixture f = new OffseasonFixture(11);
        String big = f.state.teams().keySet().stream().toList().get(0);
        String small = f.state.teams().keySet().stream().toList().get(1);
        LeagueState skewed = transfer(f.state, small, big, 17);
        assertThat(skewed.team(big).rosterSize()).isEqualTo(70);
        assertThat(skewed.team(small).rosterSize()).isEqualTo(36);

        OffseasonStep out = stage.apply(OffseasonStep.start(skewed), f.ctx);

        assertThat(out.state().teams().values()).allMatch(t -> t.rosterSize() == 53);
        assertThat(out.report().releases()).hasSize(17).allMatch(r -> r.teamId().equals(big));
        assertThat(out.report().generatedPlayerIds()).hasSize(17);
        assertThat(out.state().team(small).rosterPlayerIds()).containsAll(out.report().generatedPlayerIds());
        OffseasonFixture.assertRostersConsistent(out.state());
    }

    @Test
    @DisplayName("Cuts drop the weakest players, void their contracts and charge the remaining bonus as dead cap")
    void cutsChargeDeadCap() {
        OffseasonFixture f = new OffseasonFixture(12);
        String big = f.state.teams().keySet().stream().toList().get(0);
        String donor = f.state.teams().keySet().stream().toList().get(1);
        LeagueState skewed = transfer(f.state, donor, big, 10);

        OffseasonStep out = stage.apply(OffseasonStep.start(skewed), f.ctx);

        int weakestKept = out.state().team(big).rosterPlayerIds().stream()
                .map(out.state()::player)
                .mapToInt(p -> p.tier().rank())
                .min().orElseThrow();
        for (Release r : out.report().releases()) {
            Contract original = skewed.contracts().get(r.contractId());
            Player cut = out.state().player(r.playerId());
            assertThat(r.deadCap()).isEqualTo(original.remainingProration(f.ctx.draftYear()));
            assertThat(out.state().contracts()).doesNotContainKey(r.contractId());
            assertThat(cut.isSigned()).isFalse();
            assertThat(cut.tier().rank()).isLessThanOrEqualTo(weakestKept);
        }
    }

    @Test
    @DisplayName("Dangling, duplicated and foreign roster ids are removed before filling")
    void invalidIdsAreDropped() {
        OffseasonFixture f = new OffseasonFixture(13);
        Team team = f.state.teams().values().iterator().next();
        Team other = new ArrayList<>(f.state.teams().values()).get(5);

        List<String> messy = new ArrayList<>(team.rosterPlayerIds());
        messy.add("player-does-not-exist");
        messy.add(team.rosterPlayerIds().get(0));
        messy.add(other.rosterPlayerIds().get(0));
        Map<String, Team> teams = new LinkedHashMap<>(f.state.teams());
        teams.put(team.teamId(), team.withRoster(messy));

        OffseasonStep out = stage.apply(OffseasonStep.start(f.state.withTeams(teams)), f.ctx);

        List<String> roster = out.state().team(team.teamId()).rosterPlayerIds();
        assertThat(roster).hasSize(53).doesNotHaveDuplicates()
                .doesNotContain("player-does-not-exist", other.rosterPlayerIds().get(0));
        assertThat(out.report().releases()).isEmpty();
        OffseasonFixture.assertRostersConsistent(out.state());
    }
}
