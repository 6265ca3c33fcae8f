package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.history.HistoryConfig;
import com.gnovoa.gridiron.history.LeagueEngine;
import com.gnovoa.gridiron.history.LeagueHistorySimulator;
import com.gnovoa.gridiron.model.Coach;
import com.gnovoa.gridiron.model.CoachRole;
import com.gnovoa.gridiron.model.CoachingStaff;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamRecord;
import com.gnovoa.gridiron.sim.SeededRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CoachingStageTest {

    @Test
    @DisplayName("Losing records put the head coach at far greater risk than winning ones")
    void firingOddsFollowRecord() {
        double awful = CoachingStage.firingChance(2 / 17.0);
        double winning = CoachingStage.firingChance(12 / 17.0);

        assertThat(awful).isGreaterThan(0.5);
        assertThat(winning).isZero();
        assertThat(CoachingStage.firingChance(7 / 17.0)).isBetween(winning, awful);
    }

    @Test
    @DisplayName("A 2-15 team changes coaches far more often than a 12-5 team across repeated offseasons")
    void losingTeamTurnsOverStaffMoreOften() {
        OffseasonFixture f = new OffseasonFixture(43);
        Map<String, Team> teams = new LinkedHashMap<>(f.state.teams());
        var it = teams.keySet().iterator();
        String loser = it.next();
        String winner = it.next();
        teams.put(loser, teams.get(loser).withCurrentRecord(new TeamRecord(2, 15, 0, 240, 430)));
        teams.put(winner, teams.get(winner).withCurrentRecord(new TeamRecord(12, 5, 0, 410, 300)));
        LeagueState season = LeagueHistorySimulator.foldRecords(f.state.withTeams(teams), winner);

        int loserHeadChanges = 0;
        int winnerHeadChanges = 0;
        int loserStaffChanges = 0;
        int winnerStaffChanges = 0;
        for (long seed = 1; seed <= 300; seed++) {
            LeagueEngine engine = LeagueEngine.create(new SeededRandomSource(seed), HistoryConfig.ofYears(1), season);
            OffseasonStep out = new CoachingStage().apply(OffseasonStep.start(season),
                    engine.offseasonContext(OffseasonFixture.SEASON, f.ctx.draftOrder()));

            for (CoachingChange ch : out.report().coachingChanges()) {
                boolean head = ch.role() == CoachRole.HEAD_COACH;
                if (ch.teamId().equals(loser)) {
                    loserStaffChanges++;
                    if (head) loserHeadChanges++;
                } else if (ch.teamId().equals(winner)) {
                    winnerStaffChanges++;
                    if (head) winnerHeadChanges++;
                }
            }
        }

        // 2-15 fires the head coach 80% of the time; 12-5 never fires and always renews
        assertThat(loserHeadChanges).isGreaterThan(200);
        assertThat(winnerHeadChanges).isZero();
        assertThat(loserStaffChanges).isGreaterThan(loserHeadChanges);
        assertThat(loserStaffChanges).isGreaterThan(3 * Math.max(1, winnerStaffChanges));
    }

    @Test
    @DisplayName("Every team leaves the stage with three employed coaches in the right roles")
    void staffsAreComplete() {
        OffseasonFixture f = new OffseasonFixture(41);
        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : f.state.teams().values()) teams.put(t.teamId(), t.withCurrentRecord(new TeamRecord(1, 16, 0, 200, 450)));
        Team vacant = f.state.teams().values().iterator().next();
        teams.put(vacant.teamId(), teams.get(vacant.teamId()).withStaff(CoachingStaff.VACANT));

        OffseasonStep out = new CoachingStage().apply(OffseasonStep.start(f.state.withTeams(teams)), f.ctx);
        LeagueState s = out.state();

        for (Team t : s.teams().values()) {
            for (CoachRole role : CoachRole.values()) {
                Coach c = s.coaches().get(t.staff().coachFor(role));
                assertThat(c).as("%s %s", t.teamId(), role).isNotNull();
                assertThat(c.role()).isEqualTo(role);
                assertThat(c.teamId()).isEqualTo(t.teamId());
            }
        }
        assertThat(out.report().coachingChanges())
                .filteredOn(ch -> ch.teamId().equals(vacant.teamId()))
                .hasSize(3)
                .allMatch(ch -> ch.reason() == CoachingChange.Reason.VACANCY && ch.outgoingCoachId() == null);
        assertThat(out.report().coachingChanges())
                .anyMatch(ch -> ch.reason() == CoachingChange.Reason.FIRED && ch.role() == CoachRole.HEAD_COACH);
    }

    @Test
    @DisplayName("Fired coaches stay in the league as unemployed")
    void firedCoachesAreReleased() {
        OffseasonFixture f = new OffseasonFixture(42);
        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : f.state.teams().values()) teams.put(t.teamId(), t.withCurrentRecord(new TeamRecord(0, 17, 0, 150, 500)));

        OffseasonStep out = new CoachingStage().apply(OffseasonStep.start(f.state.withTeams(teams)), f.ctx);

        for (CoachingChange ch : out.report().coachingChanges()) {
            if (ch.outgoingCoachId() == null) continue;
            Coach gone = out.state().coaches().get(ch.outgoingCoachId());
            if (gone != null) assertThat(gone.teamId()).isNotEqualTo(ch.teamId());
        }
    }
}
