package com.gnovoa.gridiron.sim;

import com.gnovoa.gridiron.TestLeagues;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.SeasonSchedule;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.schedule.DivisionFinishOrder;
import com.gnovoa.gridiron.schedule.RoundRobinScheduler;
import com.gnovoa.gridiron.schedule.ScheduleGenerator;
import com.gnovoa.gridiron.schedule.ScheduleValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeasonSimulatorTest {

    private static LeagueState scheduledLeague(long seed) {
        LeagueState league = TestLeagues.league(seed, 2025);
        List<Team> teams = List.copyOf(league.teams().values());
        SeasonSchedule schedule = new ScheduleGenerator(new SeededRandomSource(seed), new RoundRobinScheduler(),
                new ScheduleValidator(), 6).generate(teams, DivisionFinishOrder.fromTeamRecords(teams), 2025);
        return league.withSchedule(schedule);
    }

    private static SeasonSimulator simulator(RandomSource rnd) {
        return new SeasonSimulator(rnd, new QuickGameSimulator(rnd), new TeamStrengthCalculator());
    }

    @Test
    @DisplayName("Every game is played and every team finishes with 17 decisions")
    void playsFullSeason() {
        LeagueState played = simulator(new SeededRandomSource(1)).simulateRegularSeason(scheduledLeague(1));

        assertThat(played.schedule().isComplete()).isTrue();
        for (Team t : played.teams().values()) {
            assertThat(t.currentRecord().games()).isEqualTo(SeasonSchedule.GAMES_PER_TEAM);
        }
    }

    @Test
    @DisplayName("League-wide wins equal losses")
    void winsEqualLosses() {
        LeagueState played = simulator(new SeededRandomSource(2)).simulateRegularSeason(scheduledLeague(2));

        int wins = played.teams().values().stream().mapToInt(t -> t.currentRecord().wins()).sum();
        int losses = played.teams().values().stream().mapToInt(t -> t.currentRecord().losses()).sum();
        int pointsFor = played.teams().values().stream().mapToInt(t -> t.currentRecord().pointsFor()).sum();
        int pointsAgainst = played.teams().values().stream().mapToInt(t -> t.currentRecord().pointsAgainst()).sum();

        assertThat(wins).isEqualTo(losses);
        assertThat(pointsFor).isEqualTo(pointsAgainst);
    }

    @Test
    @DisplayName("A league without a schedule cannot be simulated")
    void requiresSchedule() {
        LeagueState league = TestLeagues.league(3, 2025);
        assertThatThrownBy(() -> simulator(new SeededRandomSource(3)).simulateRegularSeason(league))
                .isInstanceOf(IllegalStateException.class);
    }
}
