package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.TestLeagues;
import com.gnovoa.gridiron.model.HistoricalSeasonSummary;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamRecord;
import com.gnovoa.gridiron.sim.SeededRandomSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeagueHistorySimulatorTest {

    private final LeagueHistorySimulator simulator = new LeagueHistorySimulator();

    @Test
    @DisplayName("Three years of history end at the following start year with a ready league")
    void threeYears() {
        LeagueState league = TestLeagues.league(7, 2022);

        HistoryResult result = simulator.simulate(league, HistoryConfig.ofYears(3), new SeededRandomSource(7));
        LeagueState s = result.finalState();

        assertThat(result.summaries()).extracting(HistoricalSeasonSummary::year).containsExactly(2022, 2023, 2024);
        assertThat(s.year()).isEqualTo(2025);
        assertThat(s.seasonHistory()).isEqualTo(result.summaries());
        assertThat(s.schedule().year()).isEqualTo(2025);
        assertThat(s.schedule().isComplete()).isFalse();
        assertThat(s.draftPicks()).hasSize(7 * 32).allMatch(p -> p.year() == 2026 && !p.isUsed());
        assertThat(s.draftClass()).isNotEmpty().allMatch(p -> p.draftYear() == 2026);
        assertThat(result.totals().draftPicks()).isEqualTo(3 * 7 * 32);
        assertThat(result.totals().retirements()).isPositive();

        for (Team t : s.teams().values()) {
            assertThat(t.currentRecord()).isEqualTo(TeamRecord.EMPTY);
            assertThat(t.allTimeRecord().games()).isEqualTo(3 * 17);
            assertThat(t.rosterSize()).isEqualTo(53);
            assertThat(t.playoffSeed()).isNull();
        }
        assertThat(new LeagueInvariants(53).violations(s)).isEmpty();
    }

    @Test
    @DisplayName("All-time records balance and every season crowns exactly one champion")
    void recordsBalance() {
        HistoryResult result = simulator.simulate(TestLeagues.league(3, 2020), HistoryConfig.ofYears(5), new SeededRandomSource(3));

        int wins = 0;
        int losses = 0;
        int titles = 0;
        for (Team t : result.finalState().teams().values()) {
            wins += t.allTimeRecord().wins();
            losses += t.allTimeRecord().losses();
            titles += t.championships();
        }
        assertThat(wins).isEqualTo(losses);
        assertThat(titles).isEqualTo(5);
        for (HistoricalSeasonSummary summary : result.summaries()) {
            assertThat(summary.playoffTeamIds()).hasSize(14).contains(summary.championTeamId(), summary.runnerUpTeamId());
            assertThat(summary.draftOrder()).hasSize(32);
            assertThat(summary.draftOrder().get(31)).isEqualTo(summary.championTeamId());
            assertThat(result.finalState().team(summary.championTeamId()).lastChampionshipYear())
                    .isGreaterThanOrEqualTo(summary.year());
        }
        HistoricalSeasonSummary last = result.summaries().get(result.summaries().size() - 1);
        assertThat(result.finalState().team(last.championTeamId()).lastChampionshipYear()).isEqualTo(last.year());
        assertThat(result.finalState().teams().values())
                .filteredOn(t -> t.championships() == 0)
                .allMatch(t -> t.lastChampionshipYear() == null);
    }

    @Test
    @DisplayName("The same league and seed replay the same history")
    void seededRunsRepeat() {
        HistoryResult first = simulator.simulate(TestLeagues.league(5, 2024), HistoryConfig.ofYears(2), new SeededRandomSource(99));
        HistoryResult second = simulator.simulate(TestLeagues.league(5, 2024), HistoryConfig.ofYears(2), new SeededRandomSource(99));

        assertThat(second.summaries()).isEqualTo(first.summaries());
        assertThat(second.totals()).isEqualTo(first.totals());
        assertThat(second.finalState().players().keySet()).isEqualTo(first.finalState().players().keySet());
    }

    @Test
    @DisplayName("Progress is reported for each season and offseason in order")
    void progressIsReported() {
        List<String> events = new ArrayList<>();

        simulator.simulate(TestLeagues.league(8, 2024), HistoryConfig.ofYears(2), new SeededRandomSource(8),
                (year, total, phase) -> events.add(year + "/" + total + " " + phase), CancellationToken.none());

        assertThat(events).containsExactly("1/2 SEASON", "1/2 OFFSEASON", "2/2 SEASON", "2/2 OFFSEASON");
    }

    @Test
    @DisplayName("Cancelling stops the run before the next season")
    void cancellationStopsTheRun() {
        CancellationToken token = new CancellationToken();
        ProgressListener cancelAfterFirstOffseasonStarts = (year, total, phase) -> {
            if (phase == HistoryPhase.OFFSEASON) token.cancel();
        };

        assertThatThrownBy(() -> simulator.simulate(TestLeagues.league(9, 2024), HistoryConfig.ofYears(3),
                new SeededRandomSource(9), cancelAfterFirstOffseasonStarts, token))
                .isInstanceOf(HistoryCancelledException.class)
                .extracting(e -> ((HistoryCancelledException) e).completedYears())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("An already cancelled token stops the run before anything is played")
    void preCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> simulator.simulate(TestLeagues.league(10, 2024), HistoryConfig.ofYears(1),
                new SeededRandomSource(10), ProgressListener.NONE, token))
                .isInstanceOf(HistoryCancelledException.class)
                .hasMessageContaining("0 completed");
    }

    @Test
    @DisplayName("Zero years only prepares the league for its current year")
    void zeroYears() {
        LeagueState league = TestLeagues.league(11, 2025);

        HistoryResult result = simulator.simulate(league, HistoryConfig.ofYears(0), new SeededRandomSource(11));

        assertThat(result.summaries()).isEmpty();
        assertThat(result.totals()).isEqualTo(HistoryTotals.ZERO);
        assertThat(result.finalState().year()).isEqualTo(2025);
        assertThat(result.finalState().schedule().games()).hasSize(32 * 17 / 2);
        assertThat(result.finalState().draftPicks()).hasSize(7 * 32);
    }

    @Test
    @DisplayName("Folding credits the champion and adds the season to the all-time record")
    void foldRecords() {
        LeagueState league = TestLeagues.league(12, 2025);
        String champ = league.teams().keySet().iterator().next();
        LeagueState played = LeagueHistorySimulator.resetRecords(league);
        Map<String, Team> teams = new LinkedHashMap<>(played.teams());
        teams.put(champ, teams.get(champ).withCurrentRecord(new TeamRecord(13, 4, 0, 420, 300)));

        LeagueState folded = LeagueHistorySimulator.foldRecords(played.withTeams(teams), champ);

        assertThat(folded.team(champ).championships()).isEqualTo(1);
        assertThat(folded.team(champ).lastChampionshipYear()).isEqualTo(2025);
        assertThat(folded.team(champ).allTimeRecord()).isEqualTo(new TeamRecord(13, 4, 0, 420, 300));
        assertThat(folded.team(champ).currentRecord().wins()).isEqualTo(13);
        assertThat(folded.teams().values()).filteredOn(t -> !t.teamId().equals(champ)).allMatch(t -> t.championships() == 0 && t.lastChampionshipYear() == null);
    }
}
