package com.gnovoa.gridiron.draft;

import com.gnovoa.gridiron.TestLeagues;
import com.gnovoa.gridiron.model.DraftPick;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamRecord;
import com.gnovoa.gridiron.playoffs.PlayoffBracket;
import com.gnovoa.gridiron.playoffs.PlayoffGenerator;
import com.gnovoa.gridiron.playoffs.PlayoffMatchup;
import com.gnovoa.gridiron.playoffs.PlayoffRound;
import com.gnovoa.gridiron.standings.LeagueStandings;
import com.gnovoa.gridiron.standings.StandingsCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DraftOrderCalculatorTest {

    private final DraftOrderCalculator calculator = new DraftOrderCalculator();
    private final PlayoffGenerator playoffs = new PlayoffGenerator();
    private List<Team> teams;
    private LeagueStandings standings;

    @BeforeEach
    void setUp() {
        teams = TestLeagues.teams();
        standings = new StandingsCalculator().calculate(2025, List.of(), teams);
    }

    private PlayoffBracket completedBracket() {
        PlayoffBracket b = playoffs.seed(standings);
        while (!b.isComplete()) {
            b = playoffs.advance(b);
            for (PlayoffMatchup m : b.currentMatchups()) b = playoffs.recordResult(b, m.matchupId(), 27, 20);
        }
        return b;
    }

    @Test
    @DisplayName("Complete season: non-qualifiers first, champion last, runner-up second to last")
    void orderFromCompletedSeason() {
        PlayoffBracket bracket = completedBracket();

        DraftOrder order = calculator.calculate(standings, bracket, teams);

        assertThat(order.size()).isEqualTo(32);
        assertThat(order.teamIds()).doesNotHaveDuplicates();
        assertThat(order.usedFallback()).isFalse();
        assertThat(order.teamIds().get(31)).isEqualTo(bracket.championId());
        assertThat(order.teamIds().get(30)).isEqualTo(bracket.runnerUpId());
        assertThat(order.teamIds().subList(0, 18)).doesNotContainAnyElementsOf(bracket.participants());
        assertThat(order.positionOf(bracket.championId())).isEqualTo(32);
    }

    @Test
    @DisplayName("Wild card losers pick before divisional losers")
    void eliminationRoundOrder() {
        PlayoffBracket bracket = completedBracket();
        DraftOrder order = calculator.calculate(standings, bracket, teams);

        for (PlayoffMatchup wc : bracket.matchupsIn(PlayoffRound.WILD_CARD)) {
            for (PlayoffMatchup div : bracket.matchupsIn(PlayoffRound.DIVISIONAL)) {
                assertThat(order.positionOf(wc.loserId())).isLessThan(order.positionOf(div.loserId()));
            }
        }
    }

    @Test
    @DisplayName("Without a bracket every team is ordered by record alone")
    void noBracket() {
        PartialDraftOrder primary = calculator.computePrimary(standings, null);
        DraftOrder order = calculator.calculate(standings, null, teams);

        assertThat(primary.teamIds()).hasSize(32);
        assertThat(order.usedFallback()).isFalse();
        assertThat(order.teamIds()).isEqualTo(primary.teamIds());
    }

    @Test
    @DisplayName("An unfinished bracket leaves playoff teams out; reconcile appends them")
    void unfinishedBracketFallsBack() {
        PlayoffBracket seededOnly = playoffs.seed(standings);

        PartialDraftOrder primary = calculator.computePrimary(standings, seededOnly);
        DraftOrder order = calculator.reconcile(primary, teams);

        assertThat(primary.teamIds()).hasSize(18);
        assertThat(order.size()).isEqualTo(32);
        assertThat(order.usedFallback()).isTrue();
        assertThat(order.toppedUp()).hasSize(14).containsExactlyInAnyOrderElementsOf(seededOnly.participants());
    }

    @Test
    @DisplayName("Reconcile drops unknown and repeated ids and appends missing teams by win percentage")
    void reconcileCleansInput() {
        Team good = TestLeagues.genericTeams(1).get(0).withCurrentRecord(new TeamRecord(10, 7, 0, 400, 350));
        Team bad = new Team("bad", "B", "B", "B", good.conference(), good.division(), List.of(),
                new TeamRecord(3, 14, 0, 250, 420), null, 0, null, null, null, null);
        Team unplayed = new Team("new", "N", "N", "N", good.conference(), good.division(), List.of(),
                null, null, 0, null, null, null, null);
        Team fine = new Team("fine", "F", "F", "F", good.conference(), good.division(), List.of(),
                new TeamRecord(12, 5, 0, 400, 300), null, 0, null, null, null, null);

        PartialDraftOrder junk = new PartialDraftOrder(2025, List.of("ghost", good.teamId(), good.teamId()));
        DraftOrder order = calculator.reconcile(junk, List.of(good, bad, unplayed, fine));

        assertThat(order.teamIds()).containsExactly(good.teamId(), "bad", "new", "fine");
        assertThat(order.toppedUp()).containsExactly("bad", "new", "fine");
    }

    @Test
    @DisplayName("Every round repeats the order and overall picks run continuously")
    void picksFollowOrder() {
        DraftOrder order = calculator.calculate(standings, completedBracket(), teams);

        List<DraftPick> picks = new DraftPickFactory().createPicks(order, 2026, 7);

        assertThat(picks).hasSize(7 * 32);
        assertThat(picks.get(0).currentTeamId()).isEqualTo(order.teamIds().get(0));
        assertThat(picks.get(32).round()).isEqualTo(2);
        assertThat(picks.get(32).currentTeamId()).isEqualTo(order.teamIds().get(0));
        assertThat(picks.get(223).overallPick()).isEqualTo(224);
        assertThat(picks).allMatch(p -> p.year() == 2026 && !p.isUsed());
    }
}
