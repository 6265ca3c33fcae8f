package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.draft.DraftOrder;
import com.gnovoa.gridiron.draft.PartialDraftOrder;
import com.gnovoa.gridiron.model.HistoricalSeasonSummary;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.model.Team;
import com.gnovoa.gridiron.model.TeamRecord;
import com.gnovoa.gridiron.offseason.OffseasonStep;
import com.gnovoa.gridiron.schedule.DivisionFinishOrder;
import com.gnovoa.gridiron.sim.LocalRandomSource;
import com.gnovoa.gridiron.sim.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simulates years of league history.
 *
 * <p>A league created at year Y and simulated for N years plays seasons Y to Y+N-1, each followed
 * by a full offseason. The returned league sits at the start year Y+N with empty records, the
 * schedule for that year, a draft class and picks for the next draft, and every structural
 * invariant checked.
 */
public final class LeagueHistorySimulator {

    private static final Logger log = LoggerFactory.getLogger(LeagueHistorySimulator.class);

    public HistoryResult simulate(LeagueState state, HistoryConfig config) {
        return simulate(state, config, new LocalRandomSource(), ProgressListener.NONE, CancellationToken.none());
    }

    public HistoryResult simulate(LeagueState state, HistoryConfig config, RandomSource rnd) {
        return simulate(state, config, rnd, ProgressListener.NONE, CancellationToken.none());
    }

    /**
     * @throws HistoryCancelledException if {@code token} is cancelled; checked before every season
     *     and every offseason
     * @throws IllegalStateException if the resulting league breaks a structural invariant
     */
    public HistoryResult simulate(LeagueState state, HistoryConfig config, RandomSource rnd,
                                  ProgressListener listener, CancellationToken token) {
        LeagueEngine engine = LeagueEngine.create(rnd, config, state);
        SeasonCycle cycle = new SeasonCycle(engine);

        int years = config.years();
        int startYear = state.year() + years;
        log.info("Simulating {} year(s) of history ({} to {})", years, state.year(), startYear - 1);

        LeagueState current = state;
        DivisionFinishOrder previous = DivisionFinishOrder.fromTeamRecords(current.teams().values());
        DraftOrder lastOrder = null;
        List<HistoricalSeasonSummary> summaries = new ArrayList<>();
        HistoryTotals totals = HistoryTotals.ZERO;

        for (int i = 0; i < years; i++) {
            token.throwIfCancelled(i);
            listener.onProgress(i + 1, years, HistoryPhase.SEASON);

            SeasonOutcome outcome = cycle.play(resetRecords(current), previous);
            HistoricalSeasonSummary summary = summarize(outcome);
            summaries.add(summary);
            log.info("{} champion: {} ({}), runner-up {}", summary.year(), summary.championTeamId(),
                    summary.championRecord(), summary.runnerUpTeamId());

            List<HistoricalSeasonSummary> history = new ArrayList<>(outcome.state().seasonHistory());
            history.add(summary);
            current = foldRecords(outcome.state(), outcome.championId()).withSeasonHistory(history);

            token.throwIfCancelled(i);
            listener.onProgress(i + 1, years, HistoryPhase.OFFSEASON);

            OffseasonStep step = engine.offseason().process(current, engine.offseasonContext(current.year(), outcome.draftOrder()));
            totals = totals.plus(step.report());

            current = step.state().withYear(current.year() + 1);
            previous = outcome.standings().divisionFinishOrder();
            lastOrder = outcome.draftOrder();
        }

        LeagueState result = prepareStartYear(current, startYear, previous, lastOrder, engine);
        new LeagueInvariants(config.settings().rosterLimit()).verify(result);

        log.info("History done: {} seasons, {} retirements, {} drafted, {} signings, {} coaching changes",
                summaries.size(), totals.retirements(), totals.draftPicks(), totals.freeAgencySignings(),
                totals.coachingChanges());
        return new HistoryResult(result, summaries, totals);
    }

    /** Calendar at the start year, fresh picks and class for the next draft, empty records and a new schedule. */
    private static LeagueState prepareStartYear(LeagueState state, int startYear, DivisionFinishOrder previous,
                                                DraftOrder lastOrder, LeagueEngine engine) {
        int nextDraft = startYear + 1;
        LeagueState reset = resetRecords(state.withYear(startYear));

        DraftOrder order = lastOrder != null
                ? lastOrder
                : engine.draftOrders().reconcile(new PartialDraftOrder(startYear, List.of()), reset.teams().values());

        return reset
                .withDraftPicks(engine.pickFactory().createPicks(order, nextDraft, engine.settings().draftRounds()))
                .withDraftClass(engine.draftClasses().generateDraftClass(nextDraft))
                .withSchedule(engine.schedules().generate(List.copyOf(reset.teams().values()), previous, startYear));
    }

    static LeagueState resetRecords(LeagueState state) {
        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            teams.put(t.teamId(), t.withCurrentRecord(TeamRecord.EMPTY).withPlayoffSeed(null));
        }
        return state.withTeams(teams);
    }

    /** Adds the season to every all-time record and credits the champion. Current records stay readable. */
    public static LeagueState foldRecords(LeagueState state, String championId) {
        Map<String, Team> teams = new LinkedHashMap<>();
        for (Team t : state.teams().values()) {
            Team folded = t.withAllTimeRecord(t.allTimeRecord().plus(t.currentRecord()));
            if (t.teamId().equals(championId)) folded = folded.withChampionshipWon(state.year());
            teams.put(t.teamId(), folded);
        }
        return state.withTeams(teams);
    }

    private static HistoricalSeasonSummary summarize(SeasonOutcome outcome) {
        String championId = outcome.championId();
        Team champion = outcome.state().team(championId);
        return new HistoricalSeasonSummary(
                outcome.state().year(),
                championId,
                champion == null ? TeamRecord.EMPTY : champion.currentRecord(),
                outcome.runnerUpId(),
                outcome.bracket().participants(),
                outcome.draftOrder().teamIds());
    }
}
