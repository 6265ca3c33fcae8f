package com.gnovoa.gridiron.runner;

import com.gnovoa.gridiron.catalog.SimProperties;
import com.gnovoa.gridiron.catalog.TeamCatalog;
import com.gnovoa.gridiron.events.HistoryProgressEvent;
import com.gnovoa.gridiron.history.CancellationToken;
import com.gnovoa.gridiron.history.HistoryCancelledException;
import com.gnovoa.gridiron.history.HistoryConfig;
import com.gnovoa.gridiron.history.HistoryPhase;
import com.gnovoa.gridiron.history.HistoryResult;
import com.gnovoa.gridiron.history.LeagueEngine;
import com.gnovoa.gridiron.history.LeagueFactory;
import com.gnovoa.gridiron.history.LeagueHistorySimulator;
import com.gnovoa.gridiron.model.LeagueState;
import com.gnovoa.gridiron.out.EventPublisher;
import com.gnovoa.gridiron.sim.LocalRandomSource;
import com.gnovoa.gridiron.sim.RandomSource;
import com.gnovoa.gridiron.sim.SeededRandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * One history run on its own thread: builds a fresh league from the team catalog, simulates the
 * requested years up to the configured start year and keeps the result for the API.
 */
public final class HistoryRunner {

    private static final Logger log = LoggerFactory.getLogger(HistoryRunner.class);

    private final String runId;
    private final int years;
    private final Long seed;
    private final int startYear;
    private final TeamCatalog catalog;
    private final SimProperties sim;
    private final LeagueHistorySimulator simulator;
    private final EventPublisher publisher;

    private final ExecutorService exec;
    private final CancellationToken token = new CancellationToken();

    private volatile RunnerState state = RunnerState.IDLE;
    private volatile int yearIndex;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile String message;
    private volatile HistoryResult result;

    public HistoryRunner(String runId, int years, Long seed, int startYear, TeamCatalog catalog, SimProperties sim,
                         LeagueHistorySimulator simulator, EventPublisher publisher) {
        if (years < 1) throw new IllegalArgumentException("A run needs at least one year, got " + years);
        this.runId = runId;
        this.years = years;
        this.seed = seed;
        this.startYear = startYear;
        this.catalog = catalog;
        this.sim = sim;
        this.simulator = simulator;
        this.publisher = publisher;
        this.exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "history-" + runId);
            t.setDaemon(true);
            return t;
        });
    }

    public String runId() { return runId; }

    public synchronized void start() {
        if (state != RunnerState.IDLE) return;
        state = RunnerState.RUNNING_SEASON;
        startedAt = Instant.now();
        exec.submit(this::run);
    }

    /** Asks the run to stop at the next season or offseason boundary. */
    public synchronized void cancel() {
        if (state.isFinished()) return;
        token.cancel();
        if (state == RunnerState.IDLE) {
            finish(RunnerState.CANCELLED, "Cancelled before start", null);
            exec.shutdown();
        }
    }

    public synchronized RunnerStatus status() {
        int currentYear = state == RunnerState.DONE ? startYear : startYear - years + Math.max(0, yearIndex - 1);
        return new RunnerStatus(runId, state, years, seed, yearIndex, currentYear, startedAt, finishedAt, message);
    }

    /** The finished history, or null while the run has not completed successfully. */
    public HistoryResult result() {
        return result;
    }

    private void run() {
        try {
            RandomSource rnd = seed == null ? new LocalRandomSource() : new SeededRandomSource(seed);
            HistoryConfig config = sim.historyConfig(years);
            LeagueState league = new LeagueFactory(LeagueEngine.create(rnd, config)).create(catalog.teams(), startYear - years);

            log.info("Run {} started: {} year(s) up to {}, seed {}", runId, years, startYear, seed);
            HistoryResult r = simulator.simulate(league, config, rnd, this::onProgress, token);

            result = r;
            finish(RunnerState.DONE, null, Map.of("seasons", r.summaries().size()));
            log.info("Run {} done", runId);
        } catch (HistoryCancelledException e) {
            finish(RunnerState.CANCELLED, e.getMessage(), Map.of("completedYears", e.completedYears()));
            log.info("Run {} cancelled after {} year(s)", runId, e.completedYears());
        } catch (RuntimeException e) {
            finish(RunnerState.FAILED, e.getMessage(), null);
            log.error("Run {} failed", runId, e);
        } finally {
            exec.shutdown();
        }
    }

    private void onProgress(int index, int total, HistoryPhase phase) {
        synchronized (this) {
            yearIndex = index;
            state = phase == HistoryPhase.SEASON ? RunnerState.RUNNING_SEASON : RunnerState.RUNNING_OFFSEASON;
        }
        publisher.publish(new HistoryProgressEvent(runId, Instant.now(), state, index, total, phase, Map.of()));
    }

    private void finish(RunnerState finalState, String why, Map<String, Object> data) {
        synchronized (this) {
            if (state.isFinished()) return;
            state = finalState;
            message = why;
            finishedAt = Instant.now();
        }
        publisher.publish(new HistoryProgressEvent(runId, finishedAt, finalState, yearIndex, years, null,
                data == null ? Map.of() : data));
    }
}
