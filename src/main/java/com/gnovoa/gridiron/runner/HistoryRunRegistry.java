package com.gnovoa.gridiron.runner;

import com.gnovoa.gridiron.catalog.SimProperties;
import com.gnovoa.gridiron.catalog.TeamCatalog;
import com.gnovoa.gridiron.history.LeagueHistorySimulator;
import com.gnovoa.gridiron.out.EventPublisher;
import org.springframework.stereotype.Component;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * History runs by id, in start order. Runs in progress are always kept; of the finished ones only
 * the newest {@code runner.max-retained-runs} survive the start of another run.
 */
@Component
public final class HistoryRunRegistry {

    private static final Logger log = LoggerFactory.getLogger(HistoryRunRegistry.class);

    private final Map<String, HistoryRunner> runners = new LinkedHashMap<>();

    private final TeamCatalog catalog;
    private final SimProperties sim;
    private final RunnerProperties props;
    private final LeagueHistorySimulator simulator;
    private final EventPublisher publisher;

    public HistoryRunRegistry(TeamCatalog catalog, SimProperties sim, RunnerProperties props,
                              LeagueHistorySimulator simulator, EventPublisher publisher) {
        this.catalog = catalog;
        this.sim = sim;
        this.props = props;
        this.simulator = simulator;
        this.publisher = publisher;
    }

    /**
     * Creates and starts a run.
     *
     * @param years null for the configured default
     * @throws IllegalArgumentException if {@code years} is outside 1..{@code runner.max-years}
     */
    public synchronized HistoryRunner start(Integer years, Long seed) {
        int n = years == null ? props.defaultYears() : years;
        if (n < 1 || n > props.maxYears()) {
            throw new IllegalArgumentException("years must be between 1 and " + props.maxYears() + ", got " + n);
        }
        String runId = "run-" + UUID.randomUUID();
        HistoryRunner runner = new HistoryRunner(runId, n, seed, props.startYear(), catalog, sim, simulator, publisher);
        evictFinished();
        runners.put(runId, runner);
        runner.start();
        return runner;
    }

    private void evictFinished() {
        List<RunnerStatus> finished = new ArrayList<>();
        for (HistoryRunner r : runners.values()) {
            RunnerStatus st = r.status();
            if (st.state().isFinished()) finished.add(st);
        }
        int excess = finished.size() - props.maxRetainedRuns();
        if (excess <= 0) return;

        // stable sort: runs finishing at the same instant go in start order
        finished.sort(Comparator.comparing(RunnerStatus::finishedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));
        for (RunnerStatus st : finished.subList(0, excess)) {
            runners.remove(st.runId());
            log.info("Dropped finished run {} ({})", st.runId(), st.state());
        }
    }

    /**
     * @throws IllegalArgumentException if no run has this id
     */
    public synchronized HistoryRunner runner(String runId) {
        HistoryRunner r = runners.get(runId);
        if (r == null) throw new IllegalArgumentException("Unknown run " + runId);
        return r;
    }

    public synchronized Collection<HistoryRunner> all() {
        return List.copyOf(runners.values());
    }
}
