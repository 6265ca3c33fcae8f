package com.gnovoa.gridiron.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.gridiron.catalog.SimProperties;
import com.gnovoa.gridiron.catalog.TeamCatalog;
import com.gnovoa.gridiron.history.LeagueHistorySimulator;
import com.gnovoa.gridiron.out.EventPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class HistoryRunRegistryTest {

    private static final TeamCatalog CATALOG = new TeamCatalog(new ObjectMapper(), TeamCatalog.DEFAULT_RESOURCE);
    private static final SimProperties SIM = new SimProperties(0, 0, 0, 0, 0, null, null);

    private final HistoryRunRegistry registry = new HistoryRunRegistry(CATALOG, SIM,
            new RunnerProperties(1, 10, 2025, false, 2), new LeagueHistorySimulator(), mock(EventPublisher.class));

    private HistoryRunner startAndCancel() throws InterruptedException {
        HistoryRunner runner = registry.start(3, 7L);
        runner.cancel();
        Instant deadline = Instant.now().plus(Duration.ofSeconds(60));
        while (!runner.status().state().isFinished() && Instant.now().isBefore(deadline)) {
            Thread.sleep(20);
        }
        assertThat(runner.status().state().isFinished()).isTrue();
        return runner;
    }

    @Test
    @DisplayName("Starting a run drops the oldest finished runs beyond the retention limit")
    void dropsOldestFinishedRuns() throws InterruptedException {
        HistoryRunner first = startAndCancel();
        HistoryRunner second = startAndCancel();
        HistoryRunner third = startAndCancel();

        HistoryRunner fourth = registry.start(3, 8L);
        fourth.cancel();

        assertThatThrownBy(() -> registry.runner(first.runId()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.runner(second.runId())).isSameAs(second);
        assertThat(registry.runner(third.runId())).isSameAs(third);
        assertThat(registry.runner(fourth.runId())).isSameAs(fourth);
        assertThat(registry.all()).hasSize(3);
    }

    @Test
    @DisplayName("Runs still in progress are never dropped")
    void keepsRunsInProgress() {
        HistoryRunner a = registry.start(10, 1L);
        HistoryRunner b = registry.start(10, 2L);
        HistoryRunner c = registry.start(10, 3L);
        try {
            assertThat(registry.all()).extracting(HistoryRunner::runId)
                    .containsExactlyInAnyOrder(a.runId(), b.runId(), c.runId());
        } finally {
            a.cancel();
            b.cancel();
            c.cancel();
        }
    }

    @Test
    @DisplayName("Unset retention falls back to the default")
    void retentionDefault() {
        assertThat(new RunnerProperties(1, 10, 2025, false, 0).maxRetainedRuns())
                .isEqualTo(RunnerProperties.DEFAULT_MAX_RETAINED_RUNS);
    }
}
