package com.gnovoa.gridiron.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public final class RunnerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(RunnerBootstrap.class);

    private final RunnerProperties props;
    private final HistoryRunRegistry registry;

    public RunnerBootstrap(RunnerProperties props, HistoryRunRegistry registry) {
        this.props = props;
        this.registry = registry;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.autoStartOnBoot()) return;
        HistoryRunner runner = registry.start(props.defaultYears(), null);
        log.info("Auto-started history run {}", runner.runId());
    }
}
