package com.gnovoa.gridiron.runner;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param startYear the league year the simulated history leads up to
 * @param maxRetainedRuns finished runs kept for querying; the oldest are dropped first
 */
@ConfigurationProperties(prefix = "runner")
public record RunnerProperties(
        int defaultYears,
        int maxYears,
        int startYear,
        boolean autoStartOnBoot,
        int maxRetainedRuns
) {
    public static final int DEFAULT_MAX_RETAINED_RUNS = 20;

    public RunnerProperties {
        if (maxRetainedRuns <= 0) maxRetainedRuns = DEFAULT_MAX_RETAINED_RUNS;
    }
}
