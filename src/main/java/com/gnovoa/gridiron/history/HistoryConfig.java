package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.offseason.OffseasonSettings;

/**
 * How much history to simulate and under which league rules.
 *
 * @param years number of full season and offseason cycles, starting with the state's current year
 */
public record HistoryConfig(int years, OffseasonSettings settings, int draftClassSize, int maxTeamsPerByeWeek) {

    public static final int DEFAULT_DRAFT_CLASS_SIZE = 256;
    public static final int DEFAULT_MAX_TEAMS_PER_BYE_WEEK = 6;

    public HistoryConfig {
        if (years < 0) throw new IllegalArgumentException("years must not be negative: " + years);
        if (settings == null) throw new IllegalArgumentException("settings are required");
        if (draftClassSize < 1) throw new IllegalArgumentException("draftClassSize must be positive");
        if (maxTeamsPerByeWeek < 2) throw new IllegalArgumentException("maxTeamsPerByeWeek must be at least 2");
    }

    public static HistoryConfig ofYears(int years) {
        return new HistoryConfig(years, OffseasonSettings.DEFAULTS, DEFAULT_DRAFT_CLASS_SIZE, DEFAULT_MAX_TEAMS_PER_BYE_WEEK);
    }
}
