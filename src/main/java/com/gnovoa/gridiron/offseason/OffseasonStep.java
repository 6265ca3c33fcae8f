package com.gnovoa.gridiron.offseason;

import com.gnovoa.gridiron.model.LeagueState;

/** League state between two offseason stages, plus the report so far. */
public record OffseasonStep(LeagueState state, OffseasonReport report) {

    public static OffseasonStep start(LeagueState state) {
        return new OffseasonStep(state, OffseasonReport.empty());
    }
}
