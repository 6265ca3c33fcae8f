package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.model.HistoricalSeasonSummary;
import com.gnovoa.gridiron.model.LeagueState;

import java.util.List;

public record HistoryResult(LeagueState finalState, List<HistoricalSeasonSummary> summaries, HistoryTotals totals) {

    public HistoryResult {
        summaries = List.copyOf(summaries);
    }
}
