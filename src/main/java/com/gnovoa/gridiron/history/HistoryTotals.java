package com.gnovoa.gridiron.history;

import com.gnovoa.gridiron.offseason.OffseasonReport;

/** Running counters over every offseason of a history run. */
public record HistoryTotals(int retirements, int draftPicks, int freeAgencySignings, int coachingChanges) {

    public static final HistoryTotals ZERO = new HistoryTotals(0, 0, 0, 0);

    public HistoryTotals plus(OffseasonReport report) {
        return new HistoryTotals(
                retirements + report.retiredPlayerIds().size(),
                draftPicks + report.draftedCount(),
                freeAgencySignings + report.signings().size(),
                coachingChanges + report.coachingChanges().size());
    }
}
