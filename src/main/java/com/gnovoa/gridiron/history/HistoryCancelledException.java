package com.gnovoa.gridiron.history;

/** Thrown out of a history simulation when its {@link CancellationToken} was cancelled. */
public class HistoryCancelledException extends RuntimeException {

    private final int completedYears;

    public HistoryCancelledException(int completedYears) {
        super("History simulation cancelled after " + completedYears + " completed year(s)");
        this.completedYears = completedYears;
    }

    public int completedYears() {
        return completedYears;
    }
}
