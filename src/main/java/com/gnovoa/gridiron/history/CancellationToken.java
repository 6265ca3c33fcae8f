package com.gnovoa.gridiron.history;

/** Cooperative cancellation, checked by the simulator between seasons and offseasons. */
public final class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void throwIfCancelled(int completedYears) {
        if (cancelled) throw new HistoryCancelledException(completedYears);
    }
}
