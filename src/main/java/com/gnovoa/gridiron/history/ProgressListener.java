package com.gnovoa.gridiron.history;

/**
 * Told when a simulated year enters its season or its offseason.
 *
 * <p>{@code yearIndex} is 1-based: the first year reports 1 of {@code totalYears}.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (yearIndex, totalYears, phase) -> { };

    void onProgress(int yearIndex, int totalYears, HistoryPhase phase);
}
