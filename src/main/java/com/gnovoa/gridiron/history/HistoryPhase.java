package com.gnovoa.gridiron.history;

public enum HistoryPhase {
    SEASON,
    OFFSEASON
}
