package com.gnovoa.gridiron.runner;

public enum RunnerState {
    IDLE,
    RUNNING_SEASON,
    RUNNING_OFFSEASON,
    DONE,
    CANCELLED,
    FAILED;

    public boolean isFinished() {
        return this == DONE || this == CANCELLED || this == FAILED;
    }
}
