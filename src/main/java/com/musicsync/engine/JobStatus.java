package com.musicsync.engine;

/**
 * Lifecycle of the single background job: {@code IDLE -> RUNNING -> (COMPLETED | FAILED | STOPPED) -> IDLE}.
 */
public enum JobStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }
}
