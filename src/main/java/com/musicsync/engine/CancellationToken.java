package com.musicsync.engine;

/**
 * Cooperative stop flag handed to every batch. Jobs check it between tracks only, never inside one.
 */
public final class CancellationToken {
    private volatile boolean requested;

    public void cancel() {
        requested = true;
    }

    public boolean isCancellationRequested() {
        return requested;
    }

    /**
     * @throws CancelledException when a stop was requested
     */
    public void throwIfCancelled() {
        if (requested) {
            throw new CancelledException("Stop requested");
        }
    }
}
