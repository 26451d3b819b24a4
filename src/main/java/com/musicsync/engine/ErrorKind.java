package com.musicsync.engine;

import java.util.Locale;

/**
 * Failure categories surfaced by the engine. Each {@link SyncException} subclass maps to one kind.
 */
public enum ErrorKind {
    SESSION_EXPIRED,
    NOT_FOUND,
    PREMIUM_REQUIRED,
    BUSY,
    CANCELLED,
    TRANSIENT_BACKEND,
    CORRUPT_STATE;

    /**
     * Kinds that end processing of the current track only; a batch records them and moves on.
     */
    public boolean isItemTerminal() {
        return this == SESSION_EXPIRED || this == NOT_FOUND || this == PREMIUM_REQUIRED;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
