package com.musicsync.engine;

/**
 * Base class of every failure the engine reports to its callers.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class SyncException extends RuntimeException {
    private final ErrorKind kind;

    public SyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
