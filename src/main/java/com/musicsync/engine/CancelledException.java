package com.musicsync.engine;

/**
 * A stop request was honored at a track boundary.
 */
public class CancelledException extends SyncException {
    public CancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }

    public CancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
