package com.musicsync.engine;

/**
 * The state file could not be parsed. Callers recover with an empty state.
 */
public class CorruptStateException extends SyncException {
    public CorruptStateException(String message) {
        super(ErrorKind.CORRUPT_STATE, message);
    }

    public CorruptStateException(String message, Throwable cause) {
        super(ErrorKind.CORRUPT_STATE, message, cause);
    }
}
