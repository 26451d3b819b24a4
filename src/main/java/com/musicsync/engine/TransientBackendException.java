package com.musicsync.engine;

/**
 * Network or automation failure that is safe to retry.
 */
public class TransientBackendException extends SyncException {
    public TransientBackendException(String message) {
        super(ErrorKind.TRANSIENT_BACKEND, message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_BACKEND, message, cause);
    }
}
