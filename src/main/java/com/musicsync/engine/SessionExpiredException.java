package com.musicsync.engine;

/**
 * The remote service redirected to its login page. The user has to sign in again.
 */
public class SessionExpiredException extends SyncException {
    public SessionExpiredException(String message) {
        super(ErrorKind.SESSION_EXPIRED, message);
    }

    public SessionExpiredException(String message, Throwable cause) {
        super(ErrorKind.SESSION_EXPIRED, message, cause);
    }
}
