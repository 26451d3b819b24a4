package com.musicsync.engine;

/**
 * No acceptable remote candidate exists for a track.
 */
public class TrackNotFoundException extends SyncException {
    public TrackNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public TrackNotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
