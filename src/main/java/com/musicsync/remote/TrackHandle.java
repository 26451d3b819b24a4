package com.musicsync.remote;

/**
 * A track opened on a backend: its page URL and, once known, its numeric id.
 */
public record TrackHandle(String url, String remoteId) {

    public boolean hasRemoteId() {
        return remoteId != null && !remoteId.isBlank();
    }
}
