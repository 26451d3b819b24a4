package com.musicsync.remote;

import com.musicsync.engine.TrackKey;

/**
 * What the orchestrator knows about a track before touching the remote side.
 *
 * @param key track key
 * @param artist artist part of the key
 * @param title title part of the key
 * @param url known remote URL, may be null
 * @param remoteId resolved remote id, may be null
 */
public record TrackRef(String key, String artist, String title, String url, String remoteId) {

    public static TrackRef of(String key, String url, String remoteId) {
        String[] parts = TrackKey.split(key);
        return new TrackRef(key, parts[0], parts[1], url, remoteId);
    }

    public boolean hasRemoteId() {
        return remoteId != null && !remoteId.isBlank();
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public TrackRef withUrl(String newUrl) {
        return new TrackRef(key, artist, title, newUrl, remoteId);
    }
}
