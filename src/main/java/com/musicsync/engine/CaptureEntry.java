package com.musicsync.engine;

/**
 * A track the user previously identified and wants in the library.
 *
 * @param artist artist as captured
 * @param title title as captured
 * @param capturedAt epoch millis of the capture, 0 when unknown
 */
public record CaptureEntry(String artist, String title, long capturedAt) {

    public String key() {
        return TrackKey.of(artist, title);
    }
}
