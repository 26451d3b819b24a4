package com.musicsync.engine;

/**
 * One audio file found by the local scanner.
 *
 * @param artist artist from tags or file name, may be empty
 * @param title title from tags or file name
 * @param filepath absolute path of the file
 * @param scannedAt epoch millis the file was observed (its last-modified time)
 * @param fromTags whether artist/title came from embedded tags
 */
public record LocalTrack(String artist, String title, String filepath, long scannedAt, boolean fromTags) {

    public String key() {
        return TrackKey.of(artist, title);
    }
}
