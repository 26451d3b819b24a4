package com.musicsync.engine;

/**
 * A change of the starred flag, kept for the activity view.
 *
 * @param timestamp epoch millis
 * @param action {@link #STARRED} or {@link #UNSTARRED}
 * @param key track key
 * @param source what caused the change: crawl, star, unstar, dismiss, undismiss
 */
public record MutationEntry(long timestamp, String action, String key, String source) {
    public static final String STARRED = "starred";
    public static final String UNSTARRED = "unstarred";
}
