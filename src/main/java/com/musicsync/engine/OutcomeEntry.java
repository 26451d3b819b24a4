package com.musicsync.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One search or sync attempt as recorded in the outcome log.
 *
 * @param timestamp epoch millis of the attempt
 * @param key track key the attempt was made for, or {@link #ALL_KEYS} for a reset marker
 * @param action one of {@link #FOUND}, {@link #NOT_FOUND}, {@link #FAILED}, {@link #RESET_NOT_FOUND}
 * @param url remote URL when found, otherwise null
 */
public record OutcomeEntry(long timestamp, String key, String action, String url) {
    public static final String FOUND = "found";
    public static final String NOT_FOUND = "not_found";
    public static final String FAILED = "failed";
    public static final String RESET_NOT_FOUND = "reset_not_found";
    public static final String ALL_KEYS = "*";

    public static OutcomeEntry found(long timestamp, String key, String url) {
        return new OutcomeEntry(timestamp, key, FOUND, url);
    }

    public static OutcomeEntry notFound(long timestamp, String key) {
        return new OutcomeEntry(timestamp, key, NOT_FOUND, null);
    }

    public static OutcomeEntry failed(long timestamp, String key, String reason) {
        return new OutcomeEntry(timestamp, key, FAILED + ":" + reason, null);
    }

    @JsonIgnore
    public boolean isDecisive() {
        return FOUND.equals(action) || NOT_FOUND.equals(action);
    }
}
