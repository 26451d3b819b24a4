package com.musicsync.engine;

/**
 * Which keys a "search all" run visits. Keys that already have a URL are always skipped.
 */
public enum SearchMode {
    /** Keys never searched or whose last search did not conclude. */
    UNFOUND,
    /** Keys flagged not found, searched again. */
    NOT_FOUND,
    /** Both of the above. */
    ALL
}
