package com.musicsync.engine;

/**
 * Progress of the running job as shown to the presentation layer.
 *
 * @param current 1-based index of the item in flight, 0 before the first item
 * @param total number of items in the batch, 0 when unknown
 * @param message human-readable step description
 * @param currentKey track key in flight, may be null
 * @param lastUrl last remote URL touched, may be null
 */
public record ProgressSnapshot(int current, int total, String message, String currentKey, String lastUrl) {

    public static ProgressSnapshot idle() {
        return new ProgressSnapshot(0, 0, "", null, null);
    }
}
