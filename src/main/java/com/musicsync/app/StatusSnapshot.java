package com.musicsync.app;

import com.musicsync.engine.JobState;

import java.util.List;
import java.util.Map;

/**
 * Read-only view handed to the presentation layer. Derived fields are replayed from the outcome log
 * before the snapshot is taken.
 *
 * @param toDownload capture keys without a local file
 * @param haveLocally capture keys with a local file
 * @param skipped capture keys on the skip list
 * @param urls remote URL per key
 * @param starred favorite flag per key; absent means unknown
 * @param notFound keys whose last search found nothing
 * @param dismissed keys the user unfavorited through the app
 * @param manualCheck keys whose remote match looks like another version of the track
 * @param lastScanAt epoch millis of the last scan, 0 if never
 * @param lastCrawlAt epoch millis of the last crawl, 0 if never
 * @param job current job slot
 */
public record StatusSnapshot(
    List<String> toDownload,
    List<String> haveLocally,
    List<String> skipped,
    Map<String, String> urls,
    Map<String, Boolean> starred,
    Map<String, Boolean> notFound,
    Map<String, Boolean> dismissed,
    List<String> manualCheck,
    long lastScanAt,
    long lastCrawlAt,
    JobState job
) {}
