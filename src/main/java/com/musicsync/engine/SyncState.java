package com.musicsync.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The persisted record of everything the engine knows per track key, plus the outcome and mutation logs.
 * <p>
 * Track facts are stored column-wise (one map per fact) the same way they are serialized, so a reader can
 * load the file without any schema beyond this class. {@code starred} is tri-state: a missing key means
 * unknown.
 * <p>
 * Instances are mutable and not thread-safe; writers go through {@link StateStore} while a single job runs.
 *
 * @author Music Sync Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncState {
    public static final int MAX_OUTCOME_ENTRIES = 100_000;
    public static final int MAX_MUTATION_ENTRIES = 2_000;

    @JsonProperty("updated_at")
    public long updatedAt;

    @JsonProperty("last_scan_at")
    public long lastScanAt;

    @JsonProperty("last_crawl_at")
    public long lastCrawlAt;

    @JsonProperty("last_crawl_window")
    public String lastCrawlWindow;

    @JsonProperty("to_download")
    public List<String> toDownload = new ArrayList<>();

    @JsonProperty("have_locally")
    public List<String> haveLocally = new ArrayList<>();

    @JsonProperty("skipped_tracks")
    public List<String> skippedTracks = new ArrayList<>();

    @JsonProperty("captured_at")
    public Map<String, Long> capturedAt = new LinkedHashMap<>();

    @JsonProperty("local_paths")
    public Map<String, String> localPaths = new LinkedHashMap<>();

    @JsonProperty("urls")
    public Map<String, String> urls = new LinkedHashMap<>();

    @JsonProperty("track_ids")
    public Map<String, String> remoteIds = new LinkedHashMap<>();

    @JsonProperty("remote_titles")
    public Map<String, String> remoteTitles = new LinkedHashMap<>();

    @JsonProperty("match_scores")
    public Map<String, Double> matchScores = new LinkedHashMap<>();

    @JsonProperty("starred")
    public Map<String, Boolean> starred = new LinkedHashMap<>();

    @JsonProperty("not_found")
    public Map<String, Boolean> notFound = new LinkedHashMap<>();

    @JsonProperty("dismissed")
    public Map<String, Boolean> dismissed = new LinkedHashMap<>();

    @JsonProperty("dismissed_manual_check")
    public Set<String> dismissedManualCheck = new LinkedHashSet<>();

    @JsonProperty("skip_list")
    public Set<String> skipList = new LinkedHashSet<>();

    @JsonProperty("search_outcomes")
    public List<OutcomeEntry> searchOutcomes = new ArrayList<>();

    @JsonProperty("mutation_log")
    public List<MutationEntry> mutationLog = new ArrayList<>();

    public static SyncState empty() {
        return new SyncState();
    }

    /**
     * Deep copy of every collection, so the copy can be mutated independently.
     */
    public SyncState copy() {
        SyncState c = new SyncState();
        c.updatedAt = updatedAt;
        c.lastScanAt = lastScanAt;
        c.lastCrawlAt = lastCrawlAt;
        c.lastCrawlWindow = lastCrawlWindow;
        c.toDownload = new ArrayList<>(toDownload);
        c.haveLocally = new ArrayList<>(haveLocally);
        c.skippedTracks = new ArrayList<>(skippedTracks);
        c.capturedAt = new LinkedHashMap<>(capturedAt);
        c.localPaths = new LinkedHashMap<>(localPaths);
        c.urls = new LinkedHashMap<>(urls);
        c.remoteIds = new LinkedHashMap<>(remoteIds);
        c.remoteTitles = new LinkedHashMap<>(remoteTitles);
        c.matchScores = new LinkedHashMap<>(matchScores);
        c.starred = new LinkedHashMap<>(starred);
        c.notFound = new LinkedHashMap<>(notFound);
        c.dismissed = new LinkedHashMap<>(dismissed);
        c.dismissedManualCheck = new LinkedHashSet<>(dismissedManualCheck);
        c.skipList = new LinkedHashSet<>(skipList);
        c.searchOutcomes = new ArrayList<>(searchOutcomes);
        c.mutationLog = new ArrayList<>(mutationLog);
        return c;
    }

    /**
     * Replaces null collections left by a sparse JSON file with empty ones.
     */
    public SyncState sanitized() {
        if (toDownload == null) toDownload = new ArrayList<>();
        if (haveLocally == null) haveLocally = new ArrayList<>();
        if (skippedTracks == null) skippedTracks = new ArrayList<>();
        if (capturedAt == null) capturedAt = new LinkedHashMap<>();
        if (localPaths == null) localPaths = new LinkedHashMap<>();
        if (urls == null) urls = new LinkedHashMap<>();
        if (remoteIds == null) remoteIds = new LinkedHashMap<>();
        if (remoteTitles == null) remoteTitles = new LinkedHashMap<>();
        if (matchScores == null) matchScores = new LinkedHashMap<>();
        if (starred == null) starred = new LinkedHashMap<>();
        if (notFound == null) notFound = new LinkedHashMap<>();
        if (dismissed == null) dismissed = new LinkedHashMap<>();
        if (dismissedManualCheck == null) dismissedManualCheck = new LinkedHashSet<>();
        if (skipList == null) skipList = new LinkedHashSet<>();
        if (searchOutcomes == null) searchOutcomes = new ArrayList<>();
        if (mutationLog == null) mutationLog = new ArrayList<>();
        return this;
    }

    public void appendOutcome(OutcomeEntry entry) {
        searchOutcomes.add(entry);
        if (searchOutcomes.size() > MAX_OUTCOME_ENTRIES) {
            searchOutcomes = new ArrayList<>(searchOutcomes.subList(searchOutcomes.size() - MAX_OUTCOME_ENTRIES, searchOutcomes.size()));
        }
    }

    public void appendMutation(MutationEntry entry) {
        mutationLog.add(entry);
        if (mutationLog.size() > MAX_MUTATION_ENTRIES) {
            mutationLog = new ArrayList<>(mutationLog.subList(mutationLog.size() - MAX_MUTATION_ENTRIES, mutationLog.size()));
        }
    }

    /**
     * Sets the starred flag and logs a mutation entry when the value actually changes.
     */
    public void setStarred(String key, boolean value, String source, long now) {
        Boolean previous = starred.put(key, value);
        if (previous == null ? value : previous != value) {
            appendMutation(new MutationEntry(now, value ? MutationEntry.STARRED : MutationEntry.UNSTARRED, key, source));
        }
    }
}
