package com.musicsync.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A partial update for {@link StateStore#mergeInto(SyncState, StatePatch)}. A null field means
 * "not part of this update".
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class StatePatch {
    long updatedAt = System.currentTimeMillis();

    Long lastScanAt;
    Long lastCrawlAt;
    String lastCrawlWindow;
    List<String> toDownload;
    List<String> haveLocally;
    List<String> skippedTracks;

    Map<String, String> localPaths;
    Map<String, String> urls;
    Map<String, String> remoteIds;
    Map<String, String> remoteTitles;
    Map<String, Double> matchScores;
    Map<String, Boolean> starred;
    Map<String, Boolean> dismissed;
    Set<String> dismissedManualCheck;
    Set<String> skipList;

    // Replaced wholesale, never unioned
    Map<String, Boolean> notFound;

    List<OutcomeEntry> outcomes;
    List<MutationEntry> mutations;

    public StatePatch at(long timestamp) {
        this.updatedAt = timestamp;
        return this;
    }

    public StatePatch lastScanAt(long value) {
        this.lastScanAt = value;
        return this;
    }

    public StatePatch lastCrawl(long at, String window) {
        this.lastCrawlAt = at;
        this.lastCrawlWindow = window;
        return this;
    }

    public StatePatch classification(List<String> toDownload, List<String> haveLocally, List<String> skipped) {
        this.toDownload = new ArrayList<>(toDownload);
        this.haveLocally = new ArrayList<>(haveLocally);
        this.skippedTracks = new ArrayList<>(skipped);
        return this;
    }

    public StatePatch localPath(String key, String path) {
        localPaths = put(localPaths, key, path);
        return this;
    }

    public StatePatch url(String key, String url) {
        urls = put(urls, key, url);
        return this;
    }

    public StatePatch urls(Map<String, String> values) {
        if (urls == null) urls = new LinkedHashMap<>();
        urls.putAll(values);
        return this;
    }

    public StatePatch remoteId(String key, String id) {
        remoteIds = put(remoteIds, key, id);
        return this;
    }

    public StatePatch remoteTitle(String key, String title) {
        remoteTitles = put(remoteTitles, key, title);
        return this;
    }

    public StatePatch matchScore(String key, double score) {
        matchScores = put(matchScores, key, score);
        return this;
    }

    public StatePatch starred(String key, boolean value) {
        starred = put(starred, key, value);
        return this;
    }

    public StatePatch dismissed(String key, boolean value) {
        dismissed = put(dismissed, key, value);
        return this;
    }

    public StatePatch dismissedManualCheck(String key) {
        if (dismissedManualCheck == null) dismissedManualCheck = new LinkedHashSet<>();
        dismissedManualCheck.add(key);
        return this;
    }

    public StatePatch skip(String lowerKey) {
        if (skipList == null) skipList = new LinkedHashSet<>();
        skipList.add(lowerKey);
        return this;
    }

    public StatePatch replaceNotFound(Map<String, Boolean> snapshot) {
        this.notFound = new LinkedHashMap<>(snapshot);
        return this;
    }

    public StatePatch outcome(OutcomeEntry entry) {
        if (outcomes == null) outcomes = new ArrayList<>();
        outcomes.add(entry);
        return this;
    }

    public StatePatch mutation(MutationEntry entry) {
        if (mutations == null) mutations = new ArrayList<>();
        mutations.add(entry);
        return this;
    }

    private static <V> Map<String, V> put(Map<String, V> map, String key, V value) {
        Map<String, V> out = map == null ? new LinkedHashMap<>() : map;
        out.put(key, value);
        return out;
    }
}
