package com.musicsync.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the capture list, the local scan, remote crawls and search/mutation outcomes into one
 * consistent {@link SyncState}.
 * <p>
 * Every method edits the given state in place and is meant to run inside
 * {@link StateStoreInterface#update(java.util.function.Consumer)}, so each call is one atomic write.
 * Classification always replays the outcome log first, so {@code urls} and {@code not_found} reflect the
 * newest recorded attempt per key.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class ReconciliationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ReconciliationEngine.class);

    public static final String SOURCE_CRAWL = "crawl";
    public static final String SOURCE_STAR = "star";
    public static final String SOURCE_UNSTAR = "unstar";
    public static final String SOURCE_DISMISS = "dismiss";
    public static final String SOURCE_UNDISMISS = "undismiss";
    public static final String SOURCE_SYNC = "sync";

    /** Upper bound of live state reads after a bounded crawl. */
    public static final int MAX_CROSS_CHECK = 30;

    /**
     * Classifies every capture as to-download or have-locally and stores the result.
     * @param captures wanted tracks; duplicates by key keep the newest capture
     * @param locals files from the local scan
     * @param state state to update
     * @return the classification that was stored
     */
    public Classification classify(Collection<CaptureEntry> captures, Collection<LocalTrack> locals, SyncState state) {
        replay(state);
        LocalMatcher matcher = new LocalMatcher(locals);
        List<String> toDownload = new ArrayList<>();
        List<String> haveLocally = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, String> paths = new LinkedHashMap<>();
        Map<String, Long> captured = new LinkedHashMap<>();
        for (CaptureEntry capture : dedupe(captures)) {
            String key = capture.key();
            if (capture.capturedAt() > 0) {
                captured.put(key, capture.capturedAt());
            }
            if (state.skipList.contains(TrackKey.lower(key))) {
                skipped.add(key);
                continue;
            }
            Optional<LocalTrack> local = matcher.match(capture);
            if (local.isPresent()) {
                haveLocally.add(key);
                paths.put(key, local.get().filepath());
            } else {
                toDownload.add(key);
            }
        }
        state.toDownload = toDownload;
        state.haveLocally = haveLocally;
        state.skippedTracks = skipped;
        state.localPaths = paths;
        state.capturedAt = captured;
        logger.info("Classified {} captures against {} local files: {} to download, {} local, {} skipped",
            toDownload.size() + haveLocally.size() + skipped.size(), matcher.size(), toDownload.size(),
            haveLocally.size(), skipped.size());
        return new Classification(toDownload, haveLocally, skipped, paths);
    }

    /**
     * Recomputes {@code urls} and {@code not_found} from the outcome log.
     */
    public void replay(SyncState state) {
        OutcomeLog.applyTo(state, OutcomeLog.replay(state.searchOutcomes));
    }

    private static Collection<CaptureEntry> dedupe(Collection<CaptureEntry> captures) {
        Map<String, CaptureEntry> byKey = new LinkedHashMap<>();
        if (captures == null) {
            return byKey.values();
        }
        for (CaptureEntry c : captures) {
            if (c == null || c.title() == null || c.title().isBlank()) {
                continue;
            }
            String lower = TrackKey.lower(c.key());
            CaptureEntry existing = byKey.get(lower);
            if (existing == null || c.capturedAt() > existing.capturedAt()) {
                byKey.put(lower, c);
            }
        }
        return byKey.values();
    }

    /**
     * Keys the app tracks: the last classification, to-download first.
     */
    public List<String> appKeys(SyncState state) {
        Set<String> keys = new LinkedHashSet<>(state.toDownload);
        keys.addAll(state.haveLocally);
        return new ArrayList<>(keys);
    }

    /**
     * Folds a crawl into the state. Each crawled entry is stored under its own key and under every app key
     * that matches it in the strictest matching tier. A URL set here is also written to the outcome log.
     * When the crawl was a full scan, starred keys whose deep form was not crawled are demoted to false;
     * their URLs stay.
     */
    public void mergeCrawl(SyncState state, CrawlResult crawl, long now) {
        TrackKeyIndex<String> appIndex = TrackKeyIndex.ofKeys(appKeys(state));
        Set<String> crawledDeep = new HashSet<>();
        int matched = 0;
        for (CrawledFavorite fav : crawl.favorites()) {
            if (fav.key() == null || fav.key().isBlank()) {
                continue;
            }
            crawledDeep.add(TrackKey.deep(fav.key()));
            storeCrawled(state, fav.key(), fav, now);
            for (TrackKeyIndex.Match<String> m : appIndex.findAll(fav.key())) {
                if (!m.key().equals(fav.key())) {
                    storeCrawled(state, m.key(), fav, now);
                    matched++;
                }
            }
        }
        int demoted = 0;
        if (crawl.fullScan()) {
            for (String key : new ArrayList<>(state.starred.keySet())) {
                if (Boolean.TRUE.equals(state.starred.get(key)) && !crawledDeep.contains(TrackKey.deep(key))) {
                    state.setStarred(key, false, SOURCE_CRAWL, now);
                    demoted++;
                }
            }
        }
        state.lastCrawlAt = now;
        logger.info("Merged crawl: {} favorites over {} pages, {} app keys matched, {} demoted (full scan: {})",
            crawl.favorites().size(), crawl.pagesVisited(), matched, demoted, crawl.fullScan());
    }

    /**
     * Starred app keys a bounded crawl did not see. A bounded crawl cannot tell "unfavorited" from
     * "older than the window", so callers read the live state of these before demoting.
     * @return at most {@link #MAX_CROSS_CHECK} keys
     */
    public List<String> crossCheckCandidates(SyncState state, CrawlResult crawl) {
        if (crawl.fullScan()) {
            return List.of();
        }
        Set<String> crawledDeep = new HashSet<>();
        for (CrawledFavorite fav : crawl.favorites()) {
            if (fav.key() != null) {
                crawledDeep.add(TrackKey.deep(fav.key()));
            }
        }
        List<String> out = new ArrayList<>();
        for (String key : appKeys(state)) {
            if (out.size() >= MAX_CROSS_CHECK) {
                break;
            }
            if (Boolean.TRUE.equals(state.starred.get(key)) && !crawledDeep.contains(TrackKey.deep(key))) {
                out.add(key);
            }
        }
        return out;
    }

    private static void storeCrawled(SyncState state, String key, CrawledFavorite fav, long now) {
        state.setStarred(key, true, SOURCE_CRAWL, now);
        if (fav.url() != null && !fav.url().isBlank()) {
            if (!fav.url().equals(state.urls.get(key))) {
                state.appendOutcome(OutcomeEntry.found(now, key, fav.url()));
            }
            state.urls.put(key, fav.url());
            state.notFound.remove(key);
        }
        if (fav.remoteTitle() != null && !fav.remoteTitle().isBlank()) {
            state.remoteTitles.put(key, fav.remoteTitle());
        }
        if (fav.remoteId() != null && !fav.remoteId().isBlank()) {
            state.remoteIds.put(key, fav.remoteId());
        }
    }

    /**
     * Records a successful search: the URL is set, the not-found flag is cleared and the attempt is logged.
     */
    public void recordFound(SyncState state, String key, String url, String remoteTitle, double score, long now) {
        state.appendOutcome(OutcomeEntry.found(now, key, url));
        state.urls.put(key, url);
        state.notFound.remove(key);
        if (remoteTitle != null && !remoteTitle.isBlank()) {
            state.remoteTitles.put(key, remoteTitle);
        }
        state.matchScores.put(key, score);
    }

    /**
     * Records a search that produced no acceptable candidate.
     */
    public void recordNotFound(SyncState state, String key, long now) {
        state.appendOutcome(OutcomeEntry.notFound(now, key));
        state.urls.remove(key);
        state.notFound.put(key, Boolean.TRUE);
    }

    /**
     * Records an attempt that ended in an error. Derived fields are left alone.
     */
    public void recordFailure(SyncState state, String key, ErrorKind kind, long now) {
        state.appendOutcome(OutcomeEntry.failed(now, key, kind.label()));
    }

    public void recordRemoteId(SyncState state, String key, String remoteId) {
        if (remoteId != null && !remoteId.isBlank()) {
            state.remoteIds.put(key, remoteId);
        }
    }

    /**
     * Applies a confirmed star. A URL learned on the way goes through the outcome log.
     */
    public void recordStarred(SyncState state, String key, String url, String remoteId, String source, long now) {
        if (url != null && !url.isBlank() && !url.equals(state.urls.get(key))) {
            state.appendOutcome(OutcomeEntry.found(now, key, url));
            state.urls.put(key, url);
            state.notFound.remove(key);
        }
        recordRemoteId(state, key, remoteId);
        state.setStarred(key, true, source, now);
    }

    public void recordUnstarred(SyncState state, String key, String remoteId, String source, long now) {
        recordRemoteId(state, key, remoteId);
        state.setStarred(key, false, source, now);
    }

    /**
     * Marks a key dismissed after its remote favorite was removed.
     */
    public void recordDismissed(SyncState state, String key, String remoteId, long now) {
        recordUnstarred(state, key, remoteId, SOURCE_DISMISS, now);
        state.dismissed.put(key, Boolean.TRUE);
    }

    public void recordUndismissed(SyncState state, String key, String url, String remoteId, long now) {
        state.dismissed.remove(key);
        recordStarred(state, key, url, remoteId, SOURCE_UNDISMISS, now);
    }

    /**
     * Wipes every not-found flag. A marker in the outcome log keeps later replays from restoring them.
     */
    public int resetNotFound(SyncState state, long now) {
        int cleared = state.notFound.size();
        state.appendOutcome(new OutcomeEntry(now, OutcomeEntry.ALL_KEYS, OutcomeEntry.RESET_NOT_FOUND, null));
        state.notFound.clear();
        logger.info("Reset {} not-found flags", cleared);
        return cleared;
    }

    /**
     * Moves a key to have-locally after its file was written into the library.
     */
    public void recordDownloaded(SyncState state, String key, String filepath) {
        state.toDownload.remove(key);
        if (!state.haveLocally.contains(key)) {
            state.haveLocally.add(key);
        }
        state.localPaths.put(key, filepath);
    }

    public void acknowledgeManualCheck(SyncState state, String key) {
        state.dismissedManualCheck.add(key);
    }

    /**
     * True when the remote match carries a version qualifier the wanted title lacks (e.g. remote "Radio Edit"
     * for a plain title) and the user has not acknowledged it yet.
     */
    public boolean needsManualCheck(SyncState state, String key) {
        if (state.dismissedManualCheck.contains(key)) {
            return false;
        }
        String remote = state.remoteTitles.get(key);
        if (remote == null || remote.isBlank()) {
            return false;
        }
        String wantedTitle = TrackKey.split(key)[1];
        return Similarity.hasVersionQualifier(remote) && !Similarity.hasVersionQualifier(wantedTitle);
    }

    /**
     * Re-scores stored matches whose remote title is known and drops the ones below the match threshold.
     * Dropped keys get a not-found outcome so a replay agrees with the cleanup.
     * @return keys whose match was removed
     */
    public List<String> cleanupMatches(SyncState state, long now) {
        List<String> removed = new ArrayList<>();
        for (String key : new ArrayList<>(state.urls.keySet())) {
            String remote = state.remoteTitles.get(key);
            if (remote == null || remote.isBlank()) {
                continue;
            }
            String[] parts = TrackKey.split(key);
            double score = MatchScorer.score(remote, parts[0], parts[1]);
            if (MatchScorer.accepts(score)) {
                state.matchScores.put(key, score);
                continue;
            }
            recordNotFound(state, key, now);
            state.remoteTitles.remove(key);
            state.remoteIds.remove(key);
            state.matchScores.remove(key);
            removed.add(key);
        }
        logger.info("Match cleanup removed {} weak matches", removed.size());
        return removed;
    }

    public void skip(SyncState state, String key) {
        state.skipList.add(TrackKey.lower(key));
    }

    public void unskip(SyncState state, String key) {
        state.skipList.remove(TrackKey.lower(key));
    }

    /**
     * Looks up a per-key fact using the tiered key strategy.
     */
    public static <V> Optional<V> lookup(Map<String, V> facts, String key) {
        return new TrackKeyIndex<>(facts).get(key);
    }

    /**
     * Keys eligible for a "search all" run in the given mode. Keys with a URL and dismissed keys are never included.
     */
    public List<String> searchCandidates(SyncState state, SearchMode mode) {
        List<String> out = new ArrayList<>();
        for (String key : appKeys(state)) {
            if (state.urls.containsKey(key) || Boolean.TRUE.equals(state.dismissed.get(key))) {
                continue;
            }
            boolean flagged = Boolean.TRUE.equals(state.notFound.get(key));
            switch (mode) {
                case UNFOUND -> {
                    if (!flagged) out.add(key);
                }
                case NOT_FOUND -> {
                    if (flagged) out.add(key);
                }
                default -> out.add(key);
            }
        }
        return out;
    }

    /**
     * Keys a sync run should favorite: to-download keys that are not dismissed, not already starred, and
     * captured no earlier than {@code capturedSince}. A capture without a timestamp only qualifies when
     * {@code capturedSince} is 0.
     */
    public List<String> syncCandidates(SyncState state, long capturedSince) {
        List<String> out = new ArrayList<>();
        for (String key : state.toDownload) {
            if (lookup(state.dismissed, key).orElse(false) || lookup(state.starred, key).orElse(false)) {
                continue;
            }
            if (capturedSince > 0 && state.capturedAt.getOrDefault(key, 0L) < capturedSince) {
                continue;
            }
            out.add(key);
        }
        return out;
    }

    /**
     * Builds the patch that restores remote context from a backup of the state file. Keys the current state
     * already knows keep their values. The backup's outcome log is only taken over when the current log is
     * empty, and {@code not_found} is recomputed from whichever log survives.
     */
    public StatePatch restorePatch(SyncState current, SyncState backup, long now) {
        StatePatch patch = new StatePatch().at(now);
        backup.urls.forEach((k, v) -> {
            if (!current.urls.containsKey(k)) patch.url(k, v);
        });
        backup.remoteIds.forEach((k, v) -> {
            if (!current.remoteIds.containsKey(k)) patch.remoteId(k, v);
        });
        backup.remoteTitles.forEach((k, v) -> {
            if (!current.remoteTitles.containsKey(k)) patch.remoteTitle(k, v);
        });
        backup.matchScores.forEach((k, v) -> {
            if (!current.matchScores.containsKey(k)) patch.matchScore(k, v);
        });
        backup.starred.forEach((k, v) -> {
            if (!current.starred.containsKey(k)) patch.starred(k, v);
        });
        backup.dismissedManualCheck.forEach(patch::dismissedManualCheck);
        List<OutcomeEntry> log = current.searchOutcomes;
        if (log.isEmpty() && !backup.searchOutcomes.isEmpty()) {
            backup.searchOutcomes.forEach(patch::outcome);
            log = backup.searchOutcomes;
        }
        patch.replaceNotFound(OutcomeLog.replay(log).notFound());
        return patch;
    }
}
