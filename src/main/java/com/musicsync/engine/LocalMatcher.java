package com.musicsync.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the local file for a wanted track.
 * <p>
 * First the tiered key lookup is tried. When it misses, titles are compared in canonical form (mix suffixes
 * and punctuation ignored, containment allowed) and at least one artist token has to appear in the file's
 * artist or file name. When several files qualify, the most recently scanned one wins.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class LocalMatcher {
    private final TrackKeyIndex<LocalTrack> index = new TrackKeyIndex<>();
    private final Map<String, List<LocalTrack>> byTitleWord = new HashMap<>();

    public LocalMatcher(Collection<LocalTrack> locals) {
        // newest first, so both the key index and the word index prefer recent files
        Map<String, LocalTrack> newestPerKey = new LinkedHashMap<>();
        List<LocalTrack> sorted = new ArrayList<>(locals == null ? List.of() : locals);
        sorted.sort(Comparator.comparingLong(LocalTrack::scannedAt).reversed());
        for (LocalTrack t : sorted) {
            if (t == null || t.title() == null || t.title().isBlank()) {
                continue;
            }
            newestPerKey.putIfAbsent(t.key(), t);
        }
        for (LocalTrack t : newestPerKey.values()) {
            index.put(t.key(), t);
            for (String w : Similarity.canon(t.title()).split(" ")) {
                if (w.length() > 1) {
                    byTitleWord.computeIfAbsent(w, k -> new ArrayList<>()).add(t);
                }
            }
        }
    }

    public int size() {
        return index.size();
    }

    public Optional<LocalTrack> match(CaptureEntry wanted) {
        Optional<LocalTrack> byKey = index.get(wanted.key());
        if (byKey.isPresent()) {
            return byKey;
        }
        Set<LocalTrack> candidates = new LinkedHashSet<>();
        for (String w : Similarity.canon(wanted.title()).split(" ")) {
            List<LocalTrack> hits = byTitleWord.get(w);
            if (hits != null) {
                candidates.addAll(hits);
            }
        }
        LocalTrack best = null;
        for (LocalTrack t : candidates) {
            if (!Similarity.canonMatch(wanted.title(), t.title())) {
                continue;
            }
            if (!artistOverlaps(wanted.artist(), t)) {
                continue;
            }
            if (best == null || t.scannedAt() > best.scannedAt()) {
                best = t;
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean artistOverlaps(String wantedArtist, LocalTrack local) {
        Set<String> tokens = Similarity.artistTokens(wantedArtist);
        if (tokens.isEmpty()) {
            return false;
        }
        Set<String> localTokens = Similarity.artistTokens(local.artist());
        for (String t : tokens) {
            if (localTokens.contains(t)) {
                return true;
            }
        }
        String fileName = local.filepath() == null ? "" : local.filepath().toLowerCase(Locale.ROOT);
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String baseName = fileName.substring(slash + 1);
        for (String t : tokens) {
            if (baseName.contains(t)) {
                return true;
            }
        }
        return false;
    }
}
