package com.musicsync.remote;

import com.musicsync.engine.MatchScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds search query variants and picks the best result link.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public final class SearchMatcher {
    /** Only the top of each result page is considered. */
    public static final int MAX_CANDIDATES = 15;

    private SearchMatcher() {}

    /**
     * Query variants in the order they are tried: "artist title", "title artist", artist, title.
     */
    public static List<String> queries(String artist, String title) {
        String a = artist == null ? "" : artist.trim();
        String t = title == null ? "" : title.trim();
        List<String> out = new ArrayList<>();
        if (!a.isEmpty() && !t.isEmpty()) {
            out.add(a + " " + t);
            out.add(t + " " + a);
            out.add(a);
            out.add(t);
        } else if (!a.isEmpty()) {
            out.add(a);
        } else if (!t.isEmpty()) {
            out.add(t);
        }
        return out;
    }

    /**
     * Highest scoring candidate at or above {@link MatchScorer#THRESHOLD}; the first wins ties.
     */
    public static Optional<SearchHit> best(List<SearchCandidate> candidates, String artist, String title, String query) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        SearchHit best = null;
        int limit = Math.min(MAX_CANDIDATES, candidates.size());
        for (int i = 0; i < limit; i++) {
            SearchCandidate c = candidates.get(i);
            if (c == null || c.url() == null || c.url().isBlank()) {
                continue;
            }
            String text = c.text() == null ? "" : c.text().trim();
            if (text.length() < 3) {
                continue;
            }
            double score = MatchScorer.score(text, artist, title);
            if (best == null || score > best.score()) {
                best = new SearchHit(c.url(), text, score, query);
            }
        }
        if (best == null || !MatchScorer.accepts(best.score())) {
            return Optional.empty();
        }
        return Optional.of(best);
    }
}
