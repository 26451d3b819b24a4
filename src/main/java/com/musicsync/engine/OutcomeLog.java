package com.musicsync.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure replay of the outcome log into the two fields it owns: {@code urls} and {@code not_found}.
 * <p>
 * The fold walks entries newest-first (ties keep log order, later entries first) and the first decisive
 * entry per key wins. A {@link OutcomeEntry#RESET_NOT_FOUND} marker clears the flag of every {@code not_found}
 * entry older than itself without letting an even older URL come back.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public final class OutcomeLog {

    /**
     * Derived view of the log.
     *
     * @param urls newest found URL per key, for keys whose newest decisive entry is "found"
     * @param notFound keys whose newest decisive entry is "not_found"
     * @param decided every key that had a decisive entry, found or not
     */
    public record Replay(Map<String, String> urls, Map<String, Boolean> notFound, Set<String> decided) {}

    private OutcomeLog() {}

    public static Replay replay(List<OutcomeEntry> log) {
        Map<String, String> urls = new LinkedHashMap<>();
        Map<String, Boolean> notFound = new LinkedHashMap<>();
        Set<String> decided = new HashSet<>();
        if (log == null || log.isEmpty()) {
            return new Replay(urls, notFound, decided);
        }
        List<Indexed> ordered = new ArrayList<>(log.size());
        for (int i = 0; i < log.size(); i++) {
            OutcomeEntry e = log.get(i);
            if (e != null) {
                ordered.add(new Indexed(i, e));
            }
        }
        ordered.sort(Comparator.comparingLong((Indexed x) -> x.entry().timestamp()).thenComparingInt(x -> x.index()).reversed());

        boolean resetSeen = false;
        for (Indexed x : ordered) {
            OutcomeEntry e = x.entry();
            if (OutcomeEntry.RESET_NOT_FOUND.equals(e.action())) {
                resetSeen = true;
                continue;
            }
            String key = e.key();
            if (key == null || !e.isDecisive() || decided.contains(key)) {
                continue;
            }
            if (OutcomeEntry.FOUND.equals(e.action())) {
                if (e.url() == null || e.url().isBlank()) {
                    continue;
                }
                urls.put(key, e.url());
                decided.add(key);
            } else {
                if (!resetSeen) {
                    notFound.put(key, Boolean.TRUE);
                }
                decided.add(key);
            }
        }
        return new Replay(urls, notFound, decided);
    }

    /**
     * Applies a replay to a state: found keys get their URL, not-found keys lose theirs, and the
     * {@code not_found} map is replaced by the replay result.
     */
    public static void applyTo(SyncState state, Replay replay) {
        for (String key : replay.decided()) {
            String url = replay.urls().get(key);
            if (url != null) {
                state.urls.put(key, url);
            } else {
                state.urls.remove(key);
            }
        }
        state.notFound = new LinkedHashMap<>(replay.notFound());
    }

    private record Indexed(int index, OutcomeEntry entry) {}
}
