package com.musicsync.engine;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * String similarity and canonicalization helpers shared by the search matcher and the local matcher.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public final class Similarity {

    private static final String EDGE_PUNCTUATION = ".,;:&()";

    // Mix and edit qualifiers stripped before comparing a capture title with a file title
    private static final Pattern TRACK_SUFFIXES = Pattern.compile(
        "\\s*[(\\[]?(?:Extended Mix|Extended Version|Extended|Original Mix|Original Version|Radio Edit|Album Version|"
            + "Instrumental|Remix|Edit|Mix|Dub Mix|Dub|Vocal|Acoustic|Version|\\(feat\\.[^)]*\\))[\\s)\\]]*",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern VERSION_QUALIFIER = Pattern.compile(
        "\\b(extended|original mix|radio edit|club mix|dub|remix|edit|vip|rework|bootleg)\\b",
        Pattern.CASE_INSENSITIVE);

    private Similarity() {}

    /**
     * Word-overlap similarity in [0, 1]. Equal strings score 1.0; containment is capped at 0.85.
     */
    public static double score(String a, String b) {
        if (a == null || b == null || a.isBlank() || b.isBlank()) {
            return 0.0;
        }
        String s1 = a.toLowerCase(Locale.ROOT).trim();
        String s2 = b.toLowerCase(Locale.ROOT).trim();
        if (s1.equals(s2)) {
            return 1.0;
        }
        Set<String> words1 = words(s1);
        Set<String> words2 = words(s2);
        if (words1.isEmpty() || words2.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(words1);
        union.addAll(words2);
        Set<String> overlap = new HashSet<>(words1);
        overlap.retainAll(words2);
        double jaccard = union.isEmpty() ? 0.0 : (double) overlap.size() / union.size();

        int shorter = Math.min(s1.length(), s2.length());
        int longer = Math.max(s1.length(), s2.length());
        double lengthRatio = longer == 0 ? 0.0 : (double) shorter / longer;
        if (s1.contains(s2) || s2.contains(s1)) {
            return Math.min(0.85, jaccard * 0.5 + lengthRatio * 0.5);
        }
        return jaccard;
    }

    static String normalizeWord(String w) {
        String s = w == null ? "" : w.trim();
        while (!s.isEmpty() && EDGE_PUNCTUATION.indexOf(s.charAt(s.length() - 1)) >= 0) {
            s = s.substring(0, s.length() - 1).trim();
        }
        while (!s.isEmpty() && EDGE_PUNCTUATION.indexOf(s.charAt(0)) >= 0) {
            s = s.substring(1).trim();
        }
        return s;
    }

    private static Set<String> words(String s) {
        Set<String> out = new HashSet<>();
        for (String w : s.split("\\s+")) {
            String n = normalizeWord(w);
            if (!n.isEmpty()) {
                out.add(n);
            }
        }
        return out;
    }

    /**
     * Lowercase, collapse whitespace and drop mix/edit suffixes.
     */
    public static String normalize(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String out = s.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
        out = TRACK_SUFFIXES.matcher(out).replaceAll("");
        return out.trim();
    }

    /**
     * Letters, digits and single spaces only. Dots vanish so "R.E.Z." equals "REZ".
     */
    public static String canon(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        String out = normalize(s).replace(".", "");
        out = out.replaceAll("[^a-z0-9\\s]", " ");
        return out.replaceAll("\\s+", " ").trim();
    }

    public static boolean canonMatch(String a, String b) {
        String ca = canon(a);
        String cb = canon(b);
        if (ca.isEmpty() || cb.isEmpty()) {
            return ca.equals(cb);
        }
        return ca.equals(cb) || ca.contains(cb) || cb.contains(ca);
    }

    /**
     * Meaningful artist tokens: split on "&", "," and " and ", at least two characters.
     */
    public static Set<String> artistTokens(String artist) {
        Set<String> out = new HashSet<>();
        if (artist == null || artist.isBlank()) {
            return out;
        }
        String s = normalize(artist).replace("&", " ").replace(",", " ").replace(" and ", " ");
        for (String w : s.split("\\s+")) {
            if (w.length() > 1) {
                out.add(w);
            }
        }
        return out;
    }

    public static boolean hasVersionQualifier(String title) {
        return title != null && VERSION_QUALIFIER.matcher(title).find();
    }
}
