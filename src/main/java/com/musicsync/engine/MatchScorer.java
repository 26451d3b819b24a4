package com.musicsync.engine;

import java.util.Locale;

/**
 * Scores a remote result text such as "Artist - Title (Extended Mix)" against a wanted artist and title.
 * Used both when picking a search result and when re-checking stored matches.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public final class MatchScorer {
    /** Results below this score are not accepted as a match. */
    public static final double THRESHOLD = 0.3;

    static final double ARTIST_WEIGHT = 0.4;
    static final double TITLE_WEIGHT = 0.6;
    static final double EXTENDED_BONUS = 0.05;

    private MatchScorer() {}

    /**
     * Weighted artist/title similarity. When the result text reads "Artist - Title", each part is compared
     * with its counterpart and titles are also compared with mix suffixes stripped; otherwise both are
     * compared with the whole text.
     */
    public static double score(String resultText, String artist, String title) {
        String text = resultText == null ? "" : resultText.toLowerCase(Locale.ROOT).trim();
        String artistText = text;
        String titleText = text;
        if (text.contains(TrackKey.SEPARATOR)) {
            String[] parts = TrackKey.split(text);
            artistText = parts[0];
            titleText = parts[1];
        }
        double artistScore = artist == null || artist.isBlank() ? 0.5 : Similarity.score(artist, artistText);
        double titleScore = title == null || title.isBlank() ? 0.5 : Math.max(Similarity.score(title, titleText),
            Similarity.score(Similarity.normalize(title), Similarity.normalize(titleText)));
        double score = artistScore * ARTIST_WEIGHT + titleScore * TITLE_WEIGHT;
        // Extended versions are preferred for DJ use
        if (text.contains("extended") && score >= THRESHOLD) {
            score += EXTENDED_BONUS;
        }
        return Math.min(1.0, score);
    }

    public static boolean accepts(double score) {
        return score >= THRESHOLD;
    }
}
