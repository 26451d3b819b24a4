package com.musicsync.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Derives the identity string used to correlate a track across the capture list, the local scan,
 * the remote crawl and the outcome log.
 * <p>
 * Four forms exist, from strictest to loosest:
 * <ul>
 *   <li>exact: {@code artist + " - " + title}</li>
 *   <li>lowercase: the exact key lowercased</li>
 *   <li>normalized: everything from the first {@code " ("} removed, then lowercased</li>
 *   <li>deep: normalized, {@code " & "} unified with {@code ", "}, artists sorted</li>
 * </ul>
 * Lookups across these forms go through {@link TrackKeyIndex}.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public final class TrackKey {
    public static final String SEPARATOR = " - ";

    private TrackKey() {}

    /**
     * Builds the exact key for an artist/title pair. Null parts are treated as empty.
     */
    public static String of(String artist, String title) {
        return (artist == null ? "" : artist.trim()) + SEPARATOR + (title == null ? "" : title.trim());
    }

    public static String lower(String key) {
        return key == null ? "" : key.toLowerCase(Locale.ROOT);
    }

    /**
     * Cuts the key at the first parenthetical qualifier, e.g. "A - B (Radio Edit)" becomes "A - B".
     * Returns the input when nothing would remain.
     */
    public static String stripParens(String key) {
        String s = key == null ? "" : key.trim();
        int idx = s.indexOf(" (");
        if (idx >= 0) {
            s = s.substring(0, idx).trim();
        }
        return s.isEmpty() ? (key == null ? "" : key) : s;
    }

    public static String normalized(String key) {
        return stripParens(key).toLowerCase(Locale.ROOT);
    }

    /**
     * Order-independent form: "B & A - Song (Extended)" and "A, B - Song" share the deep key "a, b - song".
     */
    public static String deep(String key) {
        String s = normalized(key).replace(" & ", ", ");
        int sep = s.indexOf(SEPARATOR);
        if (sep < 0) {
            return s;
        }
        String artistPart = s.substring(0, sep);
        String titlePart = s.substring(sep + SEPARATOR.length());
        String artists = Arrays.stream(artistPart.split(", "))
            .map(String::trim)
            .filter(a -> !a.isEmpty())
            .sorted()
            .collect(Collectors.joining(", "));
        return artists + SEPARATOR + titlePart;
    }

    /**
     * Splits a key back into {artist, title}. A key without separator is treated as a bare title.
     */
    public static String[] split(String key) {
        if (key == null) {
            return new String[] {"", ""};
        }
        int sep = key.indexOf(SEPARATOR);
        if (sep < 0) {
            return new String[] {"", key.trim()};
        }
        return new String[] {key.substring(0, sep).trim(), key.substring(sep + SEPARATOR.length()).trim()};
    }
}
