package com.musicsync.remote;

import java.util.List;
import java.util.Locale;

/**
 * How a track page marks its favorite button. Shared by both backends.
 */
final class FavoriteButton {
    static final List<String> SELECTORS = List.of(
        "button.favorites",
        "button.favorite",
        "button[class*='favorite']",
        "button[data-track-id]"
    );

    private static final List<String> ACTIVE_CLASSES = List.of("active", "favorited", "starred", "selected", "added");

    private FavoriteButton() {}

    /**
     * @param classes class attribute of the button
     * @param ariaPressed aria-pressed attribute, may be empty
     * @param dataFlag data-favorited or data-active attribute, may be empty
     */
    static boolean isFavorited(String classes, String ariaPressed, String dataFlag) {
        String cls = classes == null ? "" : classes.toLowerCase(Locale.ROOT);
        for (String token : cls.split("\\s+")) {
            for (String active : ACTIVE_CLASSES) {
                if (token.equals(active) || token.endsWith("-" + active) || token.endsWith("_" + active)) {
                    return true;
                }
            }
        }
        if ("true".equalsIgnoreCase(ariaPressed == null ? "" : ariaPressed.trim())) {
            return true;
        }
        String flag = dataFlag == null ? "" : dataFlag.trim().toLowerCase(Locale.ROOT);
        return flag.equals("true") || flag.equals("1");
    }
}
