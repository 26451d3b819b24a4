package com.musicsync.remote;

import java.util.Locale;

/**
 * Recency bound of a favorites crawl, expressed as the number of newest-first pages to read.
 */
public enum CrawlWindow {
    ONE_MONTH("1_month", 3, 30),
    TWO_MONTHS("2_months", 6, 60),
    THREE_MONTHS("3_months", 10, 91),
    ALL("all", 0, 0);

    private static final long DAY_MS = 86_400_000L;

    private final String label;
    private final int maxPages;
    private final int maxAgeDays;

    CrawlWindow(String label, int maxPages, int maxAgeDays) {
        this.label = label;
        this.maxPages = maxPages;
        this.maxAgeDays = maxAgeDays;
    }

    public String label() {
        return label;
    }

    /**
     * @return page limit, 0 for unbounded
     */
    public int maxPages() {
        return maxPages;
    }

    public boolean isBounded() {
        return maxPages > 0;
    }

    /**
     * Oldest capture time a sync over this window still covers.
     *
     * @return epoch millis, 0 for {@link #ALL}
     */
    public long capturedSince(long now) {
        return maxAgeDays == 0 ? 0 : now - maxAgeDays * DAY_MS;
    }

    /**
     * Parses "1_month", "2_months", "3_months", "all" or an enum name. Unknown or blank input means {@link #ALL}.
     */
    public static CrawlWindow parse(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (CrawlWindow w : values()) {
            if (w.label.equals(v) || w.name().toLowerCase(Locale.ROOT).equals(v)) {
                return w;
            }
        }
        return ALL;
    }
}
