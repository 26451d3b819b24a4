package com.musicsync.engine;

import java.util.List;

/**
 * Outcome of one walk over the remote favorites listing.
 *
 * @param favorites every entry seen, in listing order
 * @param pagesVisited number of pages fetched
 * @param fullScan true when the walk was not bounded by a page limit and reached the end of the listing
 */
public record CrawlResult(List<CrawledFavorite> favorites, int pagesVisited, boolean fullScan) {

    public boolean isEmpty() {
        return favorites == null || favorites.isEmpty();
    }
}
