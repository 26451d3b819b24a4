package com.musicsync.remote;

import com.musicsync.engine.CancellationToken;
import com.musicsync.engine.CrawlResult;
import com.musicsync.engine.CrawledFavorite;
import com.musicsync.engine.SessionExpiredException;
import com.musicsync.engine.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntConsumer;

/**
 * Walks the remote favorites listing page by page.
 * <p>
 * A login redirect, or a source that reports its session expired, aborts the walk with
 * {@link SessionExpiredException}, so callers can tell an expired session from an account that simply has
 * no favorites. A walk only counts as a full scan when it was
 * unbounded and reached the last page.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class CrawlPaginator {
    private static final Logger logger = LoggerFactory.getLogger(CrawlPaginator.class);

    private final FavoritesPageSource source;
    private final long backoffBaseMs;

    public CrawlPaginator(FavoritesPageSource source, long backoffBaseMs) {
        this.source = source;
        this.backoffBaseMs = backoffBaseMs;
    }

    /**
     * @param window recency bound
     * @param token checked before each page
     * @param onPage receives each page number before it is fetched, may be null
     * @return every favorite seen, deduplicated by URL (or key when no URL)
     */
    public CrawlResult crawl(CrawlWindow window, CancellationToken token, IntConsumer onPage) {
        int maxPages = window.maxPages();
        List<CrawledFavorite> favorites = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        boolean reachedEnd = false;
        int page = 1;
        int visited = 0;
        while (maxPages == 0 || page <= maxPages) {
            if (token != null) {
                token.throwIfCancelled();
            }
            if (onPage != null) {
                onPage.accept(page);
            }
            final int current = page;
            FavoritesPage result = Utils.retryTransient(() -> source.fetchFavoritesPage(current), 2, backoffBaseMs,
                "favorites page " + current);
            visited++;
            if (RemoteUrls.isLoginUrl(result.finalUrl()) || source.detectSessionExpiry()) {
                if (current == 1) {
                    logger.warn("Favorites listing redirected to login on the first page");
                    throw new SessionExpiredException("Redirected to login while opening favorites");
                }
                logger.warn("Favorites listing redirected to login on page {}; discarding partial crawl", current);
                throw new SessionExpiredException("Redirected to login on favorites page " + current);
            }
            int added = 0;
            for (CrawledFavorite fav : result.favorites()) {
                String identity = fav.url() != null ? fav.url() : fav.key();
                if (seen.add(identity)) {
                    favorites.add(fav);
                    added++;
                }
            }
            logger.info("Favorites page {}: {} entries ({} new)", current, result.favorites().size(), added);
            if (result.favorites().isEmpty() || !result.hasNext()) {
                reachedEnd = true;
                break;
            }
            page++;
        }
        boolean fullScan = !window.isBounded() && reachedEnd;
        logger.info("Crawl finished: {} favorites, {} pages, window {}, full scan {}", favorites.size(), visited,
            window.label(), fullScan);
        return new CrawlResult(favorites, visited, fullScan);
    }
}
