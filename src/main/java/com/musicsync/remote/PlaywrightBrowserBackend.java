package com.musicsync.remote;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import com.musicsync.engine.TransientBackendException;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Browser automation backend built on Playwright. It can open tracks that have no resolved id, which makes
 * it the backend of choice for first-time stars and for reading the favorite state when the request backend
 * cannot.
 * <p>
 * Playwright, the browser and its context are started lazily on first use and share the session
 * storage-state file with {@link HttpRequestBackend}.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class PlaywrightBrowserBackend implements RemoteBackend, FavoritesPageSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowserBackend.class);

    static final String NAME = "browser";
    private static final int NAVIGATION_TIMEOUT_MS = 30_000;
    private static final int READY_WAIT_MS = 5_000;
    private static final int TOGGLE_SETTLE_MS = 800;

    private final RemoteUrls urls;
    private final SessionServiceInterface session;
    private final boolean headed;

    private Playwright playwright;
    private BrowserContext context;
    private Page page;

    public PlaywrightBrowserBackend(RemoteUrls urls, SessionServiceInterface session, boolean headed) {
        this.urls = urls;
        this.session = session;
        this.headed = headed;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsUnresolvedTracks() {
        return true;
    }

    @Override
    public synchronized boolean detectSessionExpiry() {
        return page != null && !page.isClosed() && RemoteUrls.isLoginUrl(page.url());
    }

    @Override
    public synchronized List<SearchCandidate> search(String query) {
        Page p = navigate(urls.search(query));
        if (RemoteUrls.isLoginUrl(p.url())) {
            return List.of();
        }
        waitForPageReady(p, "a[href*='/track/']", READY_WAIT_MS);
        return ListingParser.searchCandidates(Jsoup.parse(p.content(), urls.base()), urls);
    }

    @Override
    public synchronized TrackHandle openTrack(TrackRef track) {
        String target = track.hasUrl() ? urls.toAbsolute(track.url()) : null;
        if (target == null) {
            if (!track.hasRemoteId()) {
                throw new TransientBackendException("Nothing to open for '" + track.key() + "'");
            }
            // the listing only knows pages by URL; an id-only track is looked up by its key
            List<SearchCandidate> hits = search(track.artist() + " " + track.title());
            target = hits.stream()
                .filter(c -> track.remoteId().equals(RemoteUrls.trackIdFromUrl(c.url())))
                .map(SearchCandidate::url)
                .findFirst()
                .orElseThrow(() -> new TransientBackendException("Could not find a page for id " + track.remoteId()));
        }
        Page p = navigate(target);
        if (RemoteUrls.isLoginUrl(p.url())) {
            return new TrackHandle(target, track.remoteId());
        }
        waitForPageReady(p, String.join(", ", FavoriteButton.SELECTORS), READY_WAIT_MS);
        String id = track.remoteId();
        if (id == null || id.isBlank()) {
            id = RemoteUrls.trackIdFromUrl(p.url());
        }
        if (id == null) {
            id = safeAttr(p.locator("[data-track-id]"), "data-track-id");
            id = id.isEmpty() ? null : id;
        }
        return new TrackHandle(p.url(), id);
    }

    @Override
    public synchronized FavoriteState readFavoriteState(TrackHandle handle) {
        Page p = ensurePage();
        if (handle.url() != null && !sameTrack(p.url(), handle.url())) {
            p = navigate(handle.url());
        }
        Locator button = favoriteButton(p);
        if (button == null) {
            logger.debug("No favorite button on {}", p.url());
            return FavoriteState.UNKNOWN;
        }
        String flag = safeAttr(button, "data-favorited");
        if (flag.isEmpty()) {
            flag = safeAttr(button, "data-active");
        }
        return FavoriteButton.isFavorited(safeAttr(button, "class"), safeAttr(button, "aria-pressed"), flag)
            ? FavoriteState.FAVORITED : FavoriteState.NOT_FAVORITED;
    }

    @Override
    public synchronized FavoriteState toggleFavorite(TrackHandle handle) {
        Page p = ensurePage();
        if (handle.url() != null && !sameTrack(p.url(), handle.url())) {
            p = navigate(handle.url());
        }
        Locator button = favoriteButton(p);
        if (!safeClick(button, "favorite button")) {
            throw new TransientBackendException("Favorite button not clickable on " + p.url());
        }
        p.waitForTimeout(TOGGLE_SETTLE_MS);
        if (RemoteUrls.isLoginUrl(p.url())) {
            return FavoriteState.UNKNOWN;
        }
        return readFavoriteState(handle);
    }

    @Override
    public synchronized FavoritesPage fetchFavoritesPage(int pageNumber) {
        Page p = navigate(urls.favorites(pageNumber));
        if (RemoteUrls.isLoginUrl(p.url())) {
            return new FavoritesPage(pageNumber, p.url(), List.of(), false);
        }
        if (!waitForPageReady(p, "a[href*='/track/']", READY_WAIT_MS)) {
            throw new TransientBackendException("Favorites page " + pageNumber + " did not finish loading");
        }
        return ListingParser.favorites(pageNumber, p.url(), Jsoup.parse(p.content(), urls.base()), urls);
    }

    /**
     * Opens the login page in a visible window and waits for the user.
     * @return true when a session was saved
     */
    public synchronized boolean login(long timeoutMs) {
        return session.handleManualLogin(ensurePage(), timeoutMs);
    }

    @Override
    public synchronized void close() {
        try {
            if (context != null) {
                session.saveStorageState(context);
                context.close();
            }
        } catch (PlaywrightException e) {
            logger.warn("Failed to close browser context: {}", e.getMessage());
        } finally {
            if (playwright != null) {
                playwright.close();
            }
            playwright = null;
            context = null;
            page = null;
        }
    }

    private Page ensurePage() {
        if (page != null && !page.isClosed()) {
            return page;
        }
        try {
            if (playwright == null) {
                playwright = Playwright.create();
            }
            if (context == null) {
                session.init();
                context = session.setupBrowserContext(playwright, !headed);
                context.setDefaultNavigationTimeout(NAVIGATION_TIMEOUT_MS);
            }
            page = context.newPage();
            logger.info("Browser backend started ({})", headed ? "headed" : "headless");
            return page;
        } catch (PlaywrightException e) {
            throw new TransientBackendException("Failed to start browser: " + e.getMessage(), e);
        }
    }

    private Page navigate(String url) {
        Page p = ensurePage();
        try {
            p.navigate(url);
            logger.debug("Navigated to {} (now at {})", url, p.url());
            return p;
        } catch (PlaywrightException e) {
            throw new TransientBackendException("Navigation to " + url + " failed: " + e.getMessage(), e);
        }
    }

    private Locator favoriteButton(Page p) {
        for (String selector : FavoriteButton.SELECTORS) {
            try {
                Locator l = p.locator(selector);
                if (l.count() > 0) {
                    return l.first();
                }
            } catch (PlaywrightException e) {
                logger.debug("Selector '{}' failed: {}", selector, e.getMessage());
            }
        }
        return null;
    }

    private static boolean sameTrack(String current, String wanted) {
        if (current == null || wanted == null) {
            return false;
        }
        String a = current.split("[?#]")[0];
        String b = wanted.split("[?#]")[0];
        return a.endsWith(b) || b.endsWith(a);
    }

    private String safeAttr(Locator l, String attr) {
        if (l == null) {
            return "";
        }
        try {
            if (l.count() > 0) {
                String s = l.first().getAttribute(attr);
                return s == null ? "" : s.trim();
            }
        } catch (PlaywrightException e) {
            logger.debug("Failed to get attribute '{}': {}", attr, e.getMessage());
        }
        return "";
    }

    private boolean safeClick(Locator locator, String description) {
        if (locator == null) {
            logger.warn("safeClick called with null Locator (desc={}).", description);
            return false;
        }
        try {
            if (locator.count() > 0) {
                locator.first().scrollIntoViewIfNeeded();
                locator.first().click();
                logger.debug("Successfully clicked: {}", description);
                return true;
            }
        } catch (PlaywrightException e) {
            logger.debug("Failed to click {}: {}", description, e.getMessage());
        }
        return false;
    }

    /**
     * Waits for the network to settle and a key selector to appear. A missing selector is logged, not
     * raised, since an empty listing has none.
     *
     * @return false when the page itself never settled
     */
    private boolean waitForPageReady(Page p, String selector, int maxWaitMs) {
        try {
            p.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(maxWaitMs));
        } catch (PlaywrightException e) {
            logger.warn("Page {} did not settle within {} ms: {}", p.url(), maxWaitMs, e.getMessage());
            return false;
        }
        try {
            p.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(maxWaitMs));
        } catch (PlaywrightException e) {
            logger.debug("Selector {} not found within {} ms: {}", selector, maxWaitMs, e.getMessage());
        }
        return true;
    }
}
