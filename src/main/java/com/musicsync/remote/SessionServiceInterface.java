package com.musicsync.remote;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;

import java.net.URI;

/**
 * Interface for session-related operations: Playwright context lifecycle, interactive login and the
 * saved cookies the request backend reuses.
 */
public interface SessionServiceInterface {
    /**
     * Ensures the directory of the storage-state file exists. Safe to call multiple times.
     */
    void init();

    /**
     * Creates a new browser context or restores one from the saved storage state.
     * @param browser Playwright browser instance
     * @return BrowserContext with restored session state if available
     */
    BrowserContext createOrRestoreContext(Browser browser);

    /**
     * Launches Chromium and returns a context created via {@link #createOrRestoreContext(Browser)}.
     * @param playwright Playwright instance
     * @param headless run without a visible window
     * @return configured context
     */
    BrowserContext setupBrowserContext(Playwright playwright, boolean headless);

    /**
     * Saves the context's storage state so both backends can reuse the session.
     * @param context Browser context to save
     */
    void saveStorageState(BrowserContext context);

    /**
     * Opens the login page and waits until the user has signed in (the page leaves the login URL),
     * then saves the storage state.
     * @param page page to use
     * @param timeoutMs how long to wait for the user
     * @return true when the login completed in time
     */
    boolean handleManualLogin(Page page, long timeoutMs);

    /**
     * @param page page currently shown
     * @return true unless the page sits on the login URL or shows a login form
     */
    boolean isAuthenticated(Page page);

    /**
     * Builds a {@code Cookie} header value for requests to {@code target} from the saved storage state.
     * @param target request URI
     * @return header value, empty when no cookie applies
     */
    String cookieHeader(URI target);

    /**
     * @return whether a usable storage-state file exists
     */
    boolean hasSavedSession();
}
