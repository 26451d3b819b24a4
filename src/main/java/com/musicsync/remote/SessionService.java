package com.musicsync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.musicsync.engine.TransientBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Owns the saved remote session: one Playwright storage-state file used by the browser backend directly
 * and by the request backend as a cookie jar.
 * <p>
 * A storage-state file that does not look like JSON, or that Playwright refuses, is moved aside as
 * {@code storage-state.json.invalid-<millis>} and a fresh context is created.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public final class SessionService implements SessionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    private static final String LOGIN_FORM_SELECTOR = "form[action*='logoreg'], input[type='password']";

    private final Path storageFile;
    private final RemoteUrls urls;
    private final ObjectMapper mapper = new ObjectMapper();

    public SessionService(Path storageFile, RemoteUrls urls) {
        this.storageFile = storageFile;
        this.urls = urls;
    }

    @Override
    public void init() {
        try {
            Path parent = storageFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            logger.info("Session service initialized. Storage state: {} (present: {})", storageFile, Files.exists(storageFile));
        } catch (IOException e) {
            logger.warn("Session service init failed to create directories: {}", e.getMessage());
        }
    }

    @Override
    public BrowserContext createOrRestoreContext(Browser browser) {
        Browser.NewContextOptions contextOptions = new Browser.NewContextOptions().setViewportSize(1440, 900);
        boolean usingState = false;
        if (Files.exists(storageFile)) {
            if (looksLikeJson(storageFile)) {
                contextOptions.setStorageStatePath(storageFile);
                usingState = true;
                logger.info("Using existing storage state from {} to restore session.", storageFile);
            } else {
                backup("invalid");
            }
        } else {
            logger.info("No existing storage state found; starting a fresh context.");
        }
        try {
            return browser.newContext(contextOptions);
        } catch (RuntimeException e) {
            if (!usingState) {
                throw new TransientBackendException("Failed to create browser context: " + e.getMessage(), e);
            }
            logger.warn("Playwright failed to create context using storage state: {}. Retrying without it.", e.getMessage());
            backup("playwright-error");
            try {
                return browser.newContext(new Browser.NewContextOptions().setViewportSize(1440, 900));
            } catch (RuntimeException ex) {
                logger.error("Failed to create a fresh browser context: {}", ex.getMessage());
                throw new TransientBackendException("Failed to create browser context: " + ex.getMessage(), ex);
            }
        }
    }

    private boolean looksLikeJson(Path file) {
        try {
            String content = Files.readString(file).stripLeading();
            return content.startsWith("{") || content.startsWith("[");
        } catch (IOException e) {
            logger.warn("Failed to read storage state '{}': {}", file, e.getMessage());
            return false;
        }
    }

    private void backup(String reason) {
        Path backup = storageFile.resolveSibling(storageFile.getFileName() + "." + reason + "-" + System.currentTimeMillis());
        try {
            Files.move(storageFile, backup);
            logger.warn("Storage state was unusable ({}). Backed up to {}; starting a fresh context.", reason, backup);
        } catch (IOException mv) {
            logger.warn("Unusable storage state could not be backed up: {}. It will be ignored.", mv.getMessage());
        }
    }

    @Override
    public BrowserContext setupBrowserContext(Playwright playwright, boolean headless) {
        try {
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setArgs(Arrays.asList("--disable-dev-shm-usage", "--lang=en-US"));
            Browser browser = playwright.chromium().launch(options);
            return createOrRestoreContext(browser);
        } catch (TransientBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Failed to launch browser: {}", e.getMessage());
            throw new TransientBackendException("Failed to launch browser: " + e.getMessage(), e);
        }
    }

    @Override
    public void saveStorageState(BrowserContext context) {
        try {
            init();
            context.storageState(new BrowserContext.StorageStateOptions().setPath(storageFile));
            logger.info("Saved storage state to {}", storageFile);
        } catch (RuntimeException e) {
            logger.warn("Failed to save storage state: {}", e.getMessage());
        }
    }

    @Override
    public boolean handleManualLogin(Page page, long timeoutMs) {
        page.navigate(urls.login());
        logger.info("Please complete the login in the opened browser window. Waiting up to {} s.", timeoutMs / 1000);
        long deadline = System.currentTimeMillis() + timeoutMs;
        int poll = 500;
        while (System.currentTimeMillis() < deadline) {
            if (page.isClosed()) {
                logger.warn("Browser window closed before login completed.");
                return false;
            }
            if (!RemoteUrls.isLoginUrl(page.url()) && isAuthenticated(page)) {
                logger.info("Login detected at {}", page.url());
                saveStorageState(page.context());
                return true;
            }
            page.waitForTimeout(poll);
            poll = Math.min(2000, poll * 2);
        }
        logger.warn("Timed out waiting for manual login.");
        return false;
    }

    @Override
    public boolean isAuthenticated(Page page) {
        if (page == null || page.isClosed()) {
            return false;
        }
        if (RemoteUrls.isLoginUrl(page.url())) {
            return false;
        }
        try {
            Locator loginForm = page.locator(LOGIN_FORM_SELECTOR);
            return loginForm.count() == 0;
        } catch (RuntimeException e) {
            logger.debug("Could not inspect page for a login form: {}", e.getMessage());
            return true;
        }
    }

    @Override
    public boolean hasSavedSession() {
        return Files.exists(storageFile) && looksLikeJson(storageFile);
    }

    @Override
    public String cookieHeader(URI target) {
        if (!hasSavedSession()) {
            return "";
        }
        String host = target.getHost() == null ? "" : target.getHost().toLowerCase(Locale.ROOT);
        String path = target.getPath() == null || target.getPath().isEmpty() ? "/" : target.getPath();
        List<String> pairs = new ArrayList<>();
        try {
            JsonNode root = mapper.readTree(storageFile.toFile());
            // Playwright writes {"cookies": [...]}; a bare array of cookies is accepted as well
            JsonNode cookies = root.isArray() ? root : root.path("cookies");
            if (!cookies.isArray()) {
                return "";
            }
            long nowSeconds = System.currentTimeMillis() / 1000;
            for (JsonNode c : cookies) {
                String name = c.path("name").asText("");
                if (name.isEmpty()) continue;
                String domain = c.path("domain").asText("").toLowerCase(Locale.ROOT);
                String cookiePath = c.path("path").asText("/");
                double expires = c.path("expires").asDouble(-1);
                if (expires > 0 && expires < nowSeconds) continue;
                if (!domainMatches(host, domain) || !path.startsWith(cookiePath)) continue;
                pairs.add(name + "=" + c.path("value").asText(""));
            }
        } catch (IOException e) {
            logger.warn("Failed to read cookies from {}: {}", storageFile, e.getMessage());
            return "";
        }
        return String.join("; ", pairs);
    }

    static boolean domainMatches(String host, String cookieDomain) {
        if (cookieDomain.isEmpty()) return true;
        String d = cookieDomain.startsWith(".") ? cookieDomain.substring(1) : cookieDomain;
        return host.equals(d) || host.endsWith("." + d);
    }
}
