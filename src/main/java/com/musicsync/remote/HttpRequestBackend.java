package com.musicsync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicsync.engine.CancelledException;
import com.musicsync.engine.PremiumRequiredException;
import com.musicsync.engine.SessionExpiredException;
import com.musicsync.engine.TransientBackendException;
import com.musicsync.engine.Utils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lightweight backend that talks to the catalogue service over plain HTTP with the saved session cookies.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Cookies come from the Playwright storage-state file through {@link SessionServiceInterface#cookieHeader(URI)}.</li>
 *   <li>Favorites are toggled with an XHR-style {@code POST /tracks/favor/{id}}; the JSON reply says
 *   {@code favored} or {@code unfavored}.</li>
 *   <li>Track pages and search pages are parsed with jsoup.</li>
 *   <li>Any response that ends on the login page marks the session as expired.</li>
 * </ul>
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class HttpRequestBackend implements RemoteBackend, FavoritesPageSource {
    private static final Logger logger = LoggerFactory.getLogger(HttpRequestBackend.class);

    static final String NAME = "request";
    private static final Duration TIMEOUT = Duration.ofSeconds(15);
    private static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private final RemoteUrls urls;
    private final SessionServiceInterface session;
    private final HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private volatile boolean sessionExpired;

    public HttpRequestBackend(RemoteUrls urls, SessionServiceInterface session) {
        this(urls, session, HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(TIMEOUT)
            .build());
    }

    public HttpRequestBackend(RemoteUrls urls, SessionServiceInterface session, HttpClient client) {
        this.urls = urls;
        this.session = session;
        this.client = client;
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
    public boolean detectSessionExpiry() {
        return sessionExpired;
    }

    @Override
    public List<SearchCandidate> search(String query) {
        HttpResponse<String> response = get(urls.search(query), null);
        if (sessionExpired) {
            return List.of();
        }
        return ListingParser.searchCandidates(Jsoup.parse(response.body(), urls.base()), urls);
    }

    @Override
    public TrackHandle openTrack(TrackRef track) {
        String id = track.remoteId();
        String url = track.hasUrl() ? urls.toAbsolute(track.url()) : null;
        if ((id == null || id.isBlank()) && url != null) {
            id = RemoteUrls.trackIdFromUrl(url);
            if (id == null) {
                HttpResponse<String> page = get(url, null);
                if (!sessionExpired) {
                    id = RemoteUrls.trackIdFromHtml(page.body());
                }
            }
            if (id != null) {
                logger.debug("Resolved remote id {} for {}", id, url);
            }
        }
        return new TrackHandle(url, id);
    }

    @Override
    public FavoriteState readFavoriteState(TrackHandle handle) {
        if (handle.url() == null) {
            logger.debug("No page URL for id {}; favorite state unknown to {}", handle.remoteId(), NAME);
            return FavoriteState.UNKNOWN;
        }
        HttpResponse<String> page = get(handle.url(), null);
        if (sessionExpired) {
            return FavoriteState.UNKNOWN;
        }
        return favoriteStateFromHtml(page.body());
    }

    /**
     * Reads the favorite button of a track page.
     */
    static FavoriteState favoriteStateFromHtml(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        for (String selector : FavoriteButton.SELECTORS) {
            Element button = doc.selectFirst(selector);
            if (button != null) {
                return FavoriteButton.isFavorited(button.className(), button.attr("aria-pressed"),
                    button.hasAttr("data-favorited") ? button.attr("data-favorited") : button.attr("data-active"))
                    ? FavoriteState.FAVORITED : FavoriteState.NOT_FAVORITED;
            }
        }
        return FavoriteState.UNKNOWN;
    }

    @Override
    public FavoriteState toggleFavorite(TrackHandle handle) {
        if (!handle.hasRemoteId()) {
            throw new TransientBackendException("Request backend needs a remote id to toggle");
        }
        HttpRequest request = baseRequest(urls.favor(handle.remoteId()), handle.url())
            .header("X-Requested-With", "XMLHttpRequest")
            .header("Accept", "application/json, text/javascript, */*; q=0.01")
            .header("Origin", urls.base())
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());
        if (sessionExpired) {
            return FavoriteState.UNKNOWN;
        }
        FavoriteState state = parseToggleResult(response.body());
        logger.debug("Toggle {} -> {}", handle.remoteId(), state);
        return state;
    }

    FavoriteState parseToggleResult(String body) {
        if (body == null || body.isBlank()) {
            return FavoriteState.UNKNOWN;
        }
        String verdict = body;
        try {
            JsonNode root = mapper.readTree(body);
            for (String field : new String[] {"result", "status", "action", "state"}) {
                JsonNode v = root.path(field);
                if (v.isTextual()) {
                    verdict = v.asText();
                    break;
                }
            }
        } catch (IOException e) {
            logger.debug("Toggle reply is not JSON: {}", e.getMessage());
        }
        String v = verdict.toLowerCase(Locale.ROOT);
        if (v.contains("unfavored") || v.contains("unfavorited")) {
            return FavoriteState.NOT_FAVORITED;
        }
        if (v.contains("favored") || v.contains("favorited")) {
            return FavoriteState.FAVORITED;
        }
        return FavoriteState.UNKNOWN;
    }

    @Override
    public FavoritesPage fetchFavoritesPage(int page) {
        HttpResponse<String> response = get(urls.favorites(page), null);
        String finalUrl = response.uri().toString();
        if (sessionExpired) {
            throw new SessionExpiredException("Favorites page " + page + " refused the session (HTTP "
                + response.statusCode() + ", ended on " + finalUrl + ")");
        }
        if (response.statusCode() / 100 != 2) {
            throw new TransientBackendException("Favorites page " + page + " returned " + response.statusCode());
        }
        Document doc = Jsoup.parse(response.body(), urls.base());
        return ListingParser.favorites(page, finalUrl, doc, urls);
    }

    @Override
    public Path download(TrackHandle handle, String format, Path targetDir, String baseName) {
        if (!handle.hasRemoteId()) {
            throw new TransientBackendException("Request backend needs a remote id to download");
        }
        HttpRequest request = baseRequest(urls.download(handle.remoteId(), format), handle.url())
            .header("X-Requested-With", "XMLHttpRequest")
            .header("Accept", "application/json, text/javascript, */*; q=0.01")
            .GET()
            .build();
        HttpResponse<InputStream> response = send(request, HttpResponse.BodyHandlers.ofInputStream());
        checkRedirects(response);
        String contentType = response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        try (InputStream body = response.body()) {
            if (contentType.contains("application/json") || contentType.contains("text/")) {
                String text = new String(body.readAllBytes(), StandardCharsets.UTF_8);
                String fileUrl = fileUrlFromReply(text);
                logger.info("Download reply for {} points to {}", handle.remoteId(), fileUrl);
                HttpResponse<InputStream> file = send(baseRequest(urls.toAbsolute(fileUrl), handle.url()).GET().build(),
                    HttpResponse.BodyHandlers.ofInputStream());
                checkRedirects(file);
                try (InputStream fileBody = file.body()) {
                    return writeFile(fileBody, targetDir, baseName, extensionOf(file, fileUrl));
                }
            }
            return writeFile(body, targetDir, baseName, extensionOf(response, request.uri().toString()));
        } catch (IOException e) {
            throw new TransientBackendException("Download of " + handle.remoteId() + " failed: " + e.getMessage(), e);
        }
    }

    private String fileUrlFromReply(String text) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (IOException e) {
            throw new TransientBackendException("Unexpected download reply: " + text.substring(0, Math.min(120, text.length())));
        }
        String error = root.path("error").asText(root.path("message").asText("")).toLowerCase(Locale.ROOT);
        if (error.contains("premium") || error.contains("subscription")) {
            throw new PremiumRequiredException("Download needs a premium account: " + error);
        }
        for (String field : new String[] {"url", "link", "download_url", "file"}) {
            String v = root.path(field).asText("");
            if (!v.isBlank()) {
                return v;
            }
        }
        throw new TransientBackendException("Download reply carries no file link");
    }

    private Path writeFile(InputStream in, Path targetDir, String baseName, String ext) throws IOException {
        Files.createDirectories(targetDir);
        Path target = targetDir.resolve(Utils.sanitizeFilename(baseName) + ext);
        Path tmp = target.resolveSibling(target.getFileName() + ".part");
        Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Downloaded {}", target);
        return target;
    }

    private static String extensionOf(HttpResponse<?> response, String url) {
        Optional<String> disposition = response.headers().firstValue("Content-Disposition");
        String name = disposition.map(d -> {
            int i = d.toLowerCase(Locale.ROOT).indexOf("filename=");
            return i < 0 ? "" : d.substring(i + 9).replace("\"", "").trim();
        }).orElse("");
        if (name.isEmpty()) {
            String path = URI.create(url).getPath();
            name = path == null ? "" : path;
        }
        int dot = name.lastIndexOf('.');
        if (dot >= 0 && name.length() - dot <= 6) {
            return name.substring(dot).toLowerCase(Locale.ROOT);
        }
        return ".mp3";
    }

    private void checkRedirects(HttpResponse<?> response) {
        String finalUrl = response.uri().toString();
        if (RemoteUrls.isLoginUrl(finalUrl)) {
            sessionExpired = true;
            throw new SessionExpiredException("Download redirected to login");
        }
        if (RemoteUrls.isPremiumUrl(finalUrl)) {
            throw new PremiumRequiredException("Download redirected to " + finalUrl);
        }
    }

    private HttpResponse<String> get(String url, String referer) {
        return send(baseRequest(url, referer).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder baseRequest(String url, String referer) {
        URI uri = URI.create(url);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(TIMEOUT)
            .header("User-Agent", USER_AGENT)
            .header("Referer", referer == null ? urls.base() + "/" : referer);
        String cookies = session.cookieHeader(uri);
        if (!cookies.isEmpty()) {
            builder.header("Cookie", cookies);
        }
        return builder;
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        HttpResponse<T> response;
        try {
            response = client.send(request, handler);
        } catch (IOException e) {
            throw new TransientBackendException(request.method() + " " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("Interrupted during " + request.method() + " " + request.uri());
        }
        sessionExpired = RemoteUrls.isLoginUrl(response.uri().toString());
        if (sessionExpired) {
            logger.warn("{} {} ended on the login page", request.method(), request.uri());
        }
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientBackendException(request.method() + " " + request.uri() + " returned " + status);
        }
        if (status == 401 || status == 403) {
            sessionExpired = true;
        }
        return response;
    }
}
