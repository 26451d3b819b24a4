package com.musicsync.remote;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL layout of the remote catalogue service.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public final class RemoteUrls {
    public static final String LOGIN_PATH = "/account/logoreg";
    public static final String FAVORITES_PATH = "/account/favorites";
    public static final String PREMIUM_PATH = "/premium";

    private static final Pattern ID_SUFFIX = Pattern.compile("-(\\d+)\\.html(?:[?#].*)?$");
    private static final Pattern DATA_TRACK_ID = Pattern.compile("data-track-id=[\"'](\\d+)[\"']");

    private final String baseUrl;

    public RemoteUrls(String baseUrl) {
        String b = baseUrl == null || baseUrl.isBlank() ? "https://soundeo.com" : baseUrl.trim();
        this.baseUrl = b.endsWith("/") ? b.substring(0, b.length() - 1) : b;
    }

    public String base() {
        return baseUrl;
    }

    public String login() {
        return baseUrl + LOGIN_PATH;
    }

    public String search(String query) {
        return baseUrl + "/list/tracks?searchFilter=" + URLEncoder.encode(query, StandardCharsets.UTF_8) + "&availableFilter=1";
    }

    /**
     * Favorites listing, page numbers start at 1.
     */
    public String favorites(int page) {
        return page <= 1 ? baseUrl + FAVORITES_PATH : baseUrl + FAVORITES_PATH + "?page=" + page;
    }

    public String favor(String remoteId) {
        return baseUrl + "/tracks/favor/" + remoteId;
    }

    public String download(String remoteId, String format) {
        return baseUrl + "/download/" + remoteId + "/" + format;
    }

    public String toAbsolute(String url) {
        if (url == null) return null;
        if (url.startsWith("http")) return url;
        if (url.startsWith("/")) return baseUrl + url;
        return baseUrl + "/" + url;
    }

    public static boolean isLoginUrl(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains(LOGIN_PATH);
    }

    public static boolean isPremiumUrl(String url) {
        if (url == null) return false;
        try {
            String path = URI.create(url).getPath();
            return path != null && path.toLowerCase(Locale.ROOT).startsWith(PREMIUM_PATH);
        } catch (IllegalArgumentException e) {
            return url.toLowerCase(Locale.ROOT).contains(PREMIUM_PATH);
        }
    }

    /**
     * Track id from a URL such as {@code /track/egbert-straktrekken-original-mix-4560715.html}.
     * @return id or null
     */
    public static String trackIdFromUrl(String url) {
        if (url == null) return null;
        Matcher m = ID_SUFFIX.matcher(url);
        return m.find() ? m.group(1) : null;
    }

    /**
     * First {@code data-track-id} attribute found in raw page markup.
     * @return id or null
     */
    public static String trackIdFromHtml(String html) {
        if (html == null) return null;
        Matcher m = DATA_TRACK_ID.matcher(html);
        return m.find() ? m.group(1) : null;
    }
}
