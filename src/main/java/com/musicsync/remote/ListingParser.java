package com.musicsync.remote;

import com.musicsync.engine.CrawledFavorite;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads track listings (search results, favorites pages) with jsoup.
 * The browser backend feeds it {@code page.content()}, the request backend the raw response.
 */
final class ListingParser {
    private static final String TRACK_LINK = "a[href*=/track/]";

    private ListingParser() {}

    /**
     * First {@link SearchMatcher#MAX_CANDIDATES} track links of a search result page.
     */
    static List<SearchCandidate> searchCandidates(Document doc, RemoteUrls urls) {
        List<SearchCandidate> out = new ArrayList<>();
        for (Element link : doc.select(TRACK_LINK)) {
            out.add(new SearchCandidate(absoluteHref(link, urls), link.text().trim()));
            if (out.size() >= SearchMatcher.MAX_CANDIDATES) {
                break;
            }
        }
        return out;
    }

    static FavoritesPage favorites(int page, String finalUrl, Document doc, RemoteUrls urls) {
        List<CrawledFavorite> out = new ArrayList<>();
        for (Element link : doc.select(TRACK_LINK)) {
            String text = link.text().trim();
            if (text.length() < 3 || !text.contains(" - ")) {
                continue;
            }
            String href = absoluteHref(link, urls);
            String id = RemoteUrls.trackIdFromUrl(href);
            if (id == null) {
                Element holder = link.closest("[data-track-id]");
                if (holder != null) {
                    id = holder.attr("data-track-id");
                }
            }
            out.add(new CrawledFavorite(text, href, text, id));
        }
        return new FavoritesPage(page, finalUrl, out, hasNext(doc, page));
    }

    private static String absoluteHref(Element link, RemoteUrls urls) {
        String href = link.attr("abs:href");
        return href.isBlank() ? urls.toAbsolute(link.attr("href")) : href;
    }

    private static boolean hasNext(Document doc, int page) {
        if (doc.selectFirst("a[rel=next], .pagination a.next, li.next:not(.disabled) a") != null) {
            return true;
        }
        return doc.selectFirst("a[href*=page=" + (page + 1) + "]") != null;
    }
}
