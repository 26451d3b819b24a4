package com.musicsync.remote;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ListingParserTest {
    private final RemoteUrls urls = new RemoteUrls("https://soundeo.com");

    @Test
    void testFavoritesPage() {
        String html = "<html><body>"
            + "<a href=\"/track/camelphat-cola-extended-mix-101.html\">CamelPhat - Cola (Extended Mix)</a>"
            + "<div data-track-id=\"202\"><a href=\"/track/bicep-glue\">Bicep - Glue</a></div>"
            + "<a href=\"/track/\">More</a>"
            + "<ul class=\"pagination\"><li><a href=\"/account/favorites?page=2\">2</a></li></ul>"
            + "</body></html>";
        FavoritesPage page = ListingParser.favorites(1, urls.favorites(1), Jsoup.parse(html, urls.base()), urls);

        assertEquals(2, page.favorites().size());
        assertEquals("CamelPhat - Cola (Extended Mix)", page.favorites().get(0).key());
        assertEquals("https://soundeo.com/track/camelphat-cola-extended-mix-101.html", page.favorites().get(0).url());
        assertEquals("101", page.favorites().get(0).remoteId());
        assertEquals("202", page.favorites().get(1).remoteId());
        assertTrue(page.hasNext());
    }

    @Test
    void testLastPageHasNoNext() {
        String html = "<a href=\"/track/a-b-1.html\">A - B</a><li class=\"next disabled\"><a href=\"#\">next</a></li>";
        FavoritesPage page = ListingParser.favorites(4, urls.favorites(4), Jsoup.parse(html, urls.base()), urls);
        assertFalse(page.hasNext());
    }

    @Test
    void testSearchCandidates() {
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            html.append("<a href=\"/track/t-").append(i).append(".html\"> Artist - Track ").append(i).append(" </a>");
        }
        List<SearchCandidate> candidates = ListingParser.searchCandidates(Jsoup.parse(html.toString(), urls.base()), urls);
        assertEquals(SearchMatcher.MAX_CANDIDATES, candidates.size());
        assertEquals("Artist - Track 0", candidates.get(0).text());
        assertEquals("https://soundeo.com/track/t-0.html", candidates.get(0).url());
    }

    @Test
    void testFavoriteButtonMarkers() {
        assertTrue(FavoriteButton.isFavorited("btn favorite active", "", ""));
        assertTrue(FavoriteButton.isFavorited("btn favorites-added", "", ""));
        assertTrue(FavoriteButton.isFavorited("btn", "true", ""));
        assertTrue(FavoriteButton.isFavorited("btn", "", "1"));
        assertFalse(FavoriteButton.isFavorited("btn favorite", "false", ""));
        assertFalse(FavoriteButton.isFavorited(null, null, null));
    }

    @Test
    void testFavoriteStateFromHtml() {
        assertEquals(FavoriteState.FAVORITED,
            HttpRequestBackend.favoriteStateFromHtml("<button class=\"favorite active\">Fav</button>"));
        assertEquals(FavoriteState.NOT_FAVORITED,
            HttpRequestBackend.favoriteStateFromHtml("<button class=\"favorites\" data-favorited=\"false\">Fav</button>"));
        assertEquals(FavoriteState.UNKNOWN, HttpRequestBackend.favoriteStateFromHtml("<p>no button</p>"));
    }
}
