package com.musicsync.remote;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RemoteUrlsTest {
    private final RemoteUrls urls = new RemoteUrls("https://soundeo.com/");

    @Test
    void testBuildsUrls() {
        assertEquals("https://soundeo.com", urls.base());
        assertEquals("https://soundeo.com/account/favorites", urls.favorites(1));
        assertEquals("https://soundeo.com/account/favorites?page=3", urls.favorites(3));
        assertEquals("https://soundeo.com/tracks/favor/42", urls.favor("42"));
        assertEquals("https://soundeo.com/list/tracks?searchFilter=CamelPhat+Cola&availableFilter=1", urls.search("CamelPhat Cola"));
        assertEquals("https://soundeo.com/track/x-1.html", urls.toAbsolute("/track/x-1.html"));
        assertEquals("https://other.com/a", urls.toAbsolute("https://other.com/a"));
    }

    @Test
    void testTrackIdFromUrl() {
        assertEquals("4560715", RemoteUrls.trackIdFromUrl("/track/egbert-straktrekken-original-mix-4560715.html"));
        assertEquals("12", RemoteUrls.trackIdFromUrl("https://soundeo.com/track/a-b-12.html?ref=fav"));
        assertNull(RemoteUrls.trackIdFromUrl("https://soundeo.com/track/no-id"));
        assertEquals("77", RemoteUrls.trackIdFromHtml("<div data-track-id=\"77\"></div>"));
    }

    @Test
    void testSpecialPages() {
        assertTrue(RemoteUrls.isLoginUrl("https://soundeo.com/account/logoreg?back=/account/favorites"));
        assertFalse(RemoteUrls.isLoginUrl("https://soundeo.com/account/favorites"));
        assertTrue(RemoteUrls.isPremiumUrl("https://soundeo.com/premium/plans"));
        assertFalse(RemoteUrls.isPremiumUrl("https://soundeo.com/track/premium-mix-1.html"));
    }

    @Test
    void testCrawlWindowParse() {
        assertEquals(CrawlWindow.ONE_MONTH, CrawlWindow.parse("1_month"));
        assertEquals(CrawlWindow.TWO_MONTHS, CrawlWindow.parse("TWO_MONTHS"));
        assertEquals(CrawlWindow.ALL, CrawlWindow.parse(null));
        assertEquals(CrawlWindow.ALL, CrawlWindow.parse("forever"));
        assertFalse(CrawlWindow.ALL.isBounded());
    }
}
