package com.musicsync.remote;

import com.musicsync.engine.SessionExpiredException;
import com.musicsync.engine.TrackNotFoundException;
import com.musicsync.engine.TransientBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RemoteMutationOrchestratorTest {
    private static final String URL = "https://example.com/track/camelphat-cola-101.html";
    private static final String KEY = "CamelPhat - Cola";

    private FakeBackend request;
    private FakeBackend browser;
    private RemoteMutationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        request = new FakeBackend("request");
        browser = new FakeBackend("browser");
        orchestrator = new RemoteMutationOrchestrator(request, browser, false);
    }

    @Test
    void testAlreadyFavoritedSendsNoToggle() {
        request.track(URL, "101", true);
        StarResult result = orchestrator.ensureFavorited(TrackRef.of(KEY, URL, "101"));
        assertTrue(result.starred());
        assertEquals(0, result.togglesIssued());
        assertFalse(result.changed());
        assertEquals(0, request.toggles);
        assertTrue(request.isFavorited(URL));
    }

    @Test
    void testRepeatedStarIsIdempotent() {
        request.track(URL, "101", false);
        orchestrator.ensureFavorited(TrackRef.of(KEY, URL, "101"));
        orchestrator.ensureFavorited(TrackRef.of(KEY, URL, "101"));
        assertEquals(1, request.toggles);
        assertTrue(request.isFavorited(URL));
    }

    @Test
    void testUnresolvedTrackGoesThroughBrowserAndReturnsId() {
        browser.track(URL, "101", false);
        StarResult result = orchestrator.ensureFavorited(TrackRef.of(KEY, URL, null));
        assertEquals("browser", result.backend());
        assertEquals("101", result.remoteId());
        assertEquals(0, request.opens);
        assertTrue(browser.isFavorited(URL));
    }

    @Test
    void testUnreadableRequestStateFallsBackToBrowser() {
        request.track(URL, "101", false);
        request.unreadable = true;
        browser.track(URL, "101", false);
        StarResult result = orchestrator.ensureFavorited(TrackRef.of(KEY, URL, "101"));
        assertEquals("browser", result.backend());
        assertEquals(0, request.toggles);
        assertEquals(1, browser.toggles);
    }

    @Test
    void testUnknownStateIsNeverToggled() {
        request.track(URL, "101", true);
        request.unreadable = true;
        RemoteMutationOrchestrator requestOnly = new RemoteMutationOrchestrator(request, null, false);
        assertThrows(TransientBackendException.class, () -> requestOnly.ensureFavorited(TrackRef.of(KEY, URL, "101")));
        assertEquals(0, request.toggles);
        assertTrue(request.isFavorited(URL));
    }

    @Test
    void testWrongWayToggleIsFlippedBack() {
        request.track(URL, "101", true);
        request.staleRead = true;
        StarResult result = orchestrator.ensureFavorited(TrackRef.of(KEY, URL, "101"));
        assertEquals(2, result.togglesIssued());
        assertTrue(request.isFavorited(URL));
    }

    @Test
    void testUnfavoriteLeavesUnfavoritedTrackAlone() {
        request.track(URL, "101", false);
        StarResult result = orchestrator.ensureUnfavorited(TrackRef.of(KEY, URL, "101"));
        assertFalse(result.starred());
        assertEquals(0, request.toggles);

        request.track(URL, "101", true);
        orchestrator.ensureUnfavorited(TrackRef.of(KEY, URL, "101"));
        assertEquals(1, request.toggles);
        assertFalse(request.isFavorited(URL));
    }

    @Test
    void testLoginRedirectIsSessionExpired() {
        request.track(URL, "101", false);
        request.sessionExpired = true;
        assertThrows(SessionExpiredException.class, () -> orchestrator.ensureFavorited(TrackRef.of(KEY, URL, "101")));
        assertEquals(0, request.toggles);
    }

    @Test
    void testNothingKnownIsNotFound() {
        assertThrows(TrackNotFoundException.class, () -> orchestrator.ensureFavorited(TrackRef.of(KEY, null, null)));
    }

    @Test
    void testFindAndFavoriteSearchesFirst() {
        browser.track(URL, "101", false)
            .searchResult("CamelPhat Cola", new SearchCandidate(URL, "CamelPhat - Cola (Extended Mix)"));
        StarResult result = orchestrator.findAndFavorite(TrackRef.of(KEY, null, null));
        assertTrue(result.starred());
        assertEquals(URL, result.url());
        assertEquals(List.of("CamelPhat Cola"), browser.queries);
    }

    @Test
    void testFindAndFavoriteWithoutMatch() {
        assertThrows(TrackNotFoundException.class, () -> orchestrator.findAndFavorite(TrackRef.of(KEY, null, null)));
        assertEquals(4, browser.queries.size());
        assertEquals(0, browser.toggles);
    }

    @Test
    void testSearchTriesVariantsAndPicksBest() {
        browser.searchResult("Cola CamelPhat",
            new SearchCandidate("https://example.com/track/other-1.html", "Somebody - Else"),
            new SearchCandidate("https://example.com/track/cola-2.html", "Camel Phat - Cola (Original Mix)"),
            new SearchCandidate("https://example.com/track/cola-3.html", "Camel Phat - Cola (Extended Mix)"));
        Optional<SearchHit> hit = orchestrator.search("CamelPhat", "Cola");
        assertTrue(hit.isPresent());
        assertEquals("https://example.com/track/cola-3.html", hit.get().url());
        assertEquals("Cola CamelPhat", hit.get().query());
        assertEquals(0, request.queries.size());
    }

    @Test
    void testSearchViaRequestBackend() {
        RemoteMutationOrchestrator viaRequest = new RemoteMutationOrchestrator(request, browser, true);
        viaRequest.search("CamelPhat", "Cola");
        assertEquals(4, request.queries.size());
        assertTrue(browser.queries.isEmpty());
    }

    @Test
    void testReadStateDoesNotToggle() {
        request.track(URL, "101", true);
        assertEquals(FavoriteState.FAVORITED, orchestrator.readState(TrackRef.of(KEY, URL, "101")));
        assertEquals(0, request.toggles);
    }

    @Test
    void testDownloadResolvesIdThroughBrowser(@TempDir Path dir) throws Exception {
        browser.track(URL, "101", false);
        request.track(URL, "101", false);
        request.canDownload = true;
        Path file = orchestrator.download(TrackRef.of(KEY, URL, null), "mp3", dir, KEY);
        assertEquals("audio 101", Files.readString(file));
    }

    @Test
    void testDownloadNeedsRequestBackend(@TempDir Path dir) {
        RemoteMutationOrchestrator browserOnly = new RemoteMutationOrchestrator(null, browser, false);
        assertThrows(TransientBackendException.class,
            () -> browserOnly.download(TrackRef.of(KEY, URL, "101"), "mp3", dir, KEY));
    }

    @Test
    void testAtLeastOneBackend() {
        assertThrows(IllegalArgumentException.class, () -> new RemoteMutationOrchestrator(null, null, false));
    }
}
