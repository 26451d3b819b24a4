package com.musicsync.app;

import com.musicsync.engine.BusyException;
import com.musicsync.engine.CaptureEntry;
import com.musicsync.engine.CrawledFavorite;
import com.musicsync.engine.CsvService;
import com.musicsync.engine.JobController;
import com.musicsync.engine.JobState;
import com.musicsync.engine.JobStatus;
import com.musicsync.engine.LocalScannerInterface;
import com.musicsync.engine.LocalTrack;
import com.musicsync.engine.OutcomeEntry;
import com.musicsync.engine.SearchMode;
import com.musicsync.engine.StateStore;
import com.musicsync.engine.SyncSettings;
import com.musicsync.engine.SyncState;
import com.musicsync.remote.CrawlPaginator;
import com.musicsync.remote.CrawlWindow;
import com.musicsync.remote.FakeBackend;
import com.musicsync.remote.FavoritesPage;
import com.musicsync.remote.RemoteMutationOrchestrator;
import com.musicsync.remote.SearchCandidate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the service end to end against in-memory backends and a real state file.
 */
public class SyncServiceTest {
    private static final String COLA = "CamelPhat - Cola";
    private static final String GLUE = "Bicep - Glue";
    private static final String STARRY = "Peggy Gou - Starry Night";
    private static final String COLA_URL = "https://example.com/track/camelphat-cola-extended-mix-101.html";
    private static final String STARRY_URL = "https://example.com/track/peggy-gou-starry-night-303.html";

    @TempDir
    Path dir;

    private Path library;
    private SyncSettings settings;
    private StateStore store;
    private FakeBackend request;
    private FakeBackend browser;
    private final List<CaptureEntry> captures = new ArrayList<>();
    private final List<LocalTrack> locals = new ArrayList<>();
    private LocalScannerInterface scanner;
    private SyncService service;

    @BeforeEach
    void setUp() throws Exception {
        library = Files.createDirectories(dir.resolve("library"));
        settings = new SyncSettings(dir.toString(), List.of(library.toString()), null, null, false, false, null, 0);
        store = new StateStore(settings.statePath());
        request = new FakeBackend("request");
        browser = new FakeBackend("browser");
        captures.add(new CaptureEntry("CamelPhat", "Cola", 1));
        captures.add(new CaptureEntry("Bicep", "Glue", 2));
        captures.add(new CaptureEntry("Peggy Gou", "Starry Night", 3));
        locals.add(new LocalTrack("Bicep", "Glue", library.resolve("Bicep - Glue.mp3").toString(), 10, true));
        scanner = (folders, token, onProgress) -> new ArrayList<>(locals);
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private SyncService build(FakeBackend crawlSource) {
        AtomicLong clock = new AtomicLong(1000);
        SyncService s = new SyncService(settings, store, scanner, () -> new ArrayList<>(captures),
            new RemoteMutationOrchestrator(request, browser, false), new CrawlPaginator(crawlSource, 0),
            new CsvService(), new JobController(), List.of());
        s.setClock(clock::incrementAndGet);
        service = s;
        return s;
    }

    private static JobState await(Future<JobState> job) throws Exception {
        return job.get(10, TimeUnit.SECONDS);
    }

    @Test
    void testScanCrawlAndStar() throws Exception {
        request.page(new FavoritesPage(1, "https://example.com/account/favorites", List.of(
            new CrawledFavorite("CamelPhat - Cola (Extended Mix)", COLA_URL, "CamelPhat - Cola (Extended Mix)", "101")), false));
        request.track(STARRY_URL, "303", false);
        browser.searchResult("Peggy Gou Starry Night", new SearchCandidate(STARRY_URL, "Peggy Gou - Starry Night"));
        SyncService s = build(request);

        assertEquals(JobStatus.COMPLETED, await(s.scan()).status());
        StatusSnapshot afterScan = s.status();
        assertEquals(List.of(COLA, STARRY), afterScan.toDownload());
        assertEquals(List.of(GLUE), afterScan.haveLocally());
        assertTrue(afterScan.lastScanAt() > 0);

        assertEquals(JobStatus.COMPLETED, await(s.crawl(CrawlWindow.ALL)).status());
        StatusSnapshot afterCrawl = s.status();
        assertEquals(Boolean.TRUE, afterCrawl.starred().get(COLA));
        assertEquals(COLA_URL, afterCrawl.urls().get(COLA));

        assertEquals(JobStatus.COMPLETED, await(s.searchOne(STARRY)).status());
        assertEquals(STARRY_URL, s.status().urls().get(STARRY));
        assertEquals("303", store.load().remoteIds.get(STARRY));

        // typed in lowercase, resolved to the app key
        assertEquals(JobStatus.COMPLETED, await(s.star("peggy gou - starry night")).status());
        assertEquals(Boolean.TRUE, s.status().starred().get(STARRY));
        assertEquals(1, request.toggles);

        assertEquals(JobStatus.COMPLETED, await(s.star(STARRY)).status());
        assertEquals(1, request.toggles);

        assertEquals(JobStatus.COMPLETED, await(s.unstar(STARRY)).status());
        assertEquals(Boolean.FALSE, s.status().starred().get(STARRY));
        assertFalse(request.isFavorited(STARRY_URL));
        // the repeated star changed nothing, so only two flips are logged
        assertEquals(2, store.load().mutationLog.stream().filter(m -> m.key().equals(STARRY)).count());
    }

    @Test
    void testSearchNotFoundThenFound() throws Exception {
        SyncService s = build(request);
        await(s.scan());

        assertEquals(JobStatus.COMPLETED, await(s.searchOne(STARRY)).status());
        assertEquals(Boolean.TRUE, s.status().notFound().get(STARRY));
        assertNull(s.status().urls().get(STARRY));

        browser.searchResult("Starry Night Peggy Gou", new SearchCandidate(STARRY_URL, "Peggy Gou - Starry Night (Extended Mix)"));
        assertEquals(JobStatus.COMPLETED, await(s.searchAll(SearchMode.NOT_FOUND)).status());
        StatusSnapshot status = s.status();
        assertNull(status.notFound().get(STARRY));
        assertEquals(STARRY_URL, status.urls().get(STARRY));
    }

    @Test
    void testSessionExpiryIsRecordedAsFailureNotNotFound() throws Exception {
        SyncService s = build(request);
        await(s.scan());
        browser.sessionExpired = true;

        assertEquals(JobStatus.COMPLETED, await(s.searchOne(STARRY)).status());
        SyncState state = store.load();
        assertFalse(state.notFound.containsKey(STARRY));
        OutcomeEntry last = state.searchOutcomes.get(state.searchOutcomes.size() - 1);
        assertEquals("failed:session_expired", last.action());
    }

    @Test
    void testCrawlRedirectedToLoginFails() throws Exception {
        request.page(new FavoritesPage(1, "https://example.com/account/logoreg", List.of(), false));
        SyncService s = build(request);
        await(s.scan());

        JobState crawl = await(s.crawl(CrawlWindow.ALL));
        assertEquals(JobStatus.FAILED, crawl.status());
        assertTrue(s.status().starred().isEmpty());
        assertEquals(0, s.status().lastCrawlAt());
    }

    @Test
    void testBoundedCrawlCrossChecksUnseenStars() throws Exception {
        request.page(new FavoritesPage(1, "https://example.com/account/favorites", List.of(), false));
        request.track(STARRY_URL, "303", false);
        SyncService s = build(request);
        await(s.scan());
        store.update(st -> {
            st.starred.put(STARRY, true);
            st.urls.put(STARRY, STARRY_URL);
            st.remoteIds.put(STARRY, "303");
            st.starred.put(COLA, true);
        });

        assertEquals(JobStatus.COMPLETED, await(s.crawl(CrawlWindow.ONE_MONTH)).status());
        StatusSnapshot status = s.status();
        assertEquals(Boolean.FALSE, status.starred().get(STARRY));
        // nothing known remotely, so the flag stays as it was
        assertEquals(Boolean.TRUE, status.starred().get(COLA));
        assertEquals(0, request.toggles);
    }

    @Test
    void testBusyServiceRejectsCommands() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scanner = (folders, token, onProgress) -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ArrayList<>(locals);
        };
        SyncService s = build(request);
        Future<JobState> scan = s.scan();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertThrows(BusyException.class, () -> s.crawl(CrawlWindow.ALL));
        assertThrows(BusyException.class, () -> s.star(COLA));
        assertThrows(BusyException.class, () -> s.skip(COLA));
        assertThrows(BusyException.class, s::resetNotFound);
        assertEquals(JobStatus.RUNNING, s.progress().status());

        release.countDown();
        assertEquals(JobStatus.COMPLETED, await(scan).status());
    }

    @Test
    void testStopAfterThirdTrack() throws Exception {
        captures.clear();
        for (int i = 1; i <= 10; i++) {
            captures.add(new CaptureEntry("Artist " + i, "Title " + i, i));
        }
        AtomicReference<SyncService> ref = new AtomicReference<>();
        browser = new FakeBackend("browser") {
            @Override
            public List<SearchCandidate> search(String query) {
                if (query.equals("Artist 3 Title 3")) {
                    ref.get().stop();
                }
                return super.search(query);
            }
        };
        SyncService s = build(request);
        ref.set(s);
        await(s.scan());

        JobState job = await(s.searchAll(SearchMode.ALL));
        assertEquals(JobStatus.STOPPED, job.status());
        SyncState state = store.load();
        assertEquals(3, state.notFound.size());
        assertTrue(state.notFound.containsKey("Artist 3 - Title 3"));
        assertFalse(state.notFound.containsKey("Artist 4 - Title 4"));
    }

    @Test
    void testSyncStopRequestedDuringSearchFinishesThatTrack() throws Exception {
        captures.clear();
        locals.clear();
        AtomicReference<SyncService> ref = new AtomicReference<>();
        browser = new FakeBackend("browser") {
            @Override
            public List<SearchCandidate> search(String query) {
                if (query.equals("Artist 3 Title 3")) {
                    ref.get().stop();
                }
                return super.search(query);
            }
        };
        for (int i = 1; i <= 10; i++) {
            captures.add(new CaptureEntry("Artist " + i, "Title " + i, i));
            String url = "https://example.com/track/artist-" + i + "-title-" + i + "-" + (1000 + i) + ".html";
            browser.searchResult("Artist " + i + " Title " + i, new SearchCandidate(url, "Artist " + i + " - Title " + i));
            request.track(url, String.valueOf(1000 + i), false);
        }
        SyncService s = build(request);
        ref.set(s);
        await(s.scan());

        JobState job = await(s.syncAll(CrawlWindow.ALL));
        assertEquals(JobStatus.STOPPED, job.status());
        assertEquals(3, request.toggles);
        SyncState state = store.load();
        assertEquals(Boolean.TRUE, state.starred.get("Artist 3 - Title 3"));
        assertEquals("1003", state.remoteIds.get("Artist 3 - Title 3"));
        assertTrue(request.isFavorited("https://example.com/track/artist-3-title-3-1003.html"));
        for (int i = 4; i <= 10; i++) {
            String key = "Artist " + i + " - Title " + i;
            assertFalse(state.starred.containsKey(key), key);
            assertFalse(state.urls.containsKey(key), key);
            assertFalse(state.notFound.containsKey(key), key);
        }
        assertEquals(List.of("sync", "sync", "sync"), state.mutationLog.stream().map(m -> m.source()).toList());
    }

    @Test
    void testSyncCoversWindowOnlyAndRecordsNotFound() throws Exception {
        long now = 200L * 24 * 3600 * 1000;
        long day = 24L * 3600 * 1000;
        captures.clear();
        captures.add(new CaptureEntry("CamelPhat", "Cola", now - 5 * day));
        captures.add(new CaptureEntry("Peggy Gou", "Starry Night", now - 10 * day));
        captures.add(new CaptureEntry("Bicep", "Glue", now - 90 * day));
        captures.add(new CaptureEntry("Fred again..", "Delilah", now - 20 * day));
        locals.clear();
        request.page(new FavoritesPage(1, "https://example.com/account/favorites", List.of(
            new CrawledFavorite(COLA, COLA_URL, COLA, "101")), false));
        request.track(COLA_URL, "101", true);
        request.track(STARRY_URL, "303", false);
        browser.searchResult("Peggy Gou Starry Night", new SearchCandidate(STARRY_URL, "Peggy Gou - Starry Night"));
        SyncService s = build(request);
        s.setClock(() -> now);
        await(s.scan());

        assertEquals(JobStatus.COMPLETED, await(s.syncAll(CrawlWindow.ONE_MONTH)).status());
        SyncState state = store.load();
        // already a favorite after the crawl, so never searched again
        assertFalse(browser.queries.contains("CamelPhat Cola"));
        assertEquals(Boolean.TRUE, state.starred.get(STARRY));
        assertEquals(STARRY_URL, state.urls.get(STARRY));
        assertEquals(Boolean.TRUE, state.notFound.get("Fred again.. - Delilah"));
        // captured before the window
        assertFalse(browser.queries.contains("Bicep Glue"));
        assertFalse(state.notFound.containsKey(GLUE));
        assertEquals(1, request.toggles);
    }

    @Test
    void testRestoreFromBackupFillsLostContext() throws Exception {
        SyncState backup = SyncState.empty();
        backup.urls.put(STARRY, STARRY_URL);
        backup.urls.put(COLA, "https://example.com/track/old-cola-1.html");
        backup.remoteIds.put(STARRY, "303");
        backup.starred.put(STARRY, true);
        backup.searchOutcomes.add(OutcomeEntry.found(10, STARRY, STARRY_URL));
        backup.searchOutcomes.add(OutcomeEntry.notFound(11, GLUE));
        Path backupFile = dir.resolve("status-backup.json");
        new StateStore(backupFile).save(backup);

        store.update(st -> {
            st.urls.put(COLA, COLA_URL);
            st.notFound.put(COLA, true);
        });
        SyncService s = build(request);

        SyncState restored = s.restoreFromBackup(backupFile);
        assertEquals(COLA_URL, restored.urls.get(COLA));
        assertEquals(STARRY_URL, restored.urls.get(STARRY));
        assertEquals("303", restored.remoteIds.get(STARRY));
        assertEquals(Boolean.TRUE, restored.starred.get(STARRY));
        assertEquals(2, restored.searchOutcomes.size());
        // not-found follows the restored log
        assertEquals(Map.of(GLUE, true), restored.notFound);
        assertEquals(restored.urls, store.load().urls);
    }

    @Test
    void testDismissAndUndismiss() throws Exception {
        request.track(COLA_URL, "101", true);
        SyncService s = build(request);
        await(s.scan());
        store.update(st -> {
            st.urls.put(COLA, COLA_URL);
            st.remoteIds.put(COLA, "101");
            st.starred.put(COLA, true);
        });

        assertEquals(JobStatus.COMPLETED, await(s.dismiss(COLA)).status());
        assertEquals(Boolean.TRUE, s.status().dismissed().get(COLA));
        assertFalse(request.isFavorited(COLA_URL));

        // no remote entry: local only
        assertEquals(JobStatus.COMPLETED, await(s.dismiss(STARRY)).status());
        assertEquals(Boolean.TRUE, s.status().dismissed().get(STARRY));

        assertEquals(JobStatus.COMPLETED, await(s.undismiss(COLA)).status());
        assertNull(s.status().dismissed().get(COLA));
        assertTrue(request.isFavorited(COLA_URL));
    }

    @Test
    void testDownloadMovesTrackToLibrary() throws Exception {
        request.track(COLA_URL, "101", false);
        request.canDownload = true;
        SyncService s = build(request);
        await(s.scan());
        store.update(st -> {
            st.urls.put(COLA, COLA_URL);
            st.remoteIds.put(COLA, "101");
        });

        assertEquals(JobStatus.COMPLETED, await(s.download(COLA, "mp3")).status());
        assertTrue(Files.exists(library.resolve(COLA + ".mp3")));
        StatusSnapshot status = s.status();
        assertFalse(status.toDownload().contains(COLA));
        assertTrue(status.haveLocally().contains(COLA));
    }

    @Test
    void testDownloadWithoutRemoteEntryIsRecordedAsFailure() throws Exception {
        SyncService s = build(request);
        await(s.scan());
        assertEquals(JobStatus.COMPLETED, await(s.download(STARRY, "mp3")).status());
        SyncState state = store.load();
        assertEquals("failed:not_found", state.searchOutcomes.get(state.searchOutcomes.size() - 1).action());
        assertTrue(state.toDownload.contains(STARRY));
    }

    @Test
    void testMaintenanceCommands() throws Exception {
        SyncService s = build(request);
        await(s.scan());
        await(s.searchOne(STARRY));
        assertEquals(1, s.resetNotFound());
        assertTrue(s.status().notFound().isEmpty());
        assertTrue(s.rebuildFromLog().notFound.isEmpty());

        s.skip(COLA);
        await(s.scan());
        assertEquals(List.of(COLA), s.status().skipped());
        s.unskip(COLA);
        await(s.scan());
        assertEquals(List.of(COLA, STARRY), s.status().toDownload());

        store.update(st -> {
            st.urls.put(STARRY, STARRY_URL);
            st.remoteTitles.put(STARRY, "Somebody - Else Entirely");
        });
        assertEquals(List.of(STARRY), s.cleanupMatches());

        Path csv = dir.resolve("export.csv");
        assertEquals(2, s.exportDownloadList(csv));
        assertEquals(3, Files.readAllLines(csv).size());
    }

    @Test
    void testManualCheckAcknowledgement() throws Exception {
        SyncService s = build(request);
        await(s.scan());
        store.update(st -> {
            st.urls.put(COLA, COLA_URL);
            st.remoteTitles.put(COLA, "CamelPhat - Cola (Radio Edit)");
        });
        assertEquals(List.of(COLA), s.status().manualCheck());
        s.acknowledgeManualCheck("camelphat - cola");
        assertTrue(s.status().manualCheck().isEmpty());
    }
}
