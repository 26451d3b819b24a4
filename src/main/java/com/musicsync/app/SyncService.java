package com.musicsync.app;

import com.musicsync.engine.BatchRunner;
import com.musicsync.engine.BusyException;
import com.musicsync.engine.CaptureEntry;
import com.musicsync.engine.CaptureListReaderInterface;
import com.musicsync.engine.CrawlResult;
import com.musicsync.engine.CsvCaptureListReader;
import com.musicsync.engine.CsvService;
import com.musicsync.engine.CsvServiceInterface;
import com.musicsync.engine.ErrorKind;
import com.musicsync.engine.JobContext;
import com.musicsync.engine.JobController;
import com.musicsync.engine.JobState;
import com.musicsync.engine.JobTask;
import com.musicsync.engine.LocalScanner;
import com.musicsync.engine.LocalScannerInterface;
import com.musicsync.engine.LocalTrack;
import com.musicsync.engine.ReconciliationEngine;
import com.musicsync.engine.SearchMode;
import com.musicsync.engine.StateStore;
import com.musicsync.engine.StateStoreInterface;
import com.musicsync.engine.SyncException;
import com.musicsync.engine.SyncSettings;
import com.musicsync.engine.SyncState;
import com.musicsync.engine.TrackKey;
import com.musicsync.engine.TrackKeyIndex;
import com.musicsync.engine.TrackNotFoundException;
import com.musicsync.remote.CrawlPaginator;
import com.musicsync.remote.CrawlWindow;
import com.musicsync.remote.FavoriteState;
import com.musicsync.remote.FavoritesPageSource;
import com.musicsync.remote.HttpRequestBackend;
import com.musicsync.remote.PlaywrightBrowserBackend;
import com.musicsync.remote.RemoteMutationOrchestrator;
import com.musicsync.remote.RemoteUrls;
import com.musicsync.remote.SearchHit;
import com.musicsync.remote.SessionService;
import com.musicsync.remote.StarResult;
import com.musicsync.remote.TrackRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * Facade wiring the reconciliation engine, the state store and the remote side into the commands the
 * presentation layer issues.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Long-running commands run as jobs on the {@link JobController}; the rest refuse to run while a job is busy.</li>
 *   <li>Per-track batches go through {@link BatchRunner}, and every track's result is written with its own
 *   {@link StateStoreInterface#update} call, so a stop or crash never loses a finished track.</li>
 *   <li>Failures are written to the outcome log. A failed search never sets not-found; only a search that
 *   completed without an acceptable candidate does.</li>
 * </ul>
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class SyncService implements SyncServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(SyncService.class);

    private final SyncSettings settings;
    private final StateStoreInterface store;
    private final LocalScannerInterface scanner;
    private final CaptureListReaderInterface captureReader;
    private final RemoteMutationOrchestrator orchestrator;
    private final CrawlPaginator paginator;
    private final CsvServiceInterface csvService;
    private final JobController jobs;
    private final BatchRunner batch;
    private final List<AutoCloseable> resources;
    private final ReconciliationEngine engine = new ReconciliationEngine();
    private LongSupplier clock = System::currentTimeMillis;

    public SyncService(SyncSettings settings, StateStoreInterface store, LocalScannerInterface scanner,
                       CaptureListReaderInterface captureReader, RemoteMutationOrchestrator orchestrator,
                       CrawlPaginator paginator, CsvServiceInterface csvService, JobController jobs,
                       List<AutoCloseable> resources) {
        this.settings = settings;
        this.store = store;
        this.scanner = scanner;
        this.captureReader = captureReader;
        this.orchestrator = orchestrator;
        this.paginator = paginator;
        this.csvService = csvService;
        this.jobs = jobs;
        this.batch = new BatchRunner(settings.retryBackoffMs());
        this.resources = resources == null ? List.of() : List.copyOf(resources);
    }

    /**
     * Builds the service with the real backends: the request backend reads cookies from the saved session and
     * the browser backend starts Playwright on first use. Crawls use the request backend once a session was
     * saved, the browser otherwise.
     */
    public static SyncService create(SyncSettings settings) {
        RemoteUrls urls = new RemoteUrls(settings.remoteBaseUrl());
        SessionService session = new SessionService(settings.sessionState(), urls);
        session.init();
        HttpRequestBackend request = new HttpRequestBackend(urls, session);
        PlaywrightBrowserBackend browser = new PlaywrightBrowserBackend(urls, session, settings.headedMode());
        RemoteMutationOrchestrator orchestrator =
            new RemoteMutationOrchestrator(request, browser, settings.searchUseRequestBackend());
        FavoritesPageSource crawlSource = session.hasSavedSession() ? request : browser;
        return new SyncService(settings,
            new StateStore(settings.statePath()),
            new LocalScanner(),
            new CsvCaptureListReader(settings.captureList()),
            orchestrator,
            new CrawlPaginator(crawlSource, settings.retryBackoffMs()),
            new CsvService(),
            new JobController(),
            List.of(browser));
    }

    void setClock(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public StatusSnapshot status() {
        SyncState s = store.load();
        engine.replay(s);
        List<String> manual = s.urls.keySet().stream()
            .filter(k -> engine.needsManualCheck(s, k))
            .collect(Collectors.toList());
        return new StatusSnapshot(
            List.copyOf(s.toDownload),
            List.copyOf(s.haveLocally),
            List.copyOf(s.skippedTracks),
            Collections.unmodifiableMap(new LinkedHashMap<>(s.urls)),
            Collections.unmodifiableMap(new LinkedHashMap<>(s.starred)),
            Collections.unmodifiableMap(new LinkedHashMap<>(s.notFound)),
            Collections.unmodifiableMap(new LinkedHashMap<>(s.dismissed)),
            manual,
            s.lastScanAt,
            s.lastCrawlAt,
            jobs.snapshot());
    }

    @Override
    public JobState progress() {
        return jobs.snapshot();
    }

    @Override
    public Future<JobState> scan() {
        return submit("scan", ctx -> {
            ctx.message("Scanning local folders");
            List<LocalTrack> locals = scanner.scan(settings.destinationFolders(), ctx.token(),
                (done, total) -> ctx.progress(done, total, "Scanning local folders", null));
            ctx.message("Reading capture list");
            List<CaptureEntry> captures = captureReader.read();
            long now = clock.getAsLong();
            store.update(s -> {
                engine.classify(captures, locals, s);
                s.lastScanAt = now;
            });
        });
    }

    @Override
    public Future<JobState> crawl(CrawlWindow window) {
        return submit("crawl " + window.label(), ctx -> crawlAndMerge(window, ctx));
    }

    private void crawlAndMerge(CrawlWindow window, JobContext ctx) throws Exception {
        CrawlResult result = paginator.crawl(window, ctx.token(),
            page -> ctx.progress(page, window.maxPages(), "Crawling favorites", null));
        long now = clock.getAsLong();
        SyncState saved = store.update(s -> {
            engine.mergeCrawl(s, result, now);
            s.lastCrawlWindow = window.label();
        });
        List<String> verify = engine.crossCheckCandidates(saved, result);
        if (!verify.isEmpty()) {
            logger.info("Checking {} starred tracks the {} crawl did not reach", verify.size(), window.label());
            batch.run("Cross-check", verify, ctx, k -> k, new BatchRunner.ItemHandler<String>() {
                @Override
                public void process(String key) throws IOException {
                    crossCheck(key);
                }

                @Override
                public void onFailure(String key, SyncException failure) {
                    logger.debug("Cross-check of '{}' left unchanged: {}", key, failure.getMessage());
                }
            });
        }
    }

    private void crossCheck(String key) throws IOException {
        TrackRef ref = ref(store.load(), key);
        if (!ref.hasUrl() && !ref.hasRemoteId()) {
            logger.debug("Cross-check skipped '{}': no remote entry known", key);
            return;
        }
        FavoriteState live = orchestrator.readState(ref);
        if (live == FavoriteState.NOT_FAVORITED) {
            long now = clock.getAsLong();
            store.update(s -> engine.recordUnstarred(s, key, null, ReconciliationEngine.SOURCE_CRAWL, now));
            logger.info("'{}' is no longer favorited remotely; demoted", key);
        }
    }

    @Override
    public Future<JobState> searchOne(String key) {
        String resolved = resolveKey(key);
        return submit("search", ctx -> batch.run("Search", List.of(resolved), ctx, k -> k, searchHandler(ctx)));
    }

    @Override
    public Future<JobState> searchAll(SearchMode mode) {
        return submit("search all " + mode.name().toLowerCase(Locale.ROOT), ctx -> {
            List<String> keys = engine.searchCandidates(store.load(), mode);
            logger.info("Searching {} tracks (mode {})", keys.size(), mode);
            batch.run("Search", keys, ctx, k -> k, searchHandler(ctx));
        });
    }

    private BatchRunner.ItemHandler<String> searchHandler(JobContext ctx) {
        return new BatchRunner.ItemHandler<String>() {
            @Override
            public void process(String key) throws IOException {
                String[] parts = TrackKey.split(key);
                Optional<SearchHit> hit = orchestrator.search(parts[0], parts[1]);
                long now = clock.getAsLong();
                if (hit.isPresent()) {
                    SearchHit h = hit.get();
                    ctx.lastUrl(h.url());
                    store.update(s -> {
                        engine.recordFound(s, key, h.url(), h.remoteTitle(), h.score(), now);
                        engine.recordRemoteId(s, key, RemoteUrls.trackIdFromUrl(h.url()));
                    });
                } else {
                    store.update(s -> engine.recordNotFound(s, key, now));
                }
            }

            @Override
            public void onFailure(String key, SyncException failure) throws IOException {
                recordFailure(key, failure.kind());
            }
        };
    }

    @Override
    public Future<JobState> star(String key) {
        String resolved = resolveKey(key);
        return submit("star", ctx -> batch.run("Star", List.of(resolved), ctx, k -> k, new BatchRunner.ItemHandler<String>() {
            @Override
            public void process(String k) throws IOException {
                StarResult result = orchestrator.findAndFavorite(ref(store.load(), k));
                ctx.lastUrl(result.url());
                long now = clock.getAsLong();
                store.update(s -> engine.recordStarred(s, k, result.url(), result.remoteId(),
                    ReconciliationEngine.SOURCE_STAR, now));
            }

            @Override
            public void onFailure(String k, SyncException failure) throws IOException {
                if (failure.kind() == ErrorKind.NOT_FOUND) {
                    long now = clock.getAsLong();
                    store.update(s -> engine.recordNotFound(s, k, now));
                } else {
                    recordFailure(k, failure.kind());
                }
            }
        }));
    }

    @Override
    public Future<JobState> syncAll(CrawlWindow window) {
        return submit("sync " + window.label(), ctx -> {
            ctx.message("Reading remote favorites");
            crawlAndMerge(window, ctx);
            List<String> keys = engine.syncCandidates(store.load(), window.capturedSince(clock.getAsLong()));
            logger.info("Syncing {} tracks to remote favorites (window {})", keys.size(), window.label());
            batch.run("Sync", keys, ctx, k -> k, new BatchRunner.ItemHandler<String>() {
                @Override
                public void process(String k) throws IOException {
                    syncTrack(k, ctx);
                }

                @Override
                public void onFailure(String k, SyncException failure) throws IOException {
                    recordFailure(k, failure.kind());
                }
            });
        });
    }

    /**
     * Searches the track when no remote entry is known yet, then favorites it. The search result and the
     * star are written together; a search without a match writes not-found and stops there.
     */
    private void syncTrack(String key, JobContext ctx) throws IOException {
        TrackRef ref = ref(store.load(), key);
        SearchHit hit = null;
        if (!ref.hasUrl() && !ref.hasRemoteId()) {
            String[] parts = TrackKey.split(key);
            Optional<SearchHit> found = orchestrator.search(parts[0], parts[1]);
            if (found.isEmpty()) {
                long now = clock.getAsLong();
                store.update(s -> engine.recordNotFound(s, key, now));
                return;
            }
            hit = found.get();
            ref = TrackRef.of(key, hit.url(), RemoteUrls.trackIdFromUrl(hit.url()));
            ctx.lastUrl(hit.url());
        }
        final SearchHit searched = hit;
        StarResult result;
        try {
            result = orchestrator.ensureFavorited(ref);
        } catch (SyncException e) {
            if (searched != null) {
                long now = clock.getAsLong();
                store.update(s -> recordSearchHit(s, key, searched, now));
            }
            throw e;
        }
        ctx.lastUrl(result.url());
        long now = clock.getAsLong();
        store.update(s -> {
            if (searched != null) {
                recordSearchHit(s, key, searched, now);
            }
            engine.recordStarred(s, key, result.url(), result.remoteId(), ReconciliationEngine.SOURCE_SYNC, now);
        });
    }

    private void recordSearchHit(SyncState s, String key, SearchHit hit, long now) {
        engine.recordFound(s, key, hit.url(), hit.remoteTitle(), hit.score(), now);
        engine.recordRemoteId(s, key, RemoteUrls.trackIdFromUrl(hit.url()));
    }

    @Override
    public Future<JobState> unstar(String key) {
        String resolved = resolveKey(key);
        return submit("unstar", ctx -> batch.run("Unstar", List.of(resolved), ctx, k -> k, new BatchRunner.ItemHandler<String>() {
            @Override
            public void process(String k) throws IOException {
                TrackRef ref = ref(store.load(), k);
                if (!ref.hasUrl() && !ref.hasRemoteId()) {
                    throw new TrackNotFoundException("No remote entry known for '" + k + "'");
                }
                StarResult result = orchestrator.ensureUnfavorited(ref);
                long now = clock.getAsLong();
                store.update(s -> engine.recordUnstarred(s, k, result.remoteId(), ReconciliationEngine.SOURCE_UNSTAR, now));
            }

            @Override
            public void onFailure(String k, SyncException failure) throws IOException {
                recordFailure(k, failure.kind());
            }
        }));
    }

    @Override
    public Future<JobState> dismiss(String key) {
        String resolved = resolveKey(key);
        return submit("dismiss", ctx -> batch.run("Dismiss", List.of(resolved), ctx, k -> k, new BatchRunner.ItemHandler<String>() {
            @Override
            public void process(String k) throws IOException {
                TrackRef ref = ref(store.load(), k);
                String remoteId = null;
                if (ref.hasUrl() || ref.hasRemoteId()) {
                    remoteId = orchestrator.ensureUnfavorited(ref).remoteId();
                } else {
                    logger.info("'{}' has no remote entry; dismissing locally only", k);
                }
                final String id = remoteId;
                long now = clock.getAsLong();
                store.update(s -> engine.recordDismissed(s, k, id, now));
            }

            @Override
            public void onFailure(String k, SyncException failure) throws IOException {
                recordFailure(k, failure.kind());
            }
        }));
    }

    @Override
    public Future<JobState> undismiss(String key) {
        String resolved = resolveKey(key);
        return submit("undismiss", ctx -> batch.run("Undismiss", List.of(resolved), ctx, k -> k, new BatchRunner.ItemHandler<String>() {
            @Override
            public void process(String k) throws IOException {
                StarResult result = orchestrator.findAndFavorite(ref(store.load(), k));
                ctx.lastUrl(result.url());
                long now = clock.getAsLong();
                store.update(s -> engine.recordUndismissed(s, k, result.url(), result.remoteId(), now));
            }

            @Override
            public void onFailure(String k, SyncException failure) throws IOException {
                recordFailure(k, failure.kind());
            }
        }));
    }

    @Override
    public Future<JobState> download(String key, String format) {
        if (settings.destinationFolders().isEmpty()) {
            throw new IllegalStateException("No destination folder configured");
        }
        Path targetDir = Paths.get(settings.destinationFolders().get(0));
        String resolved = resolveKey(key);
        String fmt = format == null || format.isBlank() ? "mp3" : format;
        return submit("download", ctx -> batch.run("Download", List.of(resolved), ctx, k -> k, new BatchRunner.ItemHandler<String>() {
            @Override
            public void process(String k) throws IOException {
                TrackRef ref = ref(store.load(), k);
                if (!ref.hasUrl() && !ref.hasRemoteId()) {
                    throw new TrackNotFoundException("No remote entry known for '" + k + "'; search it first");
                }
                Path file = orchestrator.download(ref, fmt, targetDir, k);
                store.update(s -> engine.recordDownloaded(s, k, file.toAbsolutePath().toString()));
            }

            @Override
            public void onFailure(String k, SyncException failure) throws IOException {
                recordFailure(k, failure.kind());
            }
        }));
    }

    @Override
    public boolean stop() {
        return jobs.stop();
    }

    @Override
    public int resetNotFound() throws IOException {
        requireIdle();
        long now = clock.getAsLong();
        int[] cleared = new int[1];
        store.update(s -> cleared[0] = engine.resetNotFound(s, now));
        return cleared[0];
    }

    @Override
    public SyncState rebuildFromLog() throws IOException {
        requireIdle();
        SyncState rebuilt = store.update(engine::replay);
        logger.info("Rebuilt status from {} outcome entries: {} urls, {} not found",
            rebuilt.searchOutcomes.size(), rebuilt.urls.size(), rebuilt.notFound.size());
        return rebuilt;
    }

    @Override
    public SyncState restoreFromBackup(Path backupFile) throws IOException {
        requireIdle();
        SyncState backup = store.read(backupFile);
        long now = clock.getAsLong();
        SyncState restored = store.merge(current -> engine.restorePatch(current, backup, now));
        logger.info("Restored remote context from {}: {} urls, {} outcome entries, {} not found",
            backupFile, restored.urls.size(), restored.searchOutcomes.size(), restored.notFound.size());
        return restored;
    }

    @Override
    public List<String> cleanupMatches() throws IOException {
        requireIdle();
        long now = clock.getAsLong();
        List<String> removed = new ArrayList<>();
        store.update(s -> removed.addAll(engine.cleanupMatches(s, now)));
        return removed;
    }

    @Override
    public void skip(String key) throws IOException {
        requireIdle();
        store.update(s -> engine.skip(s, key));
    }

    @Override
    public void unskip(String key) throws IOException {
        requireIdle();
        store.update(s -> engine.unskip(s, key));
    }

    @Override
    public void acknowledgeManualCheck(String key) throws IOException {
        requireIdle();
        String resolved = resolveKey(key);
        store.update(s -> engine.acknowledgeManualCheck(s, resolved));
    }

    @Override
    public int exportDownloadList(Path file) throws IOException {
        SyncState s = store.load();
        engine.replay(s);
        return csvService.writeDownloadList(s, file);
    }

    @Override
    public void close() {
        jobs.close();
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private Future<JobState> submit(String name, JobTask task) {
        jobs.acknowledge();
        return jobs.submit(name, task);
    }

    private void requireIdle() {
        JobState current = jobs.snapshot();
        if (current.isRunning()) {
            throw new BusyException(current.jobName());
        }
    }

    private void recordFailure(String key, ErrorKind kind) throws IOException {
        long now = clock.getAsLong();
        store.update(s -> engine.recordFailure(s, key, kind, now));
    }

    /**
     * Maps a user-typed key onto the app key it matches, strictest tier first.
     */
    private String resolveKey(String key) {
        requireIdle();
        String trimmed = key == null ? "" : key.trim();
        SyncState s = store.load();
        return TrackKeyIndex.ofKeys(engine.appKeys(s)).find(trimmed)
            .map(TrackKeyIndex.Match::key)
            .orElse(trimmed);
    }

    private static TrackRef ref(SyncState s, String key) {
        String url = ReconciliationEngine.lookup(s.urls, key).orElse(null);
        String id = ReconciliationEngine.lookup(s.remoteIds, key).orElse(null);
        return TrackRef.of(key, url, id);
    }
}
