package com.musicsync.app;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.musicsync.engine.JobState;
import com.musicsync.engine.JobStatus;
import com.musicsync.engine.ProgressSnapshot;
import com.musicsync.engine.SearchMode;
import com.musicsync.engine.SettingsService;
import com.musicsync.engine.SyncException;
import com.musicsync.engine.SyncSettings;
import com.musicsync.engine.SyncState;
import com.musicsync.remote.CrawlWindow;
import com.musicsync.remote.RemoteUrls;
import com.musicsync.remote.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line entry point for the music library sync.
 * Each job command runs on the job controller; the CLI waits for it and logs progress meanwhile.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final long LOGIN_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(5);
    private static final long PROGRESS_POLL_MS = 2000;

    static final String USAGE = String.join("\n",
        "Usage: music-sync <command> [args]",
        "  status                         show the status snapshot",
        "  scan                           scan destination folders and classify the capture list",
        "  crawl [1_month|2_months|3_months|all]",
        "  sync [1_month|2_months|3_months|all]   crawl, then favorite every to-download track in the window",
        "  search <artist> - <title>      search one track",
        "  search-all [unfound|not_found|all]",
        "  star|unstar|dismiss|undismiss <artist> - <title>",
        "  reset-not-found                clear every not-found flag",
        "  rebuild                        rebuild urls and not-found flags from the outcome log",
        "  restore <backup-file>          take lost urls, ids, stars and outcome log from a state backup",
        "  cleanup                        drop weak matches",
        "  skip|unskip <artist> - <title>",
        "  ack <artist> - <title>         acknowledge an alternate-version warning",
        "  download <artist> - <title> [--format mp3]",
        "  export [file]                  write the download list as CSV",
        "  folders <path>[" + File.pathSeparator + "<path>...]   set destination folders",
        "  login                          sign in through a browser window and save the session");

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int code;
        try {
            code = run(args, new SettingsService().load());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            code = 2;
        }
        System.exit(code);
    }

    static int run(String[] args, SyncSettings settings) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("No command given");
        }
        String command = args[0].trim().toLowerCase(Locale.ROOT);
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        if (command.equals("login")) {
            return login(settings) ? 0 : 1;
        }
        if (command.equals("folders")) {
            return setFolders(settings, rest);
        }
        try (SyncService service = SyncService.create(settings)) {
            Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "sync-stop"));
            return dispatch(service, settings, command, rest);
        } catch (IOException e) {
            logger.error("Command '{}' failed: {}", command, e.getMessage());
            return 1;
        } catch (SyncException e) {
            logger.error("Command '{}' refused ({}): {}", command, e.kind().label(), e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            logger.error("Command '{}' cannot run: {}", command, e.getMessage());
            return 1;
        }
    }

    static int dispatch(SyncServiceInterface service, SyncSettings settings, String command, List<String> rest)
            throws IOException {
        switch (command) {
            case "status":
                printStatus(service.status());
                return 0;
            case "scan":
                return await(service.scan(), service);
            case "crawl":
                return await(service.crawl(CrawlWindow.parse(rest.isEmpty() ? "all" : rest.get(0))), service);
            case "sync":
                return await(service.syncAll(CrawlWindow.parse(rest.isEmpty() ? "all" : rest.get(0))), service);
            case "search":
                return await(service.searchOne(keyArg(rest)), service);
            case "search-all":
                return await(service.searchAll(parseMode(rest.isEmpty() ? "unfound" : rest.get(0))), service);
            case "star":
                return await(service.star(keyArg(rest)), service);
            case "unstar":
                return await(service.unstar(keyArg(rest)), service);
            case "dismiss":
                return await(service.dismiss(keyArg(rest)), service);
            case "undismiss":
                return await(service.undismiss(keyArg(rest)), service);
            case "download": {
                int flag = rest.indexOf("--format");
                String format = flag >= 0 && flag + 1 < rest.size() ? rest.get(flag + 1) : "mp3";
                List<String> keyWords = flag >= 0 ? rest.subList(0, flag) : rest;
                return await(service.download(keyArg(keyWords), format), service);
            }
            case "reset-not-found":
                logger.info("Cleared {} not-found flags", service.resetNotFound());
                return 0;
            case "rebuild": {
                SyncState rebuilt = service.rebuildFromLog();
                System.out.printf("Rebuilt: %d urls, %d not found%n", rebuilt.urls.size(), rebuilt.notFound.size());
                return 0;
            }
            case "restore": {
                if (rest.isEmpty()) {
                    throw new IllegalArgumentException("A backup file is required");
                }
                SyncState restored = service.restoreFromBackup(Paths.get(rest.get(0)));
                System.out.printf("Restored: %d urls, %d outcome entries, %d not found%n", restored.urls.size(),
                    restored.searchOutcomes.size(), restored.notFound.size());
                return 0;
            }
            case "cleanup": {
                List<String> removed = service.cleanupMatches();
                removed.forEach(k -> System.out.println("removed match: " + k));
                System.out.printf("%d weak matches removed%n", removed.size());
                return 0;
            }
            case "skip":
                service.skip(keyArg(rest));
                return 0;
            case "unskip":
                service.unskip(keyArg(rest));
                return 0;
            case "ack":
                service.acknowledgeManualCheck(keyArg(rest));
                return 0;
            case "export": {
                Path file = rest.isEmpty() ? Paths.get(settings.dataDir(), "to-download.csv") : Paths.get(rest.get(0));
                int rows = service.exportDownloadList(file);
                System.out.printf("Wrote %d tracks to %s%n", rows, file);
                return 0;
            }
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    /**
     * Joins the remaining arguments into one "Artist - Title" key.
     */
    static String keyArg(List<String> rest) {
        String key = String.join(" ", rest).trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("A track key 'Artist - Title' is required");
        }
        return key;
    }

    static SearchMode parseMode(String value) {
        try {
            return SearchMode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown search mode: " + value, e);
        }
    }

    private static int await(Future<JobState> future, SyncServiceInterface service) {
        JobState done;
        try {
            while (true) {
                try {
                    done = future.get(PROGRESS_POLL_MS, TimeUnit.MILLISECONDS);
                    break;
                } catch (TimeoutException e) {
                    ProgressSnapshot p = service.progress().progress();
                    logger.info("[{}/{}] {} {}", p.current(), p.total(), p.message(),
                        p.currentKey() == null ? "" : p.currentKey());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            service.stop();
            return 130;
        } catch (ExecutionException e) {
            logger.error("Job crashed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return 1;
        }
        logger.info("Job '{}' {}{}", done.jobName(), done.status().name().toLowerCase(Locale.ROOT),
            done.error() == null ? "" : ": " + done.error());
        return done.status() == JobStatus.COMPLETED ? 0 : 1;
    }

    private static void printStatus(StatusSnapshot s) {
        System.out.printf("To download: %d, have locally: %d, skipped: %d%n",
            s.toDownload().size(), s.haveLocally().size(), s.skipped().size());
        for (String key : s.toDownload()) {
            Boolean starred = s.starred().get(key);
            String flags = (Boolean.TRUE.equals(starred) ? "*" : " ")
                + (Boolean.TRUE.equals(s.notFound().get(key)) ? "?" : " ")
                + (Boolean.TRUE.equals(s.dismissed().get(key)) ? "x" : " ");
            String url = s.urls().get(key);
            System.out.printf("  [%s] %s%s%n", flags, key, url == null ? "" : "  " + url);
        }
        if (!s.manualCheck().isEmpty()) {
            System.out.println("Check these matches (remote version differs):");
            s.manualCheck().forEach(k -> System.out.println("  " + k));
        }
        System.out.printf("Job: %s %s%n", s.job().status(), s.job().jobName() == null ? "" : s.job().jobName());
    }

    private static int setFolders(SyncSettings settings, List<String> rest) {
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("At least one folder is required");
        }
        List<String> folders = Arrays.asList(String.join(" ", rest).split(File.pathSeparator));
        try {
            new SettingsService().save(settings.withDestinationFolders(folders));
            return 0;
        } catch (IOException e) {
            logger.error("Failed to save settings: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * Opens a visible browser on the login page and saves the session once the user has signed in.
     */
    private static boolean login(SyncSettings settings) {
        SessionService session = new SessionService(settings.sessionState(), new RemoteUrls(settings.remoteBaseUrl()));
        session.init();
        try (Playwright playwright = Playwright.create()) {
            BrowserContext context = session.setupBrowserContext(playwright, false);
            Page page = context.newPage();
            boolean ok = session.handleManualLogin(page, LOGIN_TIMEOUT_MS);
            context.browser().close();
            return ok;
        } catch (SyncException | PlaywrightException e) {
            logger.error("Login failed: {}", e.getMessage());
            return false;
        }
    }
}
