package com.musicsync.app;

import com.musicsync.engine.BusyException;
import com.musicsync.engine.JobState;
import com.musicsync.engine.SearchMode;
import com.musicsync.engine.SyncState;
import com.musicsync.remote.CrawlWindow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Future;

/**
 * Commands accepted from the presentation layer.
 * <p>
 * Methods returning a {@link Future} start a background job. Every command, job or not, throws
 * {@link BusyException} while another job is running.
 */
public interface SyncServiceInterface extends AutoCloseable {

    StatusSnapshot status();

    /**
     * @return the job slot including its latest progress snapshot
     */
    JobState progress();

    /**
     * Scans the destination folders, reads the capture list and classifies.
     */
    Future<JobState> scan();

    /**
     * Crawls the remote favorites within a window and folds them into the state.
     */
    Future<JobState> crawl(CrawlWindow window);

    /**
     * Searches one key and records the outcome. Never changes favorite state.
     */
    Future<JobState> searchOne(String key);

    Future<JobState> searchAll(SearchMode mode);

    Future<JobState> star(String key);

    /**
     * Crawls the favorites within {@code window}, then searches and favorites every to-download track
     * captured inside the same window. A stop takes effect between tracks.
     */
    Future<JobState> syncAll(CrawlWindow window);

    Future<JobState> unstar(String key);

    /**
     * Unfavorites a key remotely when its remote entry is known and marks it dismissed.
     */
    Future<JobState> dismiss(String key);

    Future<JobState> undismiss(String key);

    /**
     * Downloads a key into the first destination folder.
     */
    Future<JobState> download(String key, String format);

    /**
     * Requests a cooperative stop of the running job.
     * @return true if a job was running
     */
    boolean stop();

    /**
     * Clears every not-found flag.
     * @return number of flags cleared
     */
    int resetNotFound() throws IOException;

    /**
     * Recomputes URLs and not-found flags from the outcome log and saves them.
     */
    SyncState rebuildFromLog() throws IOException;

    /**
     * Fills in remote context (URLs, ids, titles, stars, outcome log) lost from the state file, taken from a
     * backup copy. Values the current state already has are kept.
     */
    SyncState restoreFromBackup(Path backupFile) throws IOException;

    /**
     * Drops stored matches that no longer pass the match threshold.
     * @return keys whose match was removed
     */
    List<String> cleanupMatches() throws IOException;

    void skip(String key) throws IOException;

    void unskip(String key) throws IOException;

    void acknowledgeManualCheck(String key) throws IOException;

    /**
     * Writes the download list as CSV.
     * @return rows written
     */
    int exportDownloadList(Path file) throws IOException;

    @Override
    void close();
}
