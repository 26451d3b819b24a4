package com.musicsync.engine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for CSV export of the download list.
 */
public interface CsvServiceInterface {
    /**
     * Writes every {@code to_download} key of the state with its remote facts.
     * @param state current state
     * @param file output CSV file; parent directories are created
     * @return number of rows written, header excluded
     * @throws IOException if file writing fails
     */
    int writeDownloadList(SyncState state, Path file) throws IOException;
}
