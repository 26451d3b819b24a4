package com.musicsync.engine;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports the download list to CSV using OpenCSV.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final List<String> COLUMNS = List.of("Artist", "Title", "URL", "RemoteId", "Starred", "NotFound");

    @Override
    public int writeDownloadList(SyncState state, Path file) throws IOException {
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        int rows = 0;
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(COLUMNS.toArray(String[]::new));
            for (String key : state.toDownload) {
                String[] parts = TrackKey.split(key);
                Boolean starred = state.starred.get(key);
                writer.writeNext(new String[] {
                    parts[0],
                    parts[1],
                    safe(state.urls.get(key)),
                    safe(state.remoteIds.get(key)),
                    starred == null ? "" : starred.toString(),
                    Boolean.toString(Boolean.TRUE.equals(state.notFound.get(key)))
                });
                rows++;
            }
        }
        logger.info("Wrote {} tracks to CSV file: {}", rows, file);
        return rows;
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
