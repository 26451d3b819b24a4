package com.musicsync.engine;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the capture list from a CSV file using OpenCSV.
 * <p>
 * Columns: {@code artist,title,captured_at}. The header row is optional and detected by its first cell.
 * {@code captured_at} may be ISO-8601 (with or without offset, UTC assumed) or epoch millis; anything
 * else reads as 0. Duplicate keys keep the newest capture.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class CsvCaptureListReader implements CaptureListReaderInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvCaptureListReader.class);

    private final Path file;

    public CsvCaptureListReader(Path file) {
        this.file = file;
    }

    @Override
    public List<CaptureEntry> read() throws IOException {
        if (file == null || !Files.exists(file)) {
            logger.info("No capture list at {}; treating it as empty", file);
            return List.of();
        }
        Map<String, CaptureEntry> byKey = new LinkedHashMap<>();
        int rows = 0;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            String[] row;
            boolean first = true;
            while ((row = reader.readNext()) != null) {
                if (first && isHeader(row)) {
                    first = false;
                    continue;
                }
                first = false;
                rows++;
                CaptureEntry entry = toEntry(row);
                if (entry == null) {
                    continue;
                }
                String lower = TrackKey.lower(entry.key());
                CaptureEntry existing = byKey.get(lower);
                if (existing == null || entry.capturedAt() > existing.capturedAt()) {
                    byKey.put(lower, entry);
                }
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed capture list " + file + ": " + e.getMessage(), e);
        }
        logger.info("Read {} captures ({} rows) from {}", byKey.size(), rows, file);
        return new ArrayList<>(byKey.values());
    }

    private static boolean isHeader(String[] row) {
        return row.length > 0 && row[0] != null && row[0].trim().toLowerCase(Locale.ROOT).equals("artist");
    }

    private static CaptureEntry toEntry(String[] row) {
        if (row.length < 2) {
            return null;
        }
        String artist = row[0] == null ? "" : row[0].trim();
        String title = row[1] == null ? "" : row[1].trim();
        if (title.isEmpty()) {
            return null;
        }
        long capturedAt = row.length > 2 ? parseTimestamp(row[2]) : 0L;
        return new CaptureEntry(artist, title, capturedAt);
    }

    /**
     * @return epoch millis, 0 when the value is blank or unparseable
     */
    static long parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        String v = value.trim();
        if (v.chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(v);
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        try {
            return OffsetDateTime.parse(v).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            logger.trace("Not an offset timestamp: {}", v);
        }
        try {
            return Instant.parse(v).toEpochMilli();
        } catch (DateTimeParseException e) {
            logger.trace("Not an instant: {}", v);
        }
        try {
            return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable capture timestamp '{}'", v);
            return 0L;
        }
    }
}
