package com.musicsync.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves {@link SyncSettings} from environment variables, then system properties, then
 * {@code <dataDir>/config.json}, then defaults; and saves the file atomically.
 * <p>
 * Environment keys: {@code MUSICSYNC_DATA_DIR}, {@code MUSICSYNC_DESTINATION_FOLDERS} (path-separator list),
 * {@code MUSICSYNC_SESSION_STATE}, {@code MUSICSYNC_CAPTURE_LIST}, {@code MUSICSYNC_HEADED},
 * {@code MUSICSYNC_SEARCH_USE_REQUEST}, {@code MUSICSYNC_BASE_URL}, {@code MUSICSYNC_RETRY_BACKOFF_MS}.
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class SettingsService {
    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SyncSettings load() {
        String dataDir = Utils.envOrProp("MUSICSYNC_DATA_DIR", SyncSettings.DEFAULT_DATA_DIR);
        return load(dataDir);
    }

    public SyncSettings load(String dataDir) {
        SyncSettings fromFile = readFile(Paths.get(dataDir, "config.json"), dataDir);
        String folders = Utils.envOrProp("MUSICSYNC_DESTINATION_FOLDERS", null);
        List<String> destinations = folders == null || folders.isBlank()
            ? fromFile.destinationFolders()
            : new ArrayList<>(Arrays.asList(folders.split(File.pathSeparator)));
        SyncSettings resolved = new SyncSettings(
            dataDir,
            destinations,
            Utils.envOrProp("MUSICSYNC_SESSION_STATE", fromFile.sessionStatePath()),
            Utils.envOrProp("MUSICSYNC_CAPTURE_LIST", fromFile.captureListPath()),
            Boolean.parseBoolean(Utils.envOrProp("MUSICSYNC_HEADED", String.valueOf(fromFile.headedMode()))),
            Boolean.parseBoolean(Utils.envOrProp("MUSICSYNC_SEARCH_USE_REQUEST", String.valueOf(fromFile.searchUseRequestBackend()))),
            Utils.envOrProp("MUSICSYNC_BASE_URL", fromFile.remoteBaseUrl()),
            parseLong(Utils.envOrProp("MUSICSYNC_RETRY_BACKOFF_MS", String.valueOf(fromFile.retryBackoffMs())), 1000));
        logger.debug("Resolved settings: {}", resolved);
        return resolved;
    }

    private SyncSettings readFile(Path file, String dataDir) {
        if (!Files.exists(file)) {
            return SyncSettings.defaults(dataDir);
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                logger.warn("Settings file {} is not a JSON object; using defaults.", file);
                return SyncSettings.defaults(dataDir);
            }
            SyncSettings parsed = mapper.treeToValue(root, SyncSettings.class);
            // the file never relocates the data directory it lives in
            return new SyncSettings(dataDir, parsed.destinationFolders(), parsed.sessionStatePath(),
                parsed.captureListPath(), parsed.headedMode(), parsed.searchUseRequestBackend(),
                parsed.remoteBaseUrl(), root.has("retry_backoff_ms") ? parsed.retryBackoffMs() : 1000);
        } catch (IOException e) {
            logger.warn("Failed to read settings file {}: {}. Using defaults.", file, e.getMessage());
            return SyncSettings.defaults(dataDir);
        }
    }

    public void save(SyncSettings settings) throws IOException {
        Path file = settings.settingsPath();
        Files.createDirectories(file.toAbsolutePath().getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), settings);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Saved settings to {}", file);
    }

    private static long parseLong(String value, long fallback) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            return fallback;
        }
    }
}
