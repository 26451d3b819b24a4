package com.musicsync.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * User settings persisted next to the state file.
 *
 * @param dataDir directory holding state, settings and session files
 * @param destinationFolders local library roots
 * @param sessionStatePath Playwright storage-state file shared by both backends
 * @param captureListPath CSV capture list
 * @param headedMode show the automation browser
 * @param searchUseRequestBackend run searches through the request backend
 * @param remoteBaseUrl base URL of the catalogue service
 * @param retryBackoffMs base delay of the transient-failure backoff
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncSettings(
    @JsonProperty("data_dir") String dataDir,
    @JsonProperty("destination_folders") List<String> destinationFolders,
    @JsonProperty("session_state_path") String sessionStatePath,
    @JsonProperty("capture_list_path") String captureListPath,
    @JsonProperty("headed_mode") boolean headedMode,
    @JsonProperty("search_use_request_backend") boolean searchUseRequestBackend,
    @JsonProperty("remote_base_url") String remoteBaseUrl,
    @JsonProperty("retry_backoff_ms") long retryBackoffMs
) {
    public static final String DEFAULT_DATA_DIR = "sync-data";
    public static final String DEFAULT_BASE_URL = "https://soundeo.com";

    public SyncSettings {
        dataDir = dataDir == null || dataDir.isBlank() ? DEFAULT_DATA_DIR : dataDir;
        destinationFolders = destinationFolders == null ? List.of() : List.copyOf(destinationFolders);
        sessionStatePath = sessionStatePath == null || sessionStatePath.isBlank()
            ? Paths.get(dataDir, "storage-state.json").toString() : sessionStatePath;
        captureListPath = captureListPath == null || captureListPath.isBlank()
            ? Paths.get(dataDir, "captures.csv").toString() : captureListPath;
        remoteBaseUrl = remoteBaseUrl == null || remoteBaseUrl.isBlank() ? DEFAULT_BASE_URL : remoteBaseUrl;
        retryBackoffMs = retryBackoffMs < 0 ? 1000 : retryBackoffMs;
    }

    public static SyncSettings defaults(String dataDir) {
        return new SyncSettings(dataDir, List.of(), null, null, false, false, null, 1000);
    }

    public Path statePath() {
        return Paths.get(dataDir, "status.json");
    }

    public Path settingsPath() {
        return Paths.get(dataDir, "config.json");
    }

    public Path sessionState() {
        return Paths.get(sessionStatePath);
    }

    public Path captureList() {
        return Paths.get(captureListPath);
    }

    public SyncSettings withDestinationFolders(List<String> folders) {
        return new SyncSettings(dataDir, folders, sessionStatePath, captureListPath, headedMode, searchUseRequestBackend,
            remoteBaseUrl, retryBackoffMs);
    }
}
