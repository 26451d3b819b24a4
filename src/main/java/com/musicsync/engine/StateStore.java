package com.musicsync.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * JSON-file implementation of {@link StateStoreInterface} using Jackson.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #load()} reads the file; a missing file gives an empty state, an unparseable one is backed up
 *   as {@code <name>.corrupt-<millis>} and also gives an empty state.</li>
 *   <li>{@link #save(SyncState)} writes {@code <name>.tmp}, forces it to disk, then moves it over the target.</li>
 *   <li>{@link #update(Consumer)} and {@link #merge(Function)} serialize every read-modify-write on this
 *   instance.</li>
 * </ul>
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class StateStore implements StateStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();

    public StateStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path path() {
        return file;
    }

    @Override
    public SyncState load() {
        if (!Files.exists(file)) {
            logger.info("No state file at {}; starting empty.", file);
            return SyncState.empty();
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            if (bytes.length == 0) {
                throw new CorruptStateException("State file is empty: " + file);
            }
            SyncState state = mapper.readValue(bytes, SyncState.class);
            if (state == null) {
                throw new CorruptStateException("State file holds no object: " + file);
            }
            return state.sanitized();
        } catch (CorruptStateException e) {
            recoverFromCorruption(e);
        } catch (IOException e) {
            recoverFromCorruption(new CorruptStateException("Failed to parse state file " + file, e));
        }
        return SyncState.empty();
    }

    private void recoverFromCorruption(CorruptStateException e) {
        logger.warn("{} ({}). Falling back to an empty state.", e.getMessage(),
            e.getCause() == null ? "no detail" : e.getCause().getMessage());
        Path backup = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.copy(file, backup, StandardCopyOption.REPLACE_EXISTING);
            logger.warn("Backed up unreadable state file to {}", backup);
        } catch (IOException mv) {
            logger.warn("Unreadable state file could not be backed up: {}", mv.getMessage());
        }
    }

    @Override
    public void save(SyncState state) throws IOException {
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] payload = mapper.writeValueAsBytes(state);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            writeTemp(tmp, payload);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move unsupported for {}; using plain replace.", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Saved state to {} ({} bytes)", file, payload.length);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Writes and fsyncs the temporary file. Split out so a test can simulate a crash mid-write.
     */
    protected void writeTemp(Path tmp, byte[] payload) throws IOException {
        try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
             OutputStream out = Channels.newOutputStream(channel)) {
            out.write(payload);
            out.flush();
            channel.force(true);
        }
    }

    @Override
    public SyncState update(Consumer<SyncState> mutator) throws IOException {
        synchronized (writeLock) {
            SyncState state = load();
            mutator.accept(state);
            state.updatedAt = Math.max(state.updatedAt, System.currentTimeMillis());
            save(state);
            return state;
        }
    }

    @Override
    public SyncState merge(Function<SyncState, StatePatch> patchOf) throws IOException {
        synchronized (writeLock) {
            SyncState current = load();
            SyncState merged = mergeInto(current, patchOf.apply(current));
            merged.updatedAt = Math.max(merged.updatedAt, System.currentTimeMillis());
            save(merged);
            return merged;
        }
    }

    @Override
    public SyncState read(Path other) throws IOException {
        SyncState state = mapper.readValue(Files.readAllBytes(other), SyncState.class);
        if (state == null) {
            throw new CorruptStateException("State file holds no object: " + other);
        }
        return state.sanitized();
    }

    @Override
    public SyncState mergeInto(SyncState state, StatePatch patch) {
        SyncState out = state == null ? SyncState.empty() : state.copy();
        if (patch == null) {
            return out;
        }
        boolean newer = patch.updatedAt >= out.updatedAt;
        if (newer) {
            if (patch.lastScanAt != null) out.lastScanAt = patch.lastScanAt;
            if (patch.lastCrawlAt != null) out.lastCrawlAt = patch.lastCrawlAt;
            if (patch.lastCrawlWindow != null) out.lastCrawlWindow = patch.lastCrawlWindow;
            if (patch.toDownload != null) out.toDownload = new ArrayList<>(patch.toDownload);
            if (patch.haveLocally != null) out.haveLocally = new ArrayList<>(patch.haveLocally);
            if (patch.skippedTracks != null) out.skippedTracks = new ArrayList<>(patch.skippedTracks);
            out.updatedAt = patch.updatedAt;
        } else {
            logger.debug("Patch from {} is older than state ({}); scalar fields ignored.", patch.updatedAt, out.updatedAt);
        }
        union(out.localPaths, patch.localPaths);
        union(out.urls, patch.urls);
        union(out.remoteIds, patch.remoteIds);
        union(out.remoteTitles, patch.remoteTitles);
        union(out.matchScores, patch.matchScores);
        union(out.starred, patch.starred);
        union(out.dismissed, patch.dismissed);
        if (patch.dismissedManualCheck != null) out.dismissedManualCheck.addAll(patch.dismissedManualCheck);
        if (patch.skipList != null) out.skipList.addAll(patch.skipList);
        if (patch.notFound != null) {
            out.notFound = new LinkedHashMap<>(patch.notFound);
        }
        if (patch.outcomes != null) patch.outcomes.forEach(out::appendOutcome);
        if (patch.mutations != null) patch.mutations.forEach(out::appendMutation);
        return out;
    }

    private static <V> void union(Map<String, V> target, Map<String, V> incoming) {
        if (incoming != null) {
            target.putAll(incoming);
        }
    }
}
