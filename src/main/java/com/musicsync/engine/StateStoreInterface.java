package com.musicsync.engine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Persistence contract for {@link SyncState}: one authoritative file, atomic replacement on save.
 */
public interface StateStoreInterface {
    /**
     * Loads the state. A missing or unparseable file yields an empty, valid state; this never throws.
     * @return current state
     */
    SyncState load();

    /**
     * Writes the state atomically: readers see either the previous file or the new one.
     * @param state state to persist
     * @throws IOException if the file cannot be written
     */
    void save(SyncState state) throws IOException;

    /**
     * Applies a patch to a state without destroying existing data.
     * Scalars follow last-write-wins by recency, maps are unioned key-wise, logs are appended,
     * and {@code not_found} is replaced wholesale when the patch carries it.
     * @param state base state, left untouched
     * @param patch partial update
     * @return merged copy
     */
    SyncState mergeInto(SyncState state, StatePatch patch);

    /**
     * Serialized load-mutate-save. All writers go through here.
     * @param mutator edits the freshly loaded state in place
     * @return the saved state
     * @throws IOException if saving fails
     */
    SyncState update(Consumer<SyncState> mutator) throws IOException;

    /**
     * Serialized load, {@link #mergeInto} and save.
     * @param patchOf builds the patch from the freshly loaded state
     * @return the saved state
     * @throws IOException if saving fails
     */
    SyncState merge(Function<SyncState, StatePatch> patchOf) throws IOException;

    /**
     * Reads another state file, such as a backup, without any recovery.
     * @throws IOException if the file is missing or unreadable
     */
    SyncState read(Path other) throws IOException;

    Path path();
}
