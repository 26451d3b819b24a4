package com.musicsync.engine;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Finds the audio files already in the local library.
 */
public interface LocalScannerInterface {
    /**
     * @param folders library roots; missing folders are skipped
     * @param token checked between files
     * @param onProgress receives (filesDone, filesTotal), may be null
     * @return one entry per audio file
     */
    List<LocalTrack> scan(List<String> folders, CancellationToken token, BiConsumer<Integer, Integer> onProgress);
}
