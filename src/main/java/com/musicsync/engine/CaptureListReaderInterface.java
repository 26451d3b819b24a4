package com.musicsync.engine;

import java.io.IOException;
import java.util.List;

/**
 * Source of the capture list: tracks the user identified and wants locally.
 */
public interface CaptureListReaderInterface {
    /**
     * Reads every capture. A missing list reads as empty.
     * @return captures in file order; rows without a title are dropped
     * @throws IOException if the list exists but cannot be read
     */
    List<CaptureEntry> read() throws IOException;
}
