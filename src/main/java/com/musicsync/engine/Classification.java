package com.musicsync.engine;

import java.util.List;
import java.util.Map;

/**
 * Result of classifying the capture list against the local scan.
 *
 * @param toDownload capture keys without a matching local file
 * @param haveLocally capture keys with a matching local file
 * @param skipped capture keys excluded through the skip list
 * @param localPaths matched file per key in {@code haveLocally}
 */
public record Classification(List<String> toDownload, List<String> haveLocally, List<String> skipped,
                             Map<String, String> localPaths) {}
