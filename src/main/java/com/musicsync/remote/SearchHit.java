package com.musicsync.remote;

/**
 * Accepted search result.
 *
 * @param url absolute track URL
 * @param remoteTitle result text as shown remotely
 * @param score match score in [0, 1]
 * @param query query variant that produced it
 */
public record SearchHit(String url, String remoteTitle, double score, String query) {}
