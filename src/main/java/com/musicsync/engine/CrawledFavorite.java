package com.musicsync.engine;

/**
 * One entry read from the remote favorites listing.
 *
 * @param key track key built from the listing's artist and title
 * @param url absolute track URL
 * @param remoteTitle display text as shown remotely
 * @param remoteId numeric id when the listing exposes one, otherwise null
 */
public record CrawledFavorite(String key, String url, String remoteTitle, String remoteId) {}
