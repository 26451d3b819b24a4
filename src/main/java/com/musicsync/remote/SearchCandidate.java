package com.musicsync.remote;

/**
 * One result link from a remote search page.
 *
 * @param url absolute track URL
 * @param text link text, usually "Artist - Title (Mix)"
 */
public record SearchCandidate(String url, String text) {}
