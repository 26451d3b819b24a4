package com.musicsync.remote;

import com.musicsync.engine.CrawledFavorite;

import java.util.List;

/**
 * One page of the remote favorites listing.
 *
 * @param page 1-based page number
 * @param finalUrl URL the navigation ended on, used to detect a login redirect
 * @param favorites entries on the page, in listing order
 * @param hasNext whether the listing links a further page
 */
public record FavoritesPage(int page, String finalUrl, List<CrawledFavorite> favorites, boolean hasNext) {}
