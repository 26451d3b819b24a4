package com.musicsync.remote;

/**
 * Something that can fetch a page of the account's favorites listing.
 */
public interface FavoritesPageSource {
    /**
     * @param page 1-based page number
     * @return the page; a login redirect is reported through {@link FavoritesPage#finalUrl()}
     */
    FavoritesPage fetchFavoritesPage(int page);

    /**
     * @return true when the last fetch hit the login page or was refused for lack of a session
     */
    default boolean detectSessionExpiry() {
        return false;
    }
}
