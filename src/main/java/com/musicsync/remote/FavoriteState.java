package com.musicsync.remote;

/**
 * Favorite flag as read from the remote side. UNKNOWN means the backend could not tell.
 */
public enum FavoriteState {
    FAVORITED,
    NOT_FAVORITED,
    UNKNOWN
}
