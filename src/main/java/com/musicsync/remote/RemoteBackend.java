package com.musicsync.remote;

import com.musicsync.engine.PremiumRequiredException;
import com.musicsync.engine.SessionExpiredException;
import com.musicsync.engine.TransientBackendException;

import java.nio.file.Path;
import java.util.List;

/**
 * Contract shared by the request-based and the browser-based backends.
 * <p>
 * The remote service only offers a favorite <em>toggle</em>; callers must read the state first.
 * Every method may throw {@link SessionExpiredException} when the service redirects to its login page and
 * {@link TransientBackendException} for network or automation failures.
 */
public interface RemoteBackend {

    /**
     * Short name used in logs and results.
     */
    String name();

    /**
     * Whether the backend can open a track that has no resolved id.
     */
    boolean supportsUnresolvedTracks();

    /**
     * Runs one search query and returns the first result links, best effort.
     * @param query free-text query
     * @return candidates in page order, empty when none
     */
    List<SearchCandidate> search(String query);

    /**
     * Opens a track by id or URL and resolves whichever of the two is missing when possible.
     * @param track track to open
     * @return handle for the other calls
     */
    TrackHandle openTrack(TrackRef track);

    FavoriteState readFavoriteState(TrackHandle handle);

    /**
     * Flips the favorite flag once.
     * @return state reported after the flip, UNKNOWN when the backend cannot tell
     */
    FavoriteState toggleFavorite(TrackHandle handle);

    /**
     * True when the last navigation or request of this backend ended on the login page.
     */
    boolean detectSessionExpiry();

    /**
     * Downloads a track file into {@code targetDir}.
     * @throws PremiumRequiredException when the account tier does not allow downloads
     * @throws UnsupportedOperationException when this backend has no download path
     */
    default Path download(TrackHandle handle, String format, Path targetDir, String baseName) {
        throw new UnsupportedOperationException(name() + " backend does not download");
    }
}
