package com.musicsync.remote;

import com.musicsync.engine.SessionExpiredException;
import com.musicsync.engine.TrackNotFoundException;
import com.musicsync.engine.TransientBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Star, unstar and search against one track, choosing between the two backends.
 * <p>
 * Rules:
 * <ul>
 *   <li>The favorite state is always read before a toggle is sent. A track already in the wanted state costs
 *   no mutating call, which also means a favorited track is never unstarred by {@link #ensureFavorited}.</li>
 *   <li>The request backend is used whenever the track has a resolved id; otherwise the browser backend opens
 *   the track and the id it resolves is returned so the caller can persist it.</li>
 *   <li>If the request backend cannot read the state, the browser backend is asked. If nobody can read it,
 *   nothing is toggled and a {@link TransientBackendException} is raised.</li>
 *   <li>A login redirect is reported as {@link SessionExpiredException}, never as "not found".</li>
 * </ul>
 *
 * @author Music Sync Team
 * @since 1.0
 */
public class RemoteMutationOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(RemoteMutationOrchestrator.class);

    private final RemoteBackend requestBackend;
    private final RemoteBackend browserBackend;
    private final boolean searchViaRequest;

    /**
     * @param requestBackend id-keyed backend, may be null when no session cookies exist
     * @param browserBackend automation backend, may be null in headless deployments
     * @param searchViaRequest run searches through the request backend when it is available
     */
    public RemoteMutationOrchestrator(RemoteBackend requestBackend, RemoteBackend browserBackend, boolean searchViaRequest) {
        if (requestBackend == null && browserBackend == null) {
            throw new IllegalArgumentException("At least one backend is required");
        }
        this.requestBackend = requestBackend;
        this.browserBackend = browserBackend;
        this.searchViaRequest = searchViaRequest;
    }

    /**
     * Searches for a track without touching its favorite state.
     * @return best accepted result, or empty when no variant produced an acceptable candidate
     */
    public Optional<SearchHit> search(String artist, String title) {
        RemoteBackend backend = searchBackend();
        for (String query : SearchMatcher.queries(artist, title)) {
            List<SearchCandidate> candidates = backend.search(query);
            checkSession(backend, "search '" + query + "'");
            Optional<SearchHit> hit = SearchMatcher.best(candidates, artist, title, query);
            if (hit.isPresent()) {
                logger.info("Search '{} - {}' matched '{}' ({}) via {}", artist, title, hit.get().remoteTitle(),
                    String.format("%.2f", hit.get().score()), backend.name());
                return hit;
            }
        }
        logger.info("Search '{} - {}' found nothing via {}", artist, title, backend.name());
        return Optional.empty();
    }

    /**
     * Makes sure the track is favorited. Already-favorited tracks are left untouched.
     */
    public StarResult ensureFavorited(TrackRef track) {
        return ensureState(track, true);
    }

    /**
     * Makes sure the track is not favorited. Tracks that are not favorited are left untouched.
     */
    public StarResult ensureUnfavorited(TrackRef track) {
        return ensureState(track, false);
    }

    /**
     * Searches first when no URL or id is known, then favorites the best match.
     * @throws TrackNotFoundException when the search finds nothing
     */
    public StarResult findAndFavorite(TrackRef track) {
        TrackRef ref = track;
        if (!ref.hasUrl() && !ref.hasRemoteId()) {
            SearchHit hit = search(track.artist(), track.title())
                .orElseThrow(() -> new TrackNotFoundException("No match for " + track.key()));
            ref = ref.withUrl(hit.url());
        }
        return ensureFavorited(ref);
    }

    /**
     * Reads the favorite state without changing it.
     */
    public FavoriteState readState(TrackRef track) {
        RemoteBackend backend = select(track);
        TrackHandle handle = open(backend, track);
        FavoriteState state = backend.readFavoriteState(handle);
        checkSession(backend, "read state of " + track.key());
        if (state == FavoriteState.UNKNOWN && backend == requestBackend && browserBackend != null) {
            RemoteBackend fallback = browserBackend;
            TrackHandle fbHandle = open(fallback, track);
            state = fallback.readFavoriteState(fbHandle);
            checkSession(fallback, "read state of " + track.key());
        }
        return state;
    }

    /**
     * Downloads a track through the request backend, resolving its id first when needed.
     */
    public Path download(TrackRef track, String format, Path targetDir, String baseName) {
        if (requestBackend == null) {
            throw new TransientBackendException("Downloads need saved session cookies");
        }
        TrackRef ref = track;
        if (!ref.hasRemoteId()) {
            RemoteBackend resolver = browserBackend != null ? browserBackend : requestBackend;
            TrackHandle handle = open(resolver, ref);
            if (!handle.hasRemoteId()) {
                throw new TransientBackendException("Could not resolve remote id for " + track.key());
            }
            ref = new TrackRef(ref.key(), ref.artist(), ref.title(), handle.url(), handle.remoteId());
        }
        TrackHandle handle = requestBackend.openTrack(ref);
        checkSession(requestBackend, "open " + track.key());
        return requestBackend.download(handle, format, targetDir, baseName);
    }

    private StarResult ensureState(TrackRef track, boolean wantFavorited) {
        if (!track.hasUrl() && !track.hasRemoteId()) {
            throw new TrackNotFoundException("No remote URL or id known for " + track.key());
        }
        RemoteBackend backend = select(track);
        TrackHandle handle = open(backend, track);
        FavoriteState current = backend.readFavoriteState(handle);
        checkSession(backend, "read state of " + track.key());

        if (current == FavoriteState.UNKNOWN && backend == requestBackend && browserBackend != null) {
            logger.info("{} could not read favorite state of '{}'; asking {}", backend.name(), track.key(), browserBackend.name());
            backend = browserBackend;
            handle = mergeIds(open(backend, track), handle);
            current = backend.readFavoriteState(handle);
            checkSession(backend, "read state of " + track.key());
        }
        if (current == FavoriteState.UNKNOWN) {
            throw new TransientBackendException("Favorite state of '" + track.key() + "' is unreadable; not toggling");
        }

        FavoriteState wanted = wantFavorited ? FavoriteState.FAVORITED : FavoriteState.NOT_FAVORITED;
        if (current == wanted) {
            logger.info("'{}' already {} on {}; no toggle sent", track.key(), describe(wanted), backend.name());
            return result(track, wantFavorited, 0, backend, handle);
        }

        int toggles = 0;
        FavoriteState after = backend.toggleFavorite(handle);
        toggles++;
        checkSession(backend, "toggle " + track.key());
        if (after != wanted && after != FavoriteState.UNKNOWN) {
            // The read was stale and the toggle flipped it the wrong way; flip back once
            logger.warn("Toggle on '{}' produced {}; toggling again", track.key(), describe(after));
            after = backend.toggleFavorite(handle);
            toggles++;
            checkSession(backend, "toggle " + track.key());
        }
        if (after == FavoriteState.UNKNOWN) {
            after = backend.readFavoriteState(handle);
            checkSession(backend, "verify " + track.key());
        }
        if (after != wanted) {
            throw new TransientBackendException("'" + track.key() + "' is still " + describe(after) + " after toggling");
        }
        logger.info("'{}' is now {} via {} ({} toggle(s))", track.key(), describe(wanted), backend.name(), toggles);
        return result(track, wantFavorited, toggles, backend, handle);
    }

    private RemoteBackend select(TrackRef track) {
        if (track.hasRemoteId() && requestBackend != null) {
            return requestBackend;
        }
        if (browserBackend != null) {
            return browserBackend;
        }
        if (requestBackend != null && requestBackend.supportsUnresolvedTracks() && track.hasUrl()) {
            return requestBackend;
        }
        throw new TransientBackendException("No backend can open '" + track.key() + "' without a resolved id");
    }

    private RemoteBackend searchBackend() {
        if (searchViaRequest && requestBackend != null) {
            return requestBackend;
        }
        return browserBackend != null ? browserBackend : requestBackend;
    }

    private TrackHandle open(RemoteBackend backend, TrackRef track) {
        TrackHandle handle = backend.openTrack(track);
        checkSession(backend, "open " + track.key());
        return handle;
    }

    private static TrackHandle mergeIds(TrackHandle primary, TrackHandle known) {
        String url = primary.url() != null ? primary.url() : known.url();
        String id = primary.hasRemoteId() ? primary.remoteId() : known.remoteId();
        return new TrackHandle(url, id);
    }

    private static void checkSession(RemoteBackend backend, String step) {
        if (backend.detectSessionExpiry()) {
            throw new SessionExpiredException(backend.name() + " was redirected to login during " + step);
        }
    }

    private static StarResult result(TrackRef track, boolean starred, int toggles, RemoteBackend backend, TrackHandle handle) {
        String url = handle.url() != null ? handle.url() : track.url();
        String id = handle.hasRemoteId() ? handle.remoteId() : track.remoteId();
        return new StarResult(track.key(), starred, toggles, backend.name(), url, id);
    }

    private static String describe(FavoriteState s) {
        return s == FavoriteState.FAVORITED ? "favorited" : s == FavoriteState.NOT_FAVORITED ? "not favorited" : "unknown";
    }
}
