package com.musicsync.remote;

/**
 * Result of {@link RemoteMutationOrchestrator#ensureFavorited} or {@link RemoteMutationOrchestrator#ensureUnfavorited}.
 *
 * @param key track key
 * @param starred favorite flag after the operation
 * @param togglesIssued mutating calls sent, 0 when the track was already in the wanted state
 * @param backend name of the backend that did the work
 * @param url track URL, possibly discovered on the way
 * @param remoteId resolved id, possibly discovered on the way
 */
public record StarResult(String key, boolean starred, int togglesIssued, String backend, String url, String remoteId) {

    public boolean changed() {
        return togglesIssued > 0;
    }
}
