package com.dev.sacudo.media;

import com.dev.sacudo.domain.Track;

/**
 * One element of a lazily resolved playlist: either a track or the reason this entry could not be resolved.
 */
public record PlaylistEntry(
        String sourceUrl,
        Track track,
        RuntimeException failure
) {

    static PlaylistEntry resolved(String sourceUrl, Track track) {
        return new PlaylistEntry(sourceUrl, track, null);
    }

    static PlaylistEntry failed(String sourceUrl, RuntimeException failure) {
        return new PlaylistEntry(sourceUrl, null, failure);
    }

    public boolean isResolved() {
        return track != null;
    }
}
