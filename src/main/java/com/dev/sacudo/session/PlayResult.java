package com.dev.sacudo.session;

import com.dev.sacudo.domain.Track;

/**
 * Outcome of a play request once its resolution has been applied.
 *
 * @param position 0-based queue position for {@link Outcome#QUEUED}, otherwise -1
 */
public record PlayResult(Outcome outcome, Track track, int position) {

    public enum Outcome {
        STARTED,
        QUEUED,
        /** Superseded by stop, skip or leave before the track could be placed. */
        CANCELLED
    }

    static PlayResult started(Track track) {
        return new PlayResult(Outcome.STARTED, track, -1);
    }

    static PlayResult queued(Track track, int position) {
        return new PlayResult(Outcome.QUEUED, track, position);
    }

    static PlayResult cancelled() {
        return new PlayResult(Outcome.CANCELLED, null, -1);
    }
}
