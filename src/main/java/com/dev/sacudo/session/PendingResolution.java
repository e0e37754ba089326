package com.dev.sacudo.session;

import com.dev.sacudo.domain.Track;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * A play request whose tracks are still being resolved off the session context. Resolved tracks wait in
 * {@link #ready} so they are placed in the order the play requests arrived, not the order resolutions finish.
 * Only the session context reads or writes these fields.
 */
class PendingResolution {

    final String input;
    final CompletableFuture<PlayResult> outcome = new CompletableFuture<>();
    final Deque<Track> ready = new ArrayDeque<>();
    final Integer volumeOverride;
    boolean awaitsJoin;
    boolean finished;
    boolean cancelled;
    RuntimeException failure;
    Future<?> job;

    PendingResolution(String input, Integer volumeOverride) {
        this.input = input;
        this.volumeOverride = volumeOverride;
    }

    /**
     * Stops further tracks from arriving. The caller completes {@link #outcome} once the session has published
     * the change.
     */
    void cancel() {
        cancelled = true;
        finished = true;
        ready.clear();
        if (job != null) {
            job.cancel(true);
        }
    }

    /**
     * Completes the outcome once no further tracks will arrive. Does nothing if a placed track already did.
     */
    void settle() {
        if (failure != null) {
            outcome.completeExceptionally(failure);
        } else {
            outcome.complete(PlayResult.cancelled());
        }
    }
}
