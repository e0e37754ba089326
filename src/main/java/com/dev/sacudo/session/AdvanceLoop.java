package com.dev.sacudo.session;

import com.dev.sacudo.voice.TrackEnd;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Waits for the voice transport to report the end of each started track and hands the signal back to the
 * session's serialized context, tagged with the play ticket it belongs to.
 */
@Slf4j
class AdvanceLoop {

    interface Handler {
        void onTrackEnd(long ticket, TrackEnd reason);
    }

    private final Executor context;
    private final Handler handler;

    AdvanceLoop(Executor context, Handler handler) {
        this.context = context;
        this.handler = handler;
    }

    void watch(long ticket, CompletableFuture<TrackEnd> end) {
        end.whenComplete((reason, error) -> {
            TrackEnd signal = reason;
            if (error != null) {
                log.warn("Track {} ended with transport failure: {}", ticket, error.toString());
                signal = TrackEnd.TRANSPORT_ERROR;
            }
            TrackEnd delivered = signal;
            context.execute(() -> handler.onTrackEnd(ticket, delivered));
        });
    }
}
