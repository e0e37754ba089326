package com.dev.sacudo.session;

import com.dev.sacudo.domain.PlaybackState;
import com.dev.sacudo.web.InvalidStateException;

import java.util.EnumSet;
import java.util.Set;

import static com.dev.sacudo.domain.PlaybackState.CONNECTING;
import static com.dev.sacudo.domain.PlaybackState.DISCONNECTED;
import static com.dev.sacudo.domain.PlaybackState.IDLE;
import static com.dev.sacudo.domain.PlaybackState.PAUSED;
import static com.dev.sacudo.domain.PlaybackState.PLAYING;

/**
 * Transition table for a guild's playback. Volume changes never change state and are not modelled here.
 */
public class PlaybackStateMachine {

    public enum Trigger {
        JOIN(EnumSet.of(DISCONNECTED), EnumSet.of(CONNECTING)),
        JOIN_SUCCEEDED(EnumSet.of(CONNECTING), EnumSet.of(IDLE)),
        JOIN_FAILED(EnumSet.of(CONNECTING), EnumSet.of(DISCONNECTED)),
        PLAY(EnumSet.of(IDLE), EnumSet.of(PLAYING)),
        PAUSE(EnumSet.of(PLAYING), EnumSet.of(PAUSED)),
        RESUME(EnumSet.of(PAUSED), EnumSet.of(PLAYING)),
        SKIP(EnumSet.of(PLAYING, PAUSED), EnumSet.of(PLAYING, IDLE)),
        TRACK_FINISHED(EnumSet.of(PLAYING), EnumSet.of(PLAYING, IDLE)),
        PLAY_NOW(EnumSet.of(IDLE, PLAYING, PAUSED), EnumSet.of(PLAYING)),
        STOP(EnumSet.of(IDLE, PLAYING, PAUSED), EnumSet.of(IDLE)),
        IDLE_TIMEOUT(EnumSet.of(IDLE, PLAYING, PAUSED), EnumSet.of(DISCONNECTED)),
        TRANSPORT_LOST(EnumSet.of(CONNECTING, IDLE, PLAYING, PAUSED), EnumSet.of(DISCONNECTED)),
        LEAVE(EnumSet.allOf(PlaybackState.class), EnumSet.of(DISCONNECTED));

        private final Set<PlaybackState> from;
        private final Set<PlaybackState> to;

        Trigger(Set<PlaybackState> from, Set<PlaybackState> to) {
            this.from = from;
            this.to = to;
        }

        public boolean isAllowedFrom(PlaybackState state) {
            return from.contains(state);
        }
    }

    private PlaybackState state = DISCONNECTED;

    public PlaybackState getState() {
        return state;
    }

    public boolean canFire(Trigger trigger) {
        return trigger.isAllowedFrom(state);
    }

    /**
     * @throws InvalidStateException if {@code trigger} is not valid in the current state
     */
    public void check(Trigger trigger) {
        if (!canFire(trigger)) {
            throw new InvalidStateException(describe(trigger), state);
        }
    }

    public PlaybackState fire(Trigger trigger, PlaybackState target) {
        check(trigger);
        if (!trigger.to.contains(target)) {
            throw new IllegalArgumentException(trigger + " cannot lead to " + target);
        }
        state = target;
        return state;
    }

    private String describe(Trigger trigger) {
        return switch (trigger) {
            case PAUSE -> "Nothing is playing";
            case RESUME -> "Playback is not paused";
            case SKIP, TRACK_FINISHED -> "Nothing to skip";
            case PLAY, PLAY_NOW, STOP, IDLE_TIMEOUT -> "Not connected to a voice channel";
            case JOIN -> "Already " + (state == CONNECTING ? "connecting to" : "connected to") + " a voice channel";
            default -> "Cannot " + trigger.name().toLowerCase().replace('_', ' ') + " while " + state;
        };
    }
}
