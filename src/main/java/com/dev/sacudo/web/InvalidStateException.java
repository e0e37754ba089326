package com.dev.sacudo.web;

import com.dev.sacudo.domain.PlaybackState;

/**
 * A command that is not valid for the session's current playback state, e.g. resume while not paused.
 */
public class InvalidStateException extends SacudoException {

    private final PlaybackState state;

    public InvalidStateException(String message, PlaybackState state) {
        super(message);
        this.state = state;
    }

    public PlaybackState getState() {
        return state;
    }

    @Override
    public String getKind() {
        return "STATE_ERROR";
    }
}
