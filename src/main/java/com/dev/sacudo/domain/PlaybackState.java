package com.dev.sacudo.domain;

public enum PlaybackState {
    DISCONNECTED,
    CONNECTING,
    IDLE,
    PLAYING,
    PAUSED;

    public boolean isVoiceConnected() {
        return this == IDLE || this == PLAYING || this == PAUSED;
    }

    public boolean hasCurrentTrack() {
        return this == PLAYING || this == PAUSED;
    }
}
