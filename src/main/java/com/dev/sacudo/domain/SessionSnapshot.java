package com.dev.sacudo.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable view of one guild's session, republished after every applied mutation.
 * Reads are served from the latest snapshot, which makes it the authoritative state observers reconcile against.
 */
@Value
@Builder
public class SessionSnapshot {
    String guildId;
    String name;
    PlaybackState state;
    Track currentTrack;
    List<Track> queue;
    int volume;
    int memberCount;
    Instant lastActivity;

    public static SessionSnapshot disconnected(String guildId, int volume) {
        return SessionSnapshot.builder()
                .guildId(guildId)
                .name(guildId)
                .state(PlaybackState.DISCONNECTED)
                .queue(List.of())
                .volume(volume)
                .memberCount(0)
                .build();
    }

    public Optional<Track> getCurrentTrack() {
        return Optional.ofNullable(currentTrack);
    }

    public boolean isPlaying() {
        return state == PlaybackState.PLAYING;
    }

    public boolean isPaused() {
        return state == PlaybackState.PAUSED;
    }

    public boolean isVoiceConnected() {
        return state.isVoiceConnected();
    }

    public int getQueueLength() {
        return queue.size();
    }
}
