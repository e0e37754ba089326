package com.dev.sacudo.web.dto;

import com.dev.sacudo.domain.PlaybackState;
import com.dev.sacudo.domain.SessionSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GuildStateResponse(
        String id,
        String name,
        @JsonProperty("is_playing") boolean playing,
        @JsonProperty("is_paused") boolean paused,
        boolean voiceConnected,
        PlaybackState state,
        TrackView currentSong,
        List<TrackView> queue,
        int queueLength,
        int memberCount,
        int volume
) {

    public static GuildStateResponse of(SessionSnapshot snapshot) {
        return new GuildStateResponse(
                snapshot.getGuildId(),
                snapshot.getName(),
                snapshot.isPlaying(),
                snapshot.isPaused(),
                snapshot.isVoiceConnected(),
                snapshot.getState(),
                snapshot.getCurrentTrack().map(TrackView::of).orElse(null),
                snapshot.getQueue().stream().map(TrackView::of).toList(),
                snapshot.getQueueLength(),
                snapshot.getMemberCount(),
                snapshot.getVolume()
        );
    }
}
