package com.dev.sacudo.web.dto;

import com.dev.sacudo.broadcast.SongUpdateEvent;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SongUpdateMessage(
        String type,
        String guildId,
        TrackView currentTrack,
        @JsonProperty("is_playing") boolean playing,
        @JsonProperty("is_paused") boolean paused,
        int volume
) {

    public static SongUpdateMessage of(SongUpdateEvent event) {
        return new SongUpdateMessage(
                event.kind().wireName(),
                event.guildId(),
                TrackView.of(event.currentTrack()),
                event.playing(),
                event.paused(),
                event.volume()
        );
    }
}
