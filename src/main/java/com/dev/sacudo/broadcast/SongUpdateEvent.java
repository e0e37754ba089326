package com.dev.sacudo.broadcast;

import com.dev.sacudo.domain.SessionSnapshot;
import com.dev.sacudo.domain.Track;

public record SongUpdateEvent(
        String guildId,
        Track currentTrack,
        boolean playing,
        boolean paused,
        int volume
) implements SessionEvent {

    public static SongUpdateEvent of(SessionSnapshot snapshot) {
        return new SongUpdateEvent(
                snapshot.getGuildId(),
                snapshot.getCurrentTrack().orElse(null),
                snapshot.isPlaying(),
                snapshot.isPaused(),
                snapshot.getVolume());
    }

    @Override
    public Kind kind() {
        return Kind.SONG_UPDATE;
    }
}
