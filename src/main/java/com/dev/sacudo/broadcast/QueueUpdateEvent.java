package com.dev.sacudo.broadcast;

import com.dev.sacudo.domain.SessionSnapshot;
import com.dev.sacudo.domain.Track;

import java.util.List;

public record QueueUpdateEvent(
        String guildId,
        List<Track> queue,
        int queueLength
) implements SessionEvent {

    public static QueueUpdateEvent of(SessionSnapshot snapshot) {
        return new QueueUpdateEvent(snapshot.getGuildId(), snapshot.getQueue(), snapshot.getQueueLength());
    }

    @Override
    public Kind kind() {
        return Kind.QUEUE_UPDATE;
    }
}
