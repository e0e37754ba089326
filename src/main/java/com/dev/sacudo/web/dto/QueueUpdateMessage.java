package com.dev.sacudo.web.dto;

import com.dev.sacudo.broadcast.QueueUpdateEvent;

import java.util.List;

public record QueueUpdateMessage(
        String type,
        String guildId,
        List<TrackView> queue,
        int queueLength
) {

    public static QueueUpdateMessage of(QueueUpdateEvent event) {
        return new QueueUpdateMessage(
                event.kind().wireName(),
                event.guildId(),
                event.queue().stream().map(TrackView::of).toList(),
                event.queueLength()
        );
    }
}
