package com.dev.sacudo.broadcast;

import com.dev.sacudo.web.dto.QueueUpdateMessage;
import com.dev.sacudo.web.dto.SongUpdateMessage;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Observer that forwards session events to the guild's STOMP topics.
 */
@Component
public class StompEventRelay implements SessionObserver {

    static final String TOPIC_PREFIX = "/topic/guilds/";

    private final SimpMessagingTemplate messagingTemplate;

    public StompEventRelay(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void onEvent(SessionEvent event) {
        if (event instanceof SongUpdateEvent song) {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + song.guildId() + "/song", SongUpdateMessage.of(song));
        } else if (event instanceof QueueUpdateEvent queue) {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + queue.guildId() + "/queue",
                    QueueUpdateMessage.of(queue));
        }
    }
}
