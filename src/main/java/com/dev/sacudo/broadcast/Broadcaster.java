package com.dev.sacudo.broadcast;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Guild-scoped fan-out of session events.
 *
 * <p>Events are handed to observers on the publishing session's context, at most once and without
 * acknowledgement. A failing observer is logged and skipped; it never affects the session or other observers.
 */
@Slf4j
@Component
public class Broadcaster {

    private final ConcurrentMap<String, Set<SessionObserver>> observers = new ConcurrentHashMap<>();

    public void subscribe(String guildId, SessionObserver observer) {
        observers.computeIfAbsent(guildId, id -> new CopyOnWriteArraySet<>()).add(observer);
        log.debug("Observer subscribed to guild {}", guildId);
    }

    public void unsubscribe(String guildId, SessionObserver observer) {
        observers.computeIfPresent(guildId, (id, set) -> {
            set.remove(observer);
            return set.isEmpty() ? null : set;
        });
        log.debug("Observer unsubscribed from guild {}", guildId);
    }

    public int subscriberCount(String guildId) {
        Set<SessionObserver> set = observers.get(guildId);
        return set == null ? 0 : set.size();
    }

    public void publish(SessionEvent event) {
        Set<SessionObserver> set = observers.get(event.guildId());
        if (set == null) {
            return;
        }
        for (SessionObserver observer : set) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Dropping {} for guild {}: observer failed: {}", event.kind().wireName(),
                        event.guildId(), e.toString());
            }
        }
    }
}
