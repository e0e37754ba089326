package com.dev.sacudo.broadcast;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;
import org.springframework.web.socket.messaging.SessionUnsubscribeEvent;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns STOMP subscriptions to guild topics into {@link Broadcaster} subscriptions. The relay stays subscribed
 * to a guild while at least one dashboard subscription for it is open. The relay is attached and detached
 * inside the atomic update of the guild's count, so concurrent frames cannot leave the two out of step.
 */
@Slf4j
@Component
public class DashboardSubscriptionTracker {

    private static final Pattern GUILD_TOPIC = Pattern.compile("^/topic/guilds/([^/]+)/(?:song|queue)$");

    private final Broadcaster broadcaster;
    private final StompEventRelay relay;
    private final ConcurrentMap<String, String> guildBySubscription = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Integer> subscriptionsByGuild = new ConcurrentHashMap<>();

    public DashboardSubscriptionTracker(Broadcaster broadcaster, StompEventRelay relay) {
        this.broadcaster = broadcaster;
        this.relay = relay;
    }

    @EventListener
    public void onSubscribe(SessionSubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String destination = accessor.getDestination();
        if (destination == null) {
            return;
        }
        Matcher matcher = GUILD_TOPIC.matcher(destination);
        if (!matcher.matches()) {
            return;
        }
        String guildId = matcher.group(1);
        if (guildBySubscription.putIfAbsent(key(accessor.getSessionId(), accessor.getSubscriptionId()), guildId)
                != null) {
            return;
        }
        int count = subscriptionsByGuild.compute(guildId, (id, open) -> {
            if (open == null) {
                broadcaster.subscribe(id, relay);
                return 1;
            }
            return open + 1;
        });
        log.debug("Dashboard subscribed to {} ({} open for guild {})", destination, count, guildId);
    }

    @EventListener
    public void onUnsubscribe(SessionUnsubscribeEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        release(key(accessor.getSessionId(), accessor.getSubscriptionId()));
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        String prefix = key(event.getSessionId(), "");
        for (Map.Entry<String, String> entry : guildBySubscription.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                release(entry.getKey());
            }
        }
    }

    public int openSubscriptions(String guildId) {
        return subscriptionsByGuild.getOrDefault(guildId, 0);
    }

    private void release(String subscriptionKey) {
        String guildId = guildBySubscription.remove(subscriptionKey);
        if (guildId == null) {
            return;
        }
        Integer remaining = subscriptionsByGuild.computeIfPresent(guildId, (id, open) -> {
            if (open > 1) {
                return open - 1;
            }
            broadcaster.unsubscribe(id, relay);
            return null;
        });
        if (remaining == null) {
            log.debug("Last dashboard left guild {}", guildId);
        }
    }

    private static String key(String sessionId, String subscriptionId) {
        return sessionId + ":" + subscriptionId;
    }
}
