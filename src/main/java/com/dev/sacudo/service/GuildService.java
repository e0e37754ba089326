package com.dev.sacudo.service;

import com.dev.sacudo.config.PlaybackProperties;
import com.dev.sacudo.domain.SessionSnapshot;
import com.dev.sacudo.session.Session;
import com.dev.sacudo.session.SessionRegistry;
import com.dev.sacudo.web.dto.GuildStateResponse;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Service
public class GuildService {

    private final SessionRegistry registry;
    private final PlaybackProperties properties;

    public GuildService(SessionRegistry registry, PlaybackProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    public List<GuildStateResponse> listGuilds() {
        return registry.snapshots().stream()
                .sorted(Comparator.comparing(SessionSnapshot::getGuildId))
                .map(GuildStateResponse::of)
                .toList();
    }

    /**
     * Pulled state of a guild. Guilds without a live session read as disconnected and empty.
     */
    public GuildStateResponse getState(String guildId) {
        return GuildStateResponse.of(registry.find(guildId)
                .map(Session::snapshot)
                .orElseGet(() -> disconnected(guildId)));
    }

    public CompletableFuture<GuildStateResponse> join(String guildId, String channelId) {
        return registry.execute(guildId, session -> session.join(channelId))
                .thenApply(GuildStateResponse::of);
    }

    public CompletableFuture<GuildStateResponse> leave(String guildId) {
        return registry.remove(guildId)
                .thenApply(left -> GuildStateResponse.of(left.orElseGet(() -> disconnected(guildId))));
    }

    private SessionSnapshot disconnected(String guildId) {
        return SessionSnapshot.disconnected(guildId, properties.defaultVolume());
    }
}
