package com.dev.sacudo.service;

import com.dev.sacudo.session.Session;
import com.dev.sacudo.session.SessionRegistry;
import com.dev.sacudo.web.dto.GuildStateResponse;
import com.dev.sacudo.web.dto.TrackView;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Service
public class QueueService {

    private final SessionRegistry registry;

    public QueueService(SessionRegistry registry) {
        this.registry = registry;
    }

    public CompletableFuture<TrackView> remove(String guildId, int index) {
        return registry.execute(guildId, session -> session.removeFromQueue(index)).thenApply(TrackView::of);
    }

    public CompletableFuture<GuildStateResponse> playNow(String guildId, int index) {
        return registry.execute(guildId, session -> session.playNow(index)).thenApply(GuildStateResponse::of);
    }

    public CompletableFuture<GuildStateResponse> clear(String guildId) {
        return registry.execute(guildId, Session::clearQueue).thenApply(GuildStateResponse::of);
    }
}
