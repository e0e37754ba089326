package com.dev.sacudo.service;

import com.dev.sacudo.session.Session;
import com.dev.sacudo.session.SessionRegistry;
import com.dev.sacudo.web.dto.GuildStateResponse;
import com.dev.sacudo.web.dto.PlayRequest;
import com.dev.sacudo.web.dto.PlayResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
public class PlaybackService {

    private final SessionRegistry registry;

    public PlaybackService(SessionRegistry registry) {
        this.registry = registry;
    }

    public CompletableFuture<PlayResponse> play(String guildId, PlayRequest request) {
        log.debug("Play request for guild {} from {}", guildId, request.requestedBy());
        return registry.execute(guildId,
                        session -> session.play(request.url(), request.requestedBy(), request.channelId(),
                                request.volume()))
                .thenApply(PlayResponse::of);
    }

    public CompletableFuture<GuildStateResponse> skip(String guildId) {
        return registry.execute(guildId, Session::skip).thenApply(GuildStateResponse::of);
    }

    public CompletableFuture<GuildStateResponse> pause(String guildId) {
        return registry.execute(guildId, Session::pause).thenApply(GuildStateResponse::of);
    }

    public CompletableFuture<GuildStateResponse> resume(String guildId) {
        return registry.execute(guildId, Session::resume).thenApply(GuildStateResponse::of);
    }

    public CompletableFuture<GuildStateResponse> stop(String guildId) {
        return registry.execute(guildId, Session::stop).thenApply(GuildStateResponse::of);
    }

    public CompletableFuture<GuildStateResponse> setVolume(String guildId, int volume) {
        return registry.execute(guildId, session -> session.setVolume(volume)).thenApply(GuildStateResponse::of);
    }
}
