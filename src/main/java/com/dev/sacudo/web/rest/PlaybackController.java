package com.dev.sacudo.web.rest;

import com.dev.sacudo.service.PlaybackService;
import com.dev.sacudo.web.dto.GuildStateResponse;
import com.dev.sacudo.web.dto.PlayRequest;
import com.dev.sacudo.web.dto.PlayResponse;
import com.dev.sacudo.web.dto.VolumeRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/guild/{guildId}")
public class PlaybackController {

    private final PlaybackService playbackService;

    public PlaybackController(PlaybackService playbackService) {
        this.playbackService = playbackService;
    }

    @PostMapping("/play")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CompletableFuture<PlayResponse> play(@PathVariable String guildId,
                                                @Valid @RequestBody PlayRequest request) {
        return playbackService.play(guildId, request);
    }

    @PostMapping("/skip")
    public CompletableFuture<GuildStateResponse> skip(@PathVariable String guildId) {
        return playbackService.skip(guildId);
    }

    @PostMapping("/pause")
    public CompletableFuture<GuildStateResponse> pause(@PathVariable String guildId) {
        return playbackService.pause(guildId);
    }

    @PostMapping("/resume")
    public CompletableFuture<GuildStateResponse> resume(@PathVariable String guildId) {
        return playbackService.resume(guildId);
    }

    @PostMapping("/stop")
    public CompletableFuture<GuildStateResponse> stop(@PathVariable String guildId) {
        return playbackService.stop(guildId);
    }

    @PostMapping("/volume")
    public CompletableFuture<GuildStateResponse> setVolume(@PathVariable String guildId,
                                                           @Valid @RequestBody VolumeRequest request) {
        return playbackService.setVolume(guildId, request.volume());
    }
}
