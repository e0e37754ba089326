package com.dev.sacudo.web.rest;

import com.dev.sacudo.service.GuildService;
import com.dev.sacudo.web.dto.GuildStateResponse;
import com.dev.sacudo.web.dto.JoinRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
public class GuildController {

    private final GuildService guildService;

    public GuildController(GuildService guildService) {
        this.guildService = guildService;
    }

    @GetMapping("/guilds")
    public List<GuildStateResponse> listGuilds() {
        return guildService.listGuilds();
    }

    @GetMapping("/guild/{guildId}")
    public GuildStateResponse getState(@PathVariable String guildId) {
        return guildService.getState(guildId);
    }

    @PostMapping("/guild/{guildId}/join")
    public CompletableFuture<GuildStateResponse> join(@PathVariable String guildId,
                                                      @Valid @RequestBody JoinRequest request) {
        return guildService.join(guildId, request.channelId());
    }

    @PostMapping("/guild/{guildId}/leave")
    public CompletableFuture<GuildStateResponse> leave(@PathVariable String guildId) {
        return guildService.leave(guildId);
    }
}
