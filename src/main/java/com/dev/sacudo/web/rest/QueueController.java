package com.dev.sacudo.web.rest;

import com.dev.sacudo.service.QueueService;
import com.dev.sacudo.web.dto.GuildStateResponse;
import com.dev.sacudo.web.dto.TrackView;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/guild/{guildId}/queue")
public class QueueController {

    private final QueueService queueService;

    public QueueController(QueueService queueService) {
        this.queueService = queueService;
    }

    @DeleteMapping("/{index}")
    public CompletableFuture<TrackView> remove(@PathVariable String guildId,
                                               @PathVariable int index) {
        return queueService.remove(guildId, index);
    }

    @PostMapping("/{index}/play")
    public CompletableFuture<GuildStateResponse> playNow(@PathVariable String guildId,
                                                         @PathVariable int index) {
        return queueService.playNow(guildId, index);
    }

    @PostMapping("/clear")
    public CompletableFuture<GuildStateResponse> clear(@PathVariable String guildId) {
        return queueService.clear(guildId);
    }
}
