package com.dev.sacudo.config;

import com.dev.sacudo.domain.DedupPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "sacudo.playback")
public record PlaybackProperties(
        @DefaultValue("50") int defaultVolume,
        @DefaultValue("5m") Duration idleTimeout,
        @DefaultValue("10s") Duration joinTimeout,
        @DefaultValue("30s") Duration reaperInterval,
        @DefaultValue("NONE") DedupPolicy dedupPolicy
) {
}
