package com.dev.sacudo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Retry, timeout and metadata fallbacks applied around the extraction backend.
 */
@ConfigurationProperties(prefix = "sacudo.resolver")
public record ResolverProperties(
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("500ms") Duration initialBackoff,
        @DefaultValue("4s") Duration maxBackoff,
        @DefaultValue("20s") Duration attemptTimeout,
        @DefaultValue("100") int playlistLimit,
        @DefaultValue("https://i.imgur.com/ufxvZ0j.png") String fallbackThumbnailUrl,
        @DefaultValue("Unknown title") String fallbackTitle
) {
}
