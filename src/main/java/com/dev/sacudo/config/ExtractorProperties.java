package com.dev.sacudo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * @param maxStderrChars diagnostics beyond this are dropped
 * @param maxOutputBytes a run whose JSON output exceeds this fails instead of being parsed
 */
@ConfigurationProperties(prefix = "sacudo.extractor")
public record ExtractorProperties(
        @DefaultValue("yt-dlp") String binary,
        @DefaultValue List<String> extraArgs,
        @DefaultValue("65536") int maxStderrChars,
        @DefaultValue("16777216") int maxOutputBytes,
        @DefaultValue("3m") Duration simulatedTrackLength
) {
}
