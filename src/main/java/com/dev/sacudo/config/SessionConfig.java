package com.dev.sacudo.config;

import com.dev.sacudo.media.ExtractionBackend;
import com.dev.sacudo.media.MediaResolver;
import com.dev.sacudo.media.YtDlpExtractionBackend;
import com.dev.sacudo.voice.SimulatedVoiceTransport;
import com.dev.sacudo.voice.VoiceTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Collaborators of the guild sessions. The extraction backend and the voice transport back off when another
 * bean of the same type is registered, e.g. a gateway-backed transport.
 */
@Configuration
public class SessionConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExtractionBackend extractionBackend(ExtractorProperties properties, ObjectMapper objectMapper) {
        return new YtDlpExtractionBackend(properties, objectMapper);
    }

    @Bean
    public MediaResolver mediaResolver(ExtractionBackend backend,
                                       ResolverProperties properties,
                                       @Qualifier("extractorExecutor") ThreadPoolTaskExecutor extractorExecutor) {
        return new MediaResolver(backend, properties, extractorExecutor.getThreadPoolExecutor());
    }

    @Bean
    @ConditionalOnMissingBean
    public VoiceTransport voiceTransport(@Qualifier("sacudoScheduler") ThreadPoolTaskScheduler scheduler,
                                         ExtractorProperties properties) {
        return new SimulatedVoiceTransport(scheduler.getScheduledExecutor(), properties.simulatedTrackLength());
    }
}
