package com.dev.sacudo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Thread pool sizing. Session contexts share {@code session} threads. Resolution jobs run on {@code io} and
 * voice joins on {@code join}. Individual extraction attempts run on {@code extractor} so they can be abandoned
 * on timeout.
 *
 * <p>The {@code io}, {@code join} and {@code extractor} pools grow to {@code maxPoolSize} threads before they
 * queue anything, and shrink back when idle.
 */
@ConfigurationProperties(prefix = "sacudo.executor")
public record ExecutorProperties(
        @DefaultValue Pool session,
        @DefaultValue Pool io,
        @DefaultValue Pool join,
        @DefaultValue Pool extractor,
        @DefaultValue("4") int schedulerPoolSize
) {

    public record Pool(
            @DefaultValue("4") int corePoolSize,
            @DefaultValue("16") int maxPoolSize,
            @DefaultValue("1000") int queueCapacity,
            @DefaultValue("60") int keepAliveSeconds
    ) {
    }
}
