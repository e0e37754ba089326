package com.dev.sacudo.session;

import com.dev.sacudo.config.PlaybackProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically closes sessions that have been inactive for longer than the configured idle timeout.
 */
@Slf4j
@Component
public class IdleSessionReaper {

    private final SessionRegistry registry;
    private final TaskScheduler scheduler;
    private final PlaybackProperties properties;
    private final Clock clock;
    private ScheduledFuture<?> task;

    public IdleSessionReaper(SessionRegistry registry,
                             @Qualifier("sacudoScheduler") TaskScheduler scheduler,
                             PlaybackProperties properties,
                             Clock clock) {
        this.registry = registry;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        task = scheduler.scheduleWithFixedDelay(this::reap, properties.reaperInterval());
        log.info("Idle reaper every {}, idle timeout {}", properties.reaperInterval(), properties.idleTimeout());
    }

    @PreDestroy
    void shutdown() {
        if (task != null) {
            task.cancel(false);
        }
    }

    void reap() {
        for (Session session : registry.sessions()) {
            session.closeIfIdle(clock.instant(), properties.idleTimeout())
                    .whenComplete((closed, error) -> {
                        if (error != null) {
                            log.debug("Idle check for guild {} failed: {}", session.getGuildId(), error.toString());
                        } else if (closed) {
                            log.info("Reaped idle session for guild {}", session.getGuildId());
                        }
                    });
        }
    }
}
