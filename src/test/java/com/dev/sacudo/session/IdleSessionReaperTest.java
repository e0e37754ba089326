package com.dev.sacudo.session;

import com.dev.sacudo.config.PlaybackProperties;
import com.dev.sacudo.domain.DedupPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdleSessionReaperTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private SessionRegistry registry;
    @Mock
    private TaskScheduler scheduler;
    @Mock
    private Session idle;
    @Mock
    private Session busy;
    @Mock
    private ScheduledFuture<?> scheduled;

    private final PlaybackProperties properties = new PlaybackProperties(50, Duration.ofMinutes(5),
            Duration.ofSeconds(10), Duration.ofSeconds(30), DedupPolicy.NONE);

    @Test
    void checksEverySessionAgainstIdleTimeout() {
        when(registry.sessions()).thenReturn(List.of(idle, busy));
        when(idle.closeIfIdle(NOW, Duration.ofMinutes(5))).thenReturn(CompletableFuture.completedFuture(true));
        when(idle.getGuildId()).thenReturn("1");
        when(busy.closeIfIdle(NOW, Duration.ofMinutes(5))).thenReturn(CompletableFuture.completedFuture(false));

        reaper().reap();

        verify(idle).closeIfIdle(NOW, Duration.ofMinutes(5));
        verify(busy).closeIfIdle(NOW, Duration.ofMinutes(5));
    }

    @Test
    void runsOnTheConfiguredIntervalUntilShutdown() {
        doReturn(scheduled).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(30)));
        IdleSessionReaper reaper = reaper();

        reaper.start();
        reaper.shutdown();

        verify(scheduled).cancel(false);
    }

    private IdleSessionReaper reaper() {
        return new IdleSessionReaper(registry, scheduler, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
