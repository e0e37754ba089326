package com.dev.sacudo.session;

import com.dev.sacudo.broadcast.Broadcaster;
import com.dev.sacudo.config.PlaybackProperties;
import com.dev.sacudo.media.MediaResolver;
import com.dev.sacudo.voice.VoiceTransport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

@Component
public class SessionFactory {

    private final Executor sessionExecutor;
    private final ExecutorService ioExecutor;
    private final Executor joinExecutor;
    private final MediaResolver resolver;
    private final VoiceTransport transport;
    private final Broadcaster broadcaster;
    private final PlaybackProperties properties;
    private final Clock clock;

    @Autowired
    public SessionFactory(@Qualifier("sessionExecutor") ThreadPoolTaskExecutor sessionExecutor,
                          @Qualifier("ioExecutor") ThreadPoolTaskExecutor ioExecutor,
                          @Qualifier("joinExecutor") ThreadPoolTaskExecutor joinExecutor,
                          MediaResolver resolver,
                          VoiceTransport transport,
                          Broadcaster broadcaster,
                          PlaybackProperties properties,
                          Clock clock) {
        this(sessionExecutor, ioExecutor.getThreadPoolExecutor(), joinExecutor, resolver, transport, broadcaster,
                properties, clock);
    }

    public SessionFactory(Executor sessionExecutor,
                          ExecutorService ioExecutor,
                          Executor joinExecutor,
                          MediaResolver resolver,
                          VoiceTransport transport,
                          Broadcaster broadcaster,
                          PlaybackProperties properties,
                          Clock clock) {
        this.sessionExecutor = sessionExecutor;
        this.ioExecutor = ioExecutor;
        this.joinExecutor = joinExecutor;
        this.resolver = resolver;
        this.transport = transport;
        this.broadcaster = broadcaster;
        this.properties = properties;
        this.clock = clock;
    }

    Session create(String guildId, Consumer<Session> onClosed) {
        return new Session(guildId, sessionExecutor, ioExecutor, joinExecutor, resolver, transport, broadcaster,
                properties, clock, onClosed);
    }
}
