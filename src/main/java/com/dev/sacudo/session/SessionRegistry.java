package com.dev.sacudo.session;

import com.dev.sacudo.domain.SessionSnapshot;
import com.dev.sacudo.web.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * The only state shared between guilds: which session serves which guild. At most one live session exists per
 * guild; a closed session removes itself and the next command for that guild gets a fresh one.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final SessionFactory factory;

    public SessionRegistry(SessionFactory factory) {
        this.factory = factory;
    }

    public Session getOrCreate(String guildId) {
        if (guildId == null || guildId.isBlank()) {
            throw new InvalidInputException("Guild id must not be empty");
        }
        return sessions.computeIfAbsent(guildId, id -> {
            log.info("Creating session for guild {}", id);
            return factory.create(id, this::forget);
        });
    }

    public Optional<Session> find(String guildId) {
        return Optional.ofNullable(sessions.get(guildId));
    }

    public Collection<Session> sessions() {
        return List.copyOf(sessions.values());
    }

    public List<SessionSnapshot> snapshots() {
        return sessions.values().stream()
                .map(Session::snapshot)
                .toList();
    }

    /**
     * Runs {@code command} against the guild's session. A command that raced with the session closing is
     * retried once against a fresh session.
     */
    public <T> CompletableFuture<T> execute(String guildId, Function<Session, CompletableFuture<T>> command) {
        return command.apply(getOrCreate(guildId)).exceptionallyCompose(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof SessionClosedException) {
                log.debug("Session for guild {} closed under a command, retrying", guildId);
                return command.apply(getOrCreate(guildId));
            }
            return CompletableFuture.failedFuture(cause);
        });
    }

    /**
     * Leaves voice and drops the guild's session, if there is one.
     */
    public CompletableFuture<Optional<SessionSnapshot>> remove(String guildId) {
        return find(guildId)
                .map(session -> session.leave().thenApply(Optional::of))
                .orElseGet(() -> CompletableFuture.completedFuture(Optional.empty()));
    }

    void forget(Session session) {
        if (sessions.remove(session.getGuildId(), session)) {
            log.info("Removed session for guild {}", session.getGuildId());
        }
    }
}
