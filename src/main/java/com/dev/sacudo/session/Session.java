package com.dev.sacudo.session;

import com.dev.sacudo.broadcast.Broadcaster;
import com.dev.sacudo.broadcast.QueueUpdateEvent;
import com.dev.sacudo.broadcast.SongUpdateEvent;
import com.dev.sacudo.config.PlaybackProperties;
import com.dev.sacudo.domain.PlaybackState;
import com.dev.sacudo.domain.SessionSnapshot;
import com.dev.sacudo.domain.Track;
import com.dev.sacudo.media.MediaRequest;
import com.dev.sacudo.media.MediaResolver;
import com.dev.sacudo.media.PlaylistEntry;
import com.dev.sacudo.session.PlaybackStateMachine.Trigger;
import com.dev.sacudo.voice.TrackEnd;
import com.dev.sacudo.voice.VoiceConnection;
import com.dev.sacudo.voice.VoiceTransport;
import com.dev.sacudo.web.InvalidInputException;
import com.dev.sacudo.web.InvalidStateException;
import com.dev.sacudo.web.SacudoException;
import com.dev.sacudo.web.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static com.dev.sacudo.domain.PlaybackState.CONNECTING;
import static com.dev.sacudo.domain.PlaybackState.DISCONNECTED;
import static com.dev.sacudo.domain.PlaybackState.IDLE;
import static com.dev.sacudo.domain.PlaybackState.PAUSED;
import static com.dev.sacudo.domain.PlaybackState.PLAYING;

/**
 * Queue, playback state and voice connection of one guild.
 *
 * <p>Every command and every internal signal (resolution results, join results, track ends) runs on the
 * session's own serialized context, so the fields below have a single writer and are never guarded by locks.
 * After each task the immutable {@link SessionSnapshot} is republished and the song and queue updates it
 * caused are broadcast. Commands rejected with {@link InvalidInputException} or {@link InvalidStateException}
 * change nothing and broadcast nothing.
 *
 * <p>Resolutions run on the I/O executor, one task per track, and voice joins on a separate join executor.
 * Tracks are placed in the order the play requests arrived. Every pending request is cancelled by
 * {@link #stop()} and {@link #leave()}.
 *
 * <p>Futures handed out by this class are completed only after the snapshot reflecting their outcome has been
 * published.
 */
@Slf4j
public class Session {

    public static final int MIN_VOLUME = 0;
    public static final int MAX_VOLUME = 150;

    private final String guildId;
    private final SerialExecutor context;
    private final ExecutorService ioExecutor;
    private final Executor joinExecutor;
    private final MediaResolver resolver;
    private final VoiceTransport transport;
    private final Broadcaster broadcaster;
    private final PlaybackProperties properties;
    private final Clock clock;
    private final Consumer<Session> onClosed;
    private final AdvanceLoop advanceLoop;

    private final TrackQueue queue;
    private final PlaybackStateMachine machine = new PlaybackStateMachine();
    private final Deque<PendingResolution> pending = new ArrayDeque<>();
    private final List<Runnable> completions = new ArrayList<>();
    private Track currentTrack;
    private int volume;
    private VoiceConnection connection;
    private String name;
    private Instant lastActivity;
    private long playTicket;
    private long joinTicket;
    private CompletableFuture<SessionSnapshot> joining;
    private boolean closed;
    private boolean songChanged;
    private boolean queueChanged;

    private volatile SessionSnapshot snapshot;

    public Session(String guildId,
                   Executor sessionExecutor,
                   ExecutorService ioExecutor,
                   Executor joinExecutor,
                   MediaResolver resolver,
                   VoiceTransport transport,
                   Broadcaster broadcaster,
                   PlaybackProperties properties,
                   Clock clock,
                   Consumer<Session> onClosed) {
        this.guildId = guildId;
        this.context = new SerialExecutor(sessionExecutor, guildId);
        this.ioExecutor = ioExecutor;
        this.joinExecutor = joinExecutor;
        this.resolver = resolver;
        this.transport = transport;
        this.broadcaster = broadcaster;
        this.properties = properties;
        this.clock = clock;
        this.onClosed = onClosed;
        this.advanceLoop = new AdvanceLoop(this::inContext, this::onTrackEnd);
        this.queue = new TrackQueue(properties.dedupPolicy());
        this.volume = properties.defaultVolume();
        this.name = guildId;
        this.lastActivity = clock.instant();
        this.snapshot = buildSnapshot();
    }

    public String getGuildId() {
        return guildId;
    }

    /**
     * Latest published state. Never blocks and always reflects every command that has completed.
     */
    public SessionSnapshot snapshot() {
        return snapshot;
    }

    public CompletableFuture<SessionSnapshot> join(String channelId) {
        if (isBlank(channelId)) {
            throw new InvalidInputException("Voice channel id must not be empty");
        }
        return submit(() -> beginJoin(channelId)).thenCompose(Function.identity());
    }

    public CompletableFuture<PlayResult> play(String input, String requestedBy, String channelId) {
        return play(input, requestedBy, channelId, null);
    }

    /**
     * Resolves {@code input} and starts it if nothing is playing, otherwise queues it. Input is validated before
     * anything is submitted. While disconnected a {@code channelId} is required and the session joins it first.
     *
     * @param volumeOverride volume for this track only, or {@code null} to follow the session volume
     */
    public CompletableFuture<PlayResult> play(String input, String requestedBy, String channelId,
                                              Integer volumeOverride) {
        MediaRequest request = resolver.classify(input);
        if (volumeOverride != null) {
            checkVolume(volumeOverride);
        }
        return submit(() -> startResolution(request, requestedBy, channelId, volumeOverride))
                .thenCompose(Function.identity());
    }

    public CompletableFuture<SessionSnapshot> skip() {
        return mutate(() -> {
            machine.check(Trigger.SKIP);
            advance(Trigger.SKIP);
            touch();
        });
    }

    public CompletableFuture<SessionSnapshot> pause() {
        return mutate(() -> {
            machine.check(Trigger.PAUSE);
            voice(VoiceConnection::pause);
            machine.fire(Trigger.PAUSE, PAUSED);
            touch();
            songChanged = true;
        });
    }

    public CompletableFuture<SessionSnapshot> resume() {
        return mutate(() -> {
            machine.check(Trigger.RESUME);
            voice(VoiceConnection::resume);
            machine.fire(Trigger.RESUME, PLAYING);
            touch();
            songChanged = true;
        });
    }

    /**
     * Clears the queue and the current track from any state. Connected sessions become idle; disconnected or
     * connecting sessions keep their state.
     */
    public CompletableFuture<SessionSnapshot> stop() {
        return mutate(() -> {
            cancelPending(resolution -> true);
            queue.clear();
            queueChanged = true;
            if (currentTrack != null) {
                playTicket++;
                currentTrack = null;
                voice(VoiceConnection::stopTrack);
            }
            if (machine.canFire(Trigger.STOP)) {
                machine.fire(Trigger.STOP, IDLE);
            }
            songChanged = true;
            touch();
        });
    }

    public CompletableFuture<SessionSnapshot> setVolume(int requested) {
        checkVolume(requested);
        return mutate(() -> {
            volume = requested;
            if (currentTrack != null && currentTrack.getVolumeOverride().isEmpty()) {
                voice(connection -> connection.setVolume(requested));
            }
            songChanged = true;
            touch();
        });
    }

    public CompletableFuture<Track> removeFromQueue(int index) {
        return submit(() -> {
            Track removed = queue.remove(index);
            queueChanged = true;
            touch();
            log.info("Removed '{}' from queue position {}", removed.getTitle(), index);
            return removed;
        });
    }

    /**
     * Takes the track at {@code index} out of the queue and plays it immediately, discarding the current track.
     */
    public CompletableFuture<SessionSnapshot> playNow(int index) {
        return mutate(() -> {
            machine.check(Trigger.PLAY_NOW);
            Track track = queue.remove(index);
            queueChanged = true;
            playTicket++;
            currentTrack = null;
            startTrack(track, Trigger.PLAY_NOW);
        });
    }

    public CompletableFuture<SessionSnapshot> clearQueue() {
        return mutate(() -> {
            queue.clear();
            queueChanged = true;
            touch();
        });
    }

    /**
     * Leaves voice, cancels pending work and closes the session. Commands that reach it afterwards fail with
     * {@link SessionClosedException}.
     */
    public CompletableFuture<SessionSnapshot> leave() {
        return mutate(() -> close(Trigger.LEAVE, "leave requested"));
    }

    /**
     * Closes the session if it has been inactive for {@code timeout}: connected and idle or alone in its
     * channel, or disconnected with nothing pending. Connecting sessions are never reaped.
     *
     * @return whether the session was closed
     */
    public CompletableFuture<Boolean> closeIfIdle(Instant now, Duration timeout) {
        return submit(() -> {
            if (Duration.between(lastActivity, now).compareTo(timeout) < 0) {
                return false;
            }
            PlaybackState state = machine.getState();
            if (state.isVoiceConnected() && (state == IDLE || connection.getListenerCount() == 0)) {
                close(Trigger.IDLE_TIMEOUT, "idle for " + timeout);
                return true;
            }
            if (state == DISCONNECTED && pending.isEmpty()) {
                close(Trigger.LEAVE, "inactive for " + timeout);
                return true;
            }
            return false;
        });
    }

    private CompletableFuture<SessionSnapshot> beginJoin(String channelId) {
        PlaybackState state = machine.getState();
        if (state == CONNECTING) {
            return joining;
        }
        if (state.isVoiceConnected()) {
            if (channelId.equals(connection.getChannelId())) {
                return CompletableFuture.completedFuture(snapshot);
            }
            throw new InvalidStateException("Already connected to channel " + connection.getChannelId(), state);
        }
        long ticket = ++joinTicket;
        CompletableFuture<VoiceConnection> attempt = new CompletableFuture<>();
        joinExecutor.execute(() -> connect(attempt, channelId));
        machine.fire(Trigger.JOIN, CONNECTING);
        joining = new CompletableFuture<>();
        touch();
        log.info("Joining voice channel {}", channelId);
        attempt.orTimeout(properties.joinTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((joined, error) -> inContext(() -> onJoinCompleted(ticket, joined, error)));
        return joining;
    }

    private void connect(CompletableFuture<VoiceConnection> attempt, String channelId) {
        VoiceConnection joined;
        try {
            joined = transport.join(guildId, channelId);
        } catch (RuntimeException e) {
            attempt.completeExceptionally(e);
            return;
        }
        if (!attempt.complete(joined)) {
            log.info("Voice join to {} completed after it was abandoned, leaving", channelId);
            leaveQuietly(joined);
        }
    }

    private void onJoinCompleted(long ticket, VoiceConnection joined, Throwable error) {
        if (ticket != joinTicket || closed || machine.getState() != CONNECTING) {
            if (joined != null) {
                leaveQuietly(joined);
            }
            return;
        }
        CompletableFuture<SessionSnapshot> waiting = joining;
        joining = null;
        if (error != null) {
            Throwable cause = unwrap(error);
            TransportException failure = cause instanceof TimeoutException
                    ? new TransportException("Voice join timed out after " + properties.joinTimeout())
                    : cause instanceof TransportException transportException
                    ? transportException
                    : new TransportException("Voice join failed: " + cause.getMessage(), cause);
            machine.fire(Trigger.JOIN_FAILED, DISCONNECTED);
            log.warn("Could not join voice: {}", failure.getMessage());
            failJoinRequests(failure);
            drain();
            afterFlush(() -> waiting.completeExceptionally(failure));
            return;
        }
        connection = joined;
        if (!isBlank(joined.getGuildName())) {
            name = joined.getGuildName();
        }
        machine.fire(Trigger.JOIN_SUCCEEDED, IDLE);
        pending.forEach(resolution -> resolution.awaitsJoin = false);
        touch();
        log.info("Joined voice channel {}", joined.getChannelId());
        try {
            Optional<Track> head = queue.poll();
            if (head.isPresent()) {
                queueChanged = true;
                startTrack(head.get(), Trigger.PLAY);
            }
            drain();
            songChanged = true;
            afterFlush(() -> waiting.complete(snapshot));
        } catch (RuntimeException e) {
            afterFlush(() -> waiting.completeExceptionally(e));
        }
    }

    private CompletableFuture<PlayResult> startResolution(MediaRequest request, String requestedBy,
                                                          String channelId, Integer volumeOverride) {
        PlaybackState state = machine.getState();
        if (state == DISCONNECTED && isBlank(channelId)) {
            throw new InvalidStateException("Not connected to a voice channel", state);
        }
        PendingResolution resolution = new PendingResolution(request.input(), volumeOverride);
        resolution.job = ioExecutor.submit(() -> resolve(resolution, request, requestedBy));
        if (state == DISCONNECTED) {
            beginJoin(channelId);
            resolution.awaitsJoin = true;
        }
        pending.addLast(resolution);
        touch();
        log.info("Resolving '{}' for {}", request.input(), requestedBy);
        return resolution.outcome;
    }

    private void resolve(PendingResolution resolution, MediaRequest request, String requestedBy) {
        try {
            if (request.playlist()) {
                Iterator<PlaylistEntry> entries = resolver.resolvePlaylist(request, requestedBy);
                inContext(() -> continuePlaylist(resolution, entries, null));
            } else {
                Track track = resolver.resolve(request, requestedBy);
                inContext(() -> onResolved(resolution, track, true));
            }
        } catch (CancellationException e) {
            log.debug("Resolution of '{}' cancelled", request.input());
        } catch (RuntimeException e) {
            inContext(() -> onResolutionFinished(resolution, e));
        }
    }

    /**
     * Schedules resolution of the next playlist entry. Each entry is its own I/O task, so a long playlist holds
     * an I/O thread only while one entry resolves.
     */
    private void continuePlaylist(PendingResolution resolution, Iterator<PlaylistEntry> entries,
                                  RuntimeException lastFailure) {
        if (resolution.cancelled || closed) {
            return;
        }
        if (!entries.hasNext()) {
            onResolutionFinished(resolution, lastFailure);
            return;
        }
        try {
            resolution.job = ioExecutor.submit(() -> resolveEntry(resolution, entries, lastFailure));
        } catch (RejectedExecutionException e) {
            log.warn("No I/O thread for the rest of playlist '{}'", resolution.input);
            onResolutionFinished(resolution, e);
        }
    }

    private void resolveEntry(PendingResolution resolution, Iterator<PlaylistEntry> entries,
                              RuntimeException lastFailure) {
        PlaylistEntry entry;
        try {
            entry = entries.next();
        } catch (CancellationException e) {
            log.debug("Playlist '{}' cancelled", resolution.input);
            return;
        }
        inContext(() -> {
            if (entry.isResolved()) {
                onResolved(resolution, entry.track(), false);
                continuePlaylist(resolution, entries, lastFailure);
            } else {
                continuePlaylist(resolution, entries, entry.failure());
            }
        });
    }

    private void onResolved(PendingResolution resolution, Track track, boolean last) {
        if (resolution.cancelled || closed) {
            log.debug("Discarding '{}' resolved for a superseded request", track.getTitle());
            return;
        }
        resolution.ready.addLast(resolution.volumeOverride == null
                ? track
                : track.withVolumeOverride(resolution.volumeOverride));
        if (last) {
            resolution.finished = true;
        }
        drain();
    }

    private void onResolutionFinished(PendingResolution resolution, RuntimeException failure) {
        if (resolution.cancelled || closed) {
            return;
        }
        if (failure != null) {
            resolution.failure = failure;
        }
        resolution.finished = true;
        drain();
    }

    private void failJoinRequests(TransportException failure) {
        Iterator<PendingResolution> iterator = pending.iterator();
        while (iterator.hasNext()) {
            PendingResolution resolution = iterator.next();
            if (resolution.awaitsJoin) {
                resolution.cancel();
                afterFlush(() -> resolution.outcome.completeExceptionally(failure));
                iterator.remove();
            }
        }
    }

    /**
     * Places resolved tracks in arrival order. A request whose resolution is still running holds back every
     * request behind it. Nothing is placed while a join is in progress.
     */
    private void drain() {
        if (machine.getState() == CONNECTING) {
            return;
        }
        while (!pending.isEmpty()) {
            PendingResolution head = pending.peekFirst();
            while (!head.ready.isEmpty()) {
                place(head, head.ready.pollFirst());
            }
            if (!head.finished) {
                break;
            }
            pending.pollFirst();
            afterFlush(head::settle);
        }
    }

    private void place(PendingResolution resolution, Track track) {
        try {
            PlayResult result;
            if (machine.getState() == IDLE && currentTrack == null) {
                startTrack(track, Trigger.PLAY);
                result = PlayResult.started(track);
            } else {
                int position = queue.enqueue(track, currentTrack);
                queueChanged = true;
                log.info("Queued '{}' at position {}", track.getTitle(), position);
                result = PlayResult.queued(track, position);
            }
            afterFlush(() -> resolution.outcome.complete(result));
        } catch (SacudoException e) {
            resolution.failure = e;
        }
    }

    private void advance(Trigger trigger) {
        playTicket++;
        currentTrack = null;
        songChanged = true;
        Optional<Track> next = queue.poll();
        if (next.isPresent()) {
            queueChanged = true;
            startTrack(next.get(), trigger);
            return;
        }
        if (trigger == Trigger.SKIP) {
            voice(VoiceConnection::stopTrack);
        }
        machine.fire(trigger, IDLE);
        touch();
        log.info("Queue finished");
    }

    private void startTrack(Track track, Trigger trigger) {
        machine.check(trigger);
        long ticket = ++playTicket;
        CompletableFuture<TrackEnd> end;
        try {
            end = connection.play(track, track.effectiveVolume(volume));
        } catch (RuntimeException e) {
            transportLost("could not start '" + track.getTitle() + "'", e);
            throw e instanceof TransportException transportException
                    ? transportException
                    : new TransportException("Could not start playback: " + e.getMessage(), e);
        }
        machine.fire(trigger, PLAYING);
        currentTrack = track;
        songChanged = true;
        touch();
        advanceLoop.watch(ticket, end);
        log.info("Now playing '{}' requested by {}", track.getTitle(), track.getRequestedBy());
    }

    private void onTrackEnd(long ticket, TrackEnd reason) {
        if (closed || ticket != playTicket || currentTrack == null) {
            log.debug("Ignoring {} for superseded play {}", reason, ticket);
            return;
        }
        if (reason == TrackEnd.TRANSPORT_ERROR) {
            transportLost("stream of '" + currentTrack.getTitle() + "' broke", null);
            return;
        }
        log.debug("'{}' ended: {}", currentTrack.getTitle(), reason);
        advance(machine.getState() == PAUSED ? Trigger.SKIP : Trigger.TRACK_FINISHED);
    }

    /**
     * Drops the connection and the current track without retrying it. The queue is kept so playback can
     * continue after the next join.
     */
    private void transportLost(String reason, Throwable cause) {
        log.warn("Voice transport lost: {}{}", reason, cause == null ? "" : " (" + cause + ")");
        playTicket++;
        currentTrack = null;
        VoiceConnection lost = connection;
        connection = null;
        if (lost != null) {
            leaveQuietly(lost);
        }
        machine.fire(Trigger.TRANSPORT_LOST, DISCONNECTED);
        touch();
        songChanged = true;
    }

    private void voice(Consumer<VoiceConnection> action) {
        try {
            action.accept(connection);
        } catch (RuntimeException e) {
            transportLost("voice command failed", e);
            throw e instanceof TransportException transportException
                    ? transportException
                    : new TransportException("Voice command failed: " + e.getMessage(), e);
        }
    }

    private void close(Trigger trigger, String reason) {
        cancelPending(resolution -> true);
        queue.clear();
        currentTrack = null;
        playTicket++;
        joinTicket++;
        if (joining != null) {
            CompletableFuture<SessionSnapshot> abandoned = joining;
            afterFlush(() -> abandoned.completeExceptionally(
                    new TransportException("Voice join abandoned: " + reason)));
            joining = null;
        }
        VoiceConnection active = connection;
        connection = null;
        machine.fire(trigger, DISCONNECTED);
        closed = true;
        songChanged = true;
        queueChanged = true;
        onClosed.accept(this);
        log.info("Session closed: {}", reason);
        if (active != null) {
            try {
                active.leave();
            } catch (RuntimeException e) {
                throw new TransportException("Voice leave failed: " + e.getMessage(), e);
            }
        }
    }

    private void cancelPending(Predicate<PendingResolution> filter) {
        Iterator<PendingResolution> iterator = pending.iterator();
        while (iterator.hasNext()) {
            PendingResolution resolution = iterator.next();
            if (filter.test(resolution)) {
                resolution.cancel();
                afterFlush(() -> resolution.outcome.complete(PlayResult.cancelled()));
                iterator.remove();
                log.debug("Cancelled resolution of '{}'", resolution.input);
            }
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> command) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            context.execute(() -> {
                if (closed) {
                    result.completeExceptionally(new SessionClosedException(guildId));
                    return;
                }
                try {
                    T value = command.get();
                    flush();
                    result.complete(value);
                } catch (RuntimeException e) {
                    flush();
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    private CompletableFuture<SessionSnapshot> mutate(Runnable mutation) {
        return submit(() -> {
            mutation.run();
            flush();
            return snapshot;
        });
    }

    private void inContext(Runnable task) {
        context.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Session task failed", e);
            } finally {
                flush();
            }
        });
    }

    /**
     * Defers completing a future handed to a caller until the next {@link #flush()}.
     */
    private void afterFlush(Runnable completion) {
        completions.add(completion);
    }

    private void flush() {
        snapshot = buildSnapshot();
        if (songChanged) {
            songChanged = false;
            broadcaster.publish(SongUpdateEvent.of(snapshot));
        }
        if (queueChanged) {
            queueChanged = false;
            broadcaster.publish(QueueUpdateEvent.of(snapshot));
        }
        if (!completions.isEmpty()) {
            List<Runnable> due = new ArrayList<>(completions);
            completions.clear();
            due.forEach(Runnable::run);
        }
    }

    private SessionSnapshot buildSnapshot() {
        return SessionSnapshot.builder()
                .guildId(guildId)
                .name(name)
                .state(machine.getState())
                .currentTrack(currentTrack)
                .queue(queue.snapshot())
                .volume(volume)
                .memberCount(connection == null ? 0 : connection.getListenerCount())
                .lastActivity(lastActivity)
                .build();
    }

    private void touch() {
        lastActivity = clock.instant();
    }

    private static void checkVolume(int requested) {
        if (requested < MIN_VOLUME || requested > MAX_VOLUME) {
            throw new InvalidInputException("Volume must be between " + MIN_VOLUME + " and " + MAX_VOLUME
                    + ", got " + requested);
        }
    }

    private static void leaveQuietly(VoiceConnection voiceConnection) {
        try {
            voiceConnection.leave();
        } catch (RuntimeException e) {
            log.warn("Leaving voice channel {} failed: {}", voiceConnection.getChannelId(), e.toString());
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
