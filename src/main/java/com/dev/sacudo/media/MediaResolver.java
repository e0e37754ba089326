package com.dev.sacudo.media;

import com.dev.sacudo.config.ResolverProperties;
import com.dev.sacudo.domain.ResolutionFailure;
import com.dev.sacudo.domain.Track;
import com.dev.sacudo.web.ResolutionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns user input into {@link Track}s through the extraction backend.
 *
 * <p>Each backend call runs on the attempt executor and is abandoned once it exceeds the configured attempt
 * timeout. {@link ResolutionFailure#isRetryable() Retryable} failures are retried with exponential backoff up to
 * {@code maxAttempts} calls in total; every other failure surfaces on the first occurrence.
 *
 * <p>Resolution is cancelled by interrupting the thread that called {@link #resolve}; the in-flight attempt is
 * cancelled with it and {@link CancellationException} is thrown.
 */
@Slf4j
public class MediaResolver {

    private static final String UNKNOWN_REQUESTER = "unknown";

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ExtractionBackend backend;
    private final ResolverProperties properties;
    private final ExecutorService attemptExecutor;
    private final Sleeper sleeper;

    public MediaResolver(ExtractionBackend backend, ResolverProperties properties, ExecutorService attemptExecutor) {
        this(backend, properties, attemptExecutor, duration -> Thread.sleep(duration.toMillis()));
    }

    public MediaResolver(ExtractionBackend backend, ResolverProperties properties, ExecutorService attemptExecutor,
                         Sleeper sleeper) {
        this.backend = backend;
        this.properties = properties;
        this.attemptExecutor = attemptExecutor;
        this.sleeper = sleeper;
    }

    public MediaRequest classify(String input) {
        return InputClassifier.classify(input);
    }

    public Track resolve(String input, String requestedBy) {
        return resolve(classify(input), requestedBy);
    }

    public Track resolve(MediaRequest request, String requestedBy) {
        Duration timeout = properties.attemptTimeout();
        ExtractedMedia media = withRetries(request.target(), () -> backend.extract(request.target(), timeout));
        return toTrack(media, request, requestedBy);
    }

    /**
     * Lists a playlist and returns a cursor that resolves one entry per {@link Iterator#next()} call. The cursor
     * can be consumed once; entries that fail to resolve are returned as failed entries instead of ending it.
     */
    public Iterator<PlaylistEntry> resolvePlaylist(MediaRequest request, String requestedBy) {
        Duration timeout = properties.attemptTimeout();
        List<PlaylistItem> items = withRetries(request.target(),
                () -> backend.listPlaylist(request.target(), properties.playlistLimit(), timeout));
        if (items.isEmpty()) {
            throw new ResolutionException(ResolutionFailure.NOT_FOUND, "Playlist has no entries: " + request.input());
        }
        log.info("Playlist {} lists {} entries", request.target(), items.size());
        return new PlaylistCursor(items, requestedBy);
    }

    private <T> T withRetries(String target, Callable<T> call) {
        int maxAttempts = Math.max(1, properties.maxAttempts());
        Duration backoff = properties.initialBackoff();
        for (int attempt = 1; ; attempt++) {
            try {
                return attemptOnce(call);
            } catch (ResolutionException e) {
                if (!e.getFailure().isRetryable() || attempt >= maxAttempts) {
                    log.warn("Resolution of {} failed after {} attempt(s): {} {}", target, attempt,
                            e.getFailure(), e.getMessage());
                    throw e;
                }
                log.info("Resolution of {} hit {} (attempt {}/{}), retrying in {}", target, e.getFailure(),
                        attempt, maxAttempts, backoff);
                pause(backoff);
                backoff = next(backoff);
            }
        }
    }

    private <T> T attemptOnce(Callable<T> call) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Resolution cancelled");
        }
        Duration timeout = properties.attemptTimeout();
        Future<T> attempt = attemptExecutor.submit(call);
        try {
            return attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            throw new ResolutionException(ResolutionFailure.TIMEOUT, "Extraction timed out after " + timeout);
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Resolution cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResolutionException resolutionException) {
                throw resolutionException;
            }
            if (cause instanceof InterruptedException) {
                throw new CancellationException("Resolution cancelled");
            }
            throw new IllegalStateException("Extraction backend failed: " + cause, cause);
        }
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Resolution cancelled");
        }
    }

    private Duration next(Duration backoff) {
        Duration doubled = backoff.multipliedBy(2);
        return doubled.compareTo(properties.maxBackoff()) > 0 ? properties.maxBackoff() : doubled;
    }

    Track toTrack(ExtractedMedia media, MediaRequest request, String requestedBy) {
        if (isBlank(media.streamUrl())) {
            throw new ResolutionException(ResolutionFailure.NOT_FOUND, "No playable stream for " + request.input());
        }
        String sourceUrl = firstNonBlank(media.webpageUrl(), request.directUrl() ? request.target() : null,
                media.streamUrl());
        String thumbnail = firstNonBlank(media.thumbnailUrl(),
                InputClassifier.youtubeThumbnail(sourceUrl).orElse(null),
                properties.fallbackThumbnailUrl());
        Duration duration = media.duration() == null || media.duration().isNegative()
                ? Duration.ZERO
                : media.duration();
        return Track.builder()
                .id(UUID.randomUUID().toString())
                .sourceUrl(sourceUrl)
                .title(firstNonBlank(media.title(), properties.fallbackTitle()))
                .thumbnailUrl(thumbnail)
                .duration(duration)
                .requestedBy(isBlank(requestedBy) ? UNKNOWN_REQUESTER : requestedBy)
                .streamUri(media.streamUrl())
                .build();
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (!isBlank(candidate)) {
                return candidate;
            }
        }
        return "";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private final class PlaylistCursor implements Iterator<PlaylistEntry> {

        private final List<PlaylistItem> items;
        private final String requestedBy;
        private int index;

        PlaylistCursor(List<PlaylistItem> items, String requestedBy) {
            this.items = items;
            this.requestedBy = requestedBy;
        }

        @Override
        public boolean hasNext() {
            return index < items.size();
        }

        @Override
        public PlaylistEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            PlaylistItem item = items.get(index++);
            try {
                return PlaylistEntry.resolved(item.url(), resolve(MediaRequest.ofUrl(item.url()), requestedBy));
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Skipping playlist entry {}: {}", item.url(), e.getMessage());
                return PlaylistEntry.failed(item.url(), e);
            }
        }
    }
}
