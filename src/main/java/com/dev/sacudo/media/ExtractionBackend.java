package com.dev.sacudo.media;

import com.dev.sacudo.web.ResolutionException;

import java.time.Duration;
import java.util.List;

/**
 * External metadata/stream extractor. Implementations own whatever credentials or cookies they need.
 *
 * <p>Categorized failures are reported as {@link ResolutionException}; anything else is treated as an internal
 * error and never retried. Implementations should give up after {@code timeout} and must stop promptly when
 * the calling thread is interrupted.
 */
public interface ExtractionBackend {

    /**
     * Resolves a URL or a search expression (e.g. {@code ytsearch1:query}) to a single playable item.
     */
    ExtractedMedia extract(String target, Duration timeout) throws InterruptedException;

    /**
     * Lists the entries of a playlist without resolving their streams.
     */
    List<PlaylistItem> listPlaylist(String url, int limit, Duration timeout) throws InterruptedException;
}
