package com.dev.sacudo.media;

import java.time.Duration;

/**
 * Raw metadata returned by an extraction backend. Everything but {@code streamUrl} may be null.
 */
public record ExtractedMedia(
        String id,
        String title,
        String webpageUrl,
        String thumbnailUrl,
        Duration duration,
        String streamUrl
) {
}
