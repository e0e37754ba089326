package com.dev.sacudo.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.Optional;

/**
 * A resolved, playable item. Every field except the volume override is filled in by the resolver,
 * falling back to generic values where the extraction backend had nothing to offer. The override comes from
 * the play request.
 */
@Value
@Builder
public class Track {
    @NonNull String id;
    @NonNull String sourceUrl;
    @NonNull String title;
    @NonNull String thumbnailUrl;
    @NonNull Duration duration;
    @NonNull String requestedBy;
    @NonNull String streamUri;
    @With
    Integer volumeOverride;

    public Optional<Integer> getVolumeOverride() {
        return Optional.ofNullable(volumeOverride);
    }

    public int effectiveVolume(int sessionVolume) {
        return volumeOverride != null ? volumeOverride : sessionVolume;
    }
}
