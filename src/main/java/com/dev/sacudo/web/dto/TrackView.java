package com.dev.sacudo.web.dto;

import com.dev.sacudo.domain.Track;

public record TrackView(
        String id,
        String title,
        String url,
        String thumbnail,
        long durationSeconds,
        String requestedBy,
        Integer volumeOverride
) {

    public static TrackView of(Track track) {
        if (track == null) {
            return null;
        }
        return new TrackView(
                track.getId(),
                track.getTitle(),
                track.getSourceUrl(),
                track.getThumbnailUrl(),
                track.getDuration().toSeconds(),
                track.getRequestedBy(),
                track.getVolumeOverride().orElse(null)
        );
    }
}
