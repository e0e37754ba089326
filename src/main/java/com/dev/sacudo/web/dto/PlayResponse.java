package com.dev.sacudo.web.dto;

import com.dev.sacudo.session.PlayResult;

import java.util.Locale;

public record PlayResponse(
        String status,
        TrackView track,
        Integer position
) {

    public static PlayResponse of(PlayResult result) {
        return new PlayResponse(
                result.outcome().name().toLowerCase(Locale.ROOT),
                TrackView.of(result.track()),
                result.position() >= 0 ? result.position() : null
        );
    }
}
