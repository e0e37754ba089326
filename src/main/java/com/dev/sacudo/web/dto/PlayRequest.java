package com.dev.sacudo.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param volume volume for this track only; omit to follow the guild volume
 */
public record PlayRequest(
        @NotBlank String url,
        String channelId,
        String requestedBy,
        Integer volume
) {
}
