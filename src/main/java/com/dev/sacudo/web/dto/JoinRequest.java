package com.dev.sacudo.web.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinRequest(
        @NotBlank String channelId
) {
}
