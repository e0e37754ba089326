package com.dev.sacudo.web.dto;

import jakarta.validation.constraints.NotNull;

public record VolumeRequest(
        @NotNull Integer volume
) {
}
