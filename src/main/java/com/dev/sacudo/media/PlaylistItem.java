package com.dev.sacudo.media;

public record PlaylistItem(
        String url,
        String title
) {
}
