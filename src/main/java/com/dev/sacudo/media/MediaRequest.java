package com.dev.sacudo.media;

/**
 * Classified user input.
 *
 * @param input    the trimmed text as the user typed it
 * @param target   what is handed to the extraction backend: a normalized URL or a search expression
 * @param directUrl whether the input was a link rather than a search query
 * @param playlist whether the link points at a playlist
 */
public record MediaRequest(
        String input,
        String target,
        boolean directUrl,
        boolean playlist
) {

    public static MediaRequest ofUrl(String url) {
        return new MediaRequest(url, url, true, false);
    }
}
