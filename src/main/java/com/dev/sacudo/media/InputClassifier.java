package com.dev.sacudo.media;

import com.dev.sacudo.web.InvalidInputException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tells links from search queries and pulls what little metadata can be derived from a link alone.
 */
public final class InputClassifier {

    static final int MAX_INPUT_LENGTH = 2000;
    static final String SEARCH_PREFIX = "ytsearch1:";

    private static final List<String> SCHEMES = List.of("http://", "https://");
    private static final List<String> BARE_PREFIXES = List.of(
            "youtu.be/", "youtube.com/", "www.youtube.com/", "m.youtube.com/", "music.youtube.com/");
    private static final List<String> MEDIA_DOMAINS = List.of("soundcloud.com", "bandcamp.com", "spotify.com");
    private static final Pattern VIDEO_ID = Pattern.compile("(?:[?&]v=|youtu\\.be/|/shorts/|/embed/)([0-9A-Za-z_-]{11})");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private InputClassifier() {
    }

    public static MediaRequest classify(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidInputException("Query must not be empty");
        }
        String text = input.strip();
        if (text.length() > MAX_INPUT_LENGTH) {
            throw new InvalidInputException("Query is longer than " + MAX_INPUT_LENGTH + " characters");
        }
        if (!looksLikeUrl(text)) {
            return new MediaRequest(text, SEARCH_PREFIX + text, false, false);
        }
        if (WHITESPACE.matcher(text).find()) {
            throw new InvalidInputException("Malformed URL: " + text);
        }
        String url = hasScheme(text) ? text : "https://" + text;
        URI uri = parse(url);
        return new MediaRequest(text, url, true, isPlaylist(uri));
    }

    public static Optional<String> youtubeVideoId(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.contains("youtube.com") && !lower.contains("youtu.be")) {
            return Optional.empty();
        }
        Matcher matcher = VIDEO_ID.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static Optional<String> youtubeThumbnail(String url) {
        return youtubeVideoId(url).map(id -> "https://img.youtube.com/vi/" + id + "/hqdefault.jpg");
    }

    static boolean looksLikeUrl(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (hasScheme(lower)) {
            return true;
        }
        if (BARE_PREFIXES.stream().anyMatch(lower::startsWith)) {
            return true;
        }
        return !WHITESPACE.matcher(lower).find() && MEDIA_DOMAINS.stream().anyMatch(lower::contains);
    }

    private static boolean hasScheme(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return SCHEMES.stream().anyMatch(lower::startsWith);
    }

    private static URI parse(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                throw new InvalidInputException("Malformed URL: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new InvalidInputException("Malformed URL: " + url);
        }
    }

    private static boolean isPlaylist(URI uri) {
        String query = uri.getRawQuery();
        if (query != null && (query.startsWith("list=") || query.contains("&list="))) {
            return true;
        }
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        return path.startsWith("/playlist") || path.contains("/sets/") || path.contains("/album/");
    }
}
