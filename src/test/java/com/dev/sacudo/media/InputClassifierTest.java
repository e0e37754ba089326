package com.dev.sacudo.media;

import com.dev.sacudo.web.InvalidInputException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputClassifierTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t"})
    void blankInputIsRejected(String input) {
        assertThatThrownBy(() -> InputClassifier.classify(input))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Query must not be empty");
    }

    @Test
    void nullInputIsRejected() {
        assertThatThrownBy(() -> InputClassifier.classify(null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void overlongInputIsRejected() {
        String input = "a".repeat(InputClassifier.MAX_INPUT_LENGTH + 1);

        assertThatThrownBy(() -> InputClassifier.classify(input)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void plainTextBecomesSearch() {
        MediaRequest request = InputClassifier.classify("  never gonna give you up ");

        assertThat(request.directUrl()).isFalse();
        assertThat(request.input()).isEqualTo("never gonna give you up");
        assertThat(request.target()).isEqualTo("ytsearch1:never gonna give you up");
    }

    @Test
    void linksAreKeptAsUrls() {
        MediaRequest request = InputClassifier.classify("https://www.youtube.com/watch?v=dQw4w9WgXcQ");

        assertThat(request.directUrl()).isTrue();
        assertThat(request.playlist()).isFalse();
        assertThat(request.target()).isEqualTo("https://www.youtube.com/watch?v=dQw4w9WgXcQ");
    }

    @Test
    void bareHostsGetHttps() {
        assertThat(InputClassifier.classify("youtu.be/dQw4w9WgXcQ").target())
                .isEqualTo("https://youtu.be/dQw4w9WgXcQ");
        assertThat(InputClassifier.classify("soundcloud.com/artist/track").directUrl()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://www.youtube.com/playlist?list=PL123",
            "https://www.youtube.com/watch?v=dQw4w9WgXcQ&list=PL123",
            "https://soundcloud.com/artist/sets/best-of",
            "https://artist.bandcamp.com/album/first"
    })
    void playlistLinksAreDetected(String url) {
        assertThat(InputClassifier.classify(url).playlist()).isTrue();
    }

    @Test
    void malformedUrlIsRejected() {
        assertThatThrownBy(() -> InputClassifier.classify("https://exa mple.com/x"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageStartingWith("Malformed URL");
        assertThatThrownBy(() -> InputClassifier.classify("https://"))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void youtubeThumbnailIsDerivedFromVideoId() {
        assertThat(InputClassifier.youtubeThumbnail("https://youtu.be/dQw4w9WgXcQ"))
                .contains("https://img.youtube.com/vi/dQw4w9WgXcQ/hqdefault.jpg");
        assertThat(InputClassifier.youtubeVideoId("https://www.youtube.com/shorts/abcdefghijk"))
                .contains("abcdefghijk");
        assertThat(InputClassifier.youtubeThumbnail("https://soundcloud.com/a/b")).isEmpty();
    }
}
