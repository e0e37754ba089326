package com.dev.sacudo.media;

import com.dev.sacudo.config.ExtractorProperties;
import com.dev.sacudo.domain.ResolutionFailure;
import com.dev.sacudo.web.ResolutionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YtDlpExtractionBackendTest {

    private final ExtractorProperties properties =
            new ExtractorProperties("yt-dlp", List.of("--cookies", "c.txt"), 4096, 65536,
                    Duration.ofMinutes(3));
    private final List<List<String>> commands = new ArrayList<>();

    @Test
    void parsesSingleVideo() throws Exception {
        String json = """
                {"id": "abc", "title": "Song", "webpage_url": "https://youtu.be/abc",
                 "thumbnail": "https://i.ytimg.com/abc.jpg", "duration": 212.5, "url": "https://cdn/abc"}
                """;
        YtDlpExtractionBackend backend = backend(FakeProcess.finished(0, json, ""));

        ExtractedMedia media = backend.extract("https://youtu.be/abc", Duration.ofSeconds(5));

        assertThat(media.title()).isEqualTo("Song");
        assertThat(media.streamUrl()).isEqualTo("https://cdn/abc");
        assertThat(media.duration()).isEqualTo(Duration.ofMillis(212_500));
        assertThat(commands.get(0)).containsExactly("yt-dlp", "-J", "--no-playlist", "-f", "bestaudio/best",
                "--no-warnings", "--cookies", "c.txt", "--", "https://youtu.be/abc");
    }

    @Test
    void takesFirstSearchResultAndFallsBackToRequestedFormats() throws Exception {
        String json = """
                {"entries": [{"id": "x", "title": "First", "requested_formats": [{"url": "https://cdn/x"}]}]}
                """;
        YtDlpExtractionBackend backend = backend(FakeProcess.finished(0, json, ""));

        ExtractedMedia media = backend.extract("ytsearch1:first", Duration.ofSeconds(5));

        assertThat(media.title()).isEqualTo("First");
        assertThat(media.streamUrl()).isEqualTo("https://cdn/x");
        assertThat(media.duration()).isNull();
    }

    @Test
    void emptySearchIsNotFound() {
        YtDlpExtractionBackend backend = backend(FakeProcess.finished(0, "{\"entries\": []}", ""));

        assertThatThrownBy(() -> backend.extract("ytsearch1:nothing", Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(ResolutionException.class,
                        e -> assertThat(e.getFailure()).isEqualTo(ResolutionFailure.NOT_FOUND));
    }

    @Test
    void failedRunIsCategorizedFromStderr() {
        String stderr = "[youtube] abc: Downloading webpage\nERROR: [youtube] abc: HTTP Error 429: Too Many Requests";
        YtDlpExtractionBackend backend = backend(FakeProcess.finished(1, "", stderr));

        assertThatThrownBy(() -> backend.extract("https://youtu.be/abc", Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(ResolutionException.class, e -> {
                    assertThat(e.getFailure()).isEqualTo(ResolutionFailure.RATE_LIMITED);
                    assertThat(e.getMessage()).startsWith("ERROR: [youtube] abc: HTTP Error 429");
                });
    }

    @Test
    void hungProcessIsDestroyedOnTimeout() {
        FakeProcess process = FakeProcess.hanging();
        YtDlpExtractionBackend backend = backend(process);

        assertThatThrownBy(() -> backend.extract("https://youtu.be/abc", Duration.ofMillis(50)))
                .isInstanceOfSatisfying(ResolutionException.class,
                        e -> assertThat(e.getFailure()).isEqualTo(ResolutionFailure.TIMEOUT));
        assertThat(process.destroyed()).isTrue();
    }

    @Test
    void unreadableOutputIsAnError() {
        YtDlpExtractionBackend backend = backend(FakeProcess.finished(0, "not json at all {", ""));

        assertThatThrownBy(() -> backend.extract("https://youtu.be/abc", Duration.ofSeconds(5)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void oversizedOutputFailsInsteadOfBeingParsed() {
        ExtractorProperties capped =
                new ExtractorProperties("yt-dlp", List.of(), 4096, 1024, Duration.ofMinutes(3));
        String json = "{\"title\": \"" + "x".repeat(4096) + "\", \"url\": \"https://cdn/a\"}";
        YtDlpExtractionBackend backend = new YtDlpExtractionBackend(command -> FakeProcess.finished(0, json, ""),
                capped, new ObjectMapper());

        assertThatThrownBy(() -> backend.extract("https://youtu.be/abc", Duration.ofSeconds(5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("exceeded 1024 bytes");
    }

    @Test
    void missingBinaryIsAnError() {
        YtDlpExtractionBackend backend = new YtDlpExtractionBackend(command -> {
            throw new IOException("No such file");
        }, properties, new ObjectMapper());

        assertThatThrownBy(() -> backend.extract("https://youtu.be/abc", Duration.ofSeconds(5)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Cannot start yt-dlp");
    }

    @Test
    void listsFlatPlaylistUpToLimit() throws Exception {
        String json = """
                {"entries": [
                  {"id": "aaaaaaaaaaa", "title": "A", "url": "aaaaaaaaaaa"},
                  {"id": "b", "title": "B", "url": "https://youtu.be/b"},
                  {"id": "c", "title": "C", "webpage_url": "https://youtu.be/c"}
                ]}
                """;
        YtDlpExtractionBackend backend = backend(FakeProcess.finished(0, json, ""));

        List<PlaylistItem> items = backend.listPlaylist("https://www.youtube.com/playlist?list=PL", 2,
                Duration.ofSeconds(5));

        assertThat(items).extracting(PlaylistItem::url)
                .containsExactly("https://www.youtube.com/watch?v=aaaaaaaaaaa", "https://youtu.be/b");
        assertThat(commands.get(0)).contains("--flat-playlist", "--playlist-end", "2");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "ERROR: HTTP Error 429: Too Many Requests | RATE_LIMITED",
            "ERROR: Read timed out.                   | TIMEOUT",
            "ERROR: Sign in to confirm your age       | AUTH_REQUIRED",
            "ERROR: Private video                     | AUTH_REQUIRED",
            "ERROR: HTTP Error 403: Forbidden         | AUTH_REQUIRED",
            "ERROR: The uploader has not made this video available in your country | REGION_BLOCKED",
            "ERROR: Video unavailable                 | NOT_FOUND",
            "''                                       | NOT_FOUND"
    })
    void classifiesExtractorErrors(String stderr, ResolutionFailure expected) {
        assertThat(YtDlpExtractionBackend.classifyError(stderr)).isEqualTo(expected);
    }

    private YtDlpExtractionBackend backend(FakeProcess process) {
        return new YtDlpExtractionBackend(command -> {
            commands.add(command);
            return process;
        }, properties, new ObjectMapper());
    }

    private static final class FakeProcess extends Process {

        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final CountDownLatch exit;
        private volatile boolean destroyed;

        private FakeProcess(int exitCode, String out, String err, boolean running) {
            this.exitCode = exitCode;
            this.out = out.getBytes(StandardCharsets.UTF_8);
            this.err = err.getBytes(StandardCharsets.UTF_8);
            this.exit = new CountDownLatch(running ? 1 : 0);
        }

        static FakeProcess finished(int exitCode, String out, String err) {
            return new FakeProcess(exitCode, out, err, false);
        }

        static FakeProcess hanging() {
            return new FakeProcess(0, "", "", true);
        }

        boolean destroyed() {
            return destroyed;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() throws InterruptedException {
            exit.await();
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            return exit.await(timeout, unit);
        }

        @Override
        public int exitValue() {
            if (exit.getCount() > 0) {
                throw new IllegalThreadStateException("still running");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyed = true;
            exit.countDown();
        }
    }
}
