package com.dev.sacudo.media;

import com.dev.sacudo.config.ExtractorProperties;
import com.dev.sacudo.domain.ResolutionFailure;
import com.dev.sacudo.web.ResolutionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Extraction backend that shells out to {@code yt-dlp} and reads its JSON dump.
 *
 * <p>Failures are categorized from stderr. A process outliving the timeout, or whose caller is interrupted,
 * is destroyed.
 */
@Slf4j
public class YtDlpExtractionBackend implements ExtractionBackend {

    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";
    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private final ProcessFactory processFactory;
    private final ExtractorProperties properties;
    private final ObjectMapper objectMapper;

    public YtDlpExtractionBackend(ExtractorProperties properties, ObjectMapper objectMapper) {
        this(command -> new ProcessBuilder(command).start(), properties, objectMapper);
    }

    YtDlpExtractionBackend(ProcessFactory processFactory, ExtractorProperties properties, ObjectMapper objectMapper) {
        this.processFactory = processFactory;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExtractedMedia extract(String target, Duration timeout) throws InterruptedException {
        JsonNode root = run(command(List.of("-J", "--no-playlist", "-f", "bestaudio/best"), target), timeout);
        JsonNode entry = root;
        if (root.has("entries")) {
            JsonNode entries = root.get("entries");
            if (!entries.isArray() || entries.isEmpty() || entries.get(0).isNull()) {
                throw new ResolutionException(ResolutionFailure.NOT_FOUND, "No results for " + target);
            }
            entry = entries.get(0);
        }
        String stream = text(entry, "url");
        JsonNode requestedFormats = entry.path("requested_formats");
        if (stream == null && requestedFormats.isArray() && !requestedFormats.isEmpty()) {
            stream = text(requestedFormats.get(0), "url");
        }
        if (stream == null) {
            throw new ResolutionException(ResolutionFailure.NOT_FOUND, "No playable stream for " + target);
        }
        return new ExtractedMedia(
                text(entry, "id"),
                text(entry, "title"),
                text(entry, "webpage_url"),
                text(entry, "thumbnail"),
                duration(entry),
                stream);
    }

    @Override
    public List<PlaylistItem> listPlaylist(String url, int limit, Duration timeout) throws InterruptedException {
        JsonNode root = run(command(List.of("-J", "--flat-playlist", "--playlist-end", String.valueOf(limit)), url),
                timeout);
        List<PlaylistItem> items = new ArrayList<>();
        for (JsonNode entry : root.path("entries")) {
            String entryUrl = text(entry, "url");
            if (entryUrl == null || !entryUrl.startsWith("http")) {
                String id = text(entry, "id");
                entryUrl = text(entry, "webpage_url") != null ? text(entry, "webpage_url")
                        : id != null ? WATCH_URL + id : null;
            }
            if (entryUrl != null) {
                items.add(new PlaylistItem(entryUrl, text(entry, "title")));
            }
            if (items.size() >= limit) {
                break;
            }
        }
        return items;
    }

    static ResolutionFailure classifyError(String stderr) {
        String text = stderr == null ? "" : stderr.toLowerCase(Locale.ROOT);
        if (text.contains("http error 429") || text.contains("too many requests")) {
            return ResolutionFailure.RATE_LIMITED;
        }
        if (text.contains("timed out") || text.contains("read timeout")) {
            return ResolutionFailure.TIMEOUT;
        }
        if (text.contains("sign in to confirm") || text.contains("login required") || text.contains("age-restricted")
                || text.contains("private video") || text.contains("members-only") || text.contains("http error 403")) {
            return ResolutionFailure.AUTH_REQUIRED;
        }
        if (text.contains("not available in your country") || text.contains("geo restrict")
                || text.contains("geo-restrict") || text.contains("blocked it in your country")) {
            return ResolutionFailure.REGION_BLOCKED;
        }
        return ResolutionFailure.NOT_FOUND;
    }

    private List<String> command(List<String> options, String target) {
        List<String> command = new ArrayList<>();
        command.add(properties.binary());
        command.addAll(options);
        command.add("--no-warnings");
        command.addAll(properties.extraArgs());
        command.add("--");
        command.add(target);
        return command;
    }

    private JsonNode run(List<String> command, Duration timeout) throws InterruptedException {
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot start " + properties.binary() + ": " + e.getMessage(), e);
        }
        StreamCollector stdout = StreamCollector.start(process.getInputStream(), "yt-dlp-out",
                properties.maxOutputBytes());
        StreamCollector stderr = StreamCollector.start(process.getErrorStream(), "yt-dlp-err",
                properties.maxStderrChars());
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroy(process);
                throw new ResolutionException(ResolutionFailure.TIMEOUT,
                        properties.binary() + " did not finish within " + timeout);
            }
            stdout.await(DRAIN_TIMEOUT);
            stderr.await(DRAIN_TIMEOUT);
        } catch (InterruptedException e) {
            destroy(process);
            throw e;
        }
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String diagnostics = stderr.text().strip();
            ResolutionFailure failure = classifyError(diagnostics);
            log.debug("{} exited with {}: {}", properties.binary(), exitCode, diagnostics);
            throw new ResolutionException(failure, lastLine(diagnostics, exitCode));
        }
        if (stdout.overflowed()) {
            throw new IllegalStateException(properties.binary() + " output exceeded "
                    + properties.maxOutputBytes() + " bytes");
        }
        try {
            return objectMapper.readTree(stdout.text());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable " + properties.binary() + " output", e);
        }
    }

    private static String lastLine(String diagnostics, int exitCode) {
        if (diagnostics.isEmpty()) {
            return "Extractor exited with code " + exitCode;
        }
        String[] lines = diagnostics.split("\\R");
        return lines[lines.length - 1];
    }

    private static void destroy(Process process) {
        process.destroy();
        try {
            if (!process.waitFor(1, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static Duration duration(JsonNode node) {
        JsonNode value = node.get("duration");
        if (value == null || !value.isNumber()) {
            return null;
        }
        return Duration.ofMillis(Math.round(value.asDouble() * 1000));
    }

    /**
     * Drains one process stream on a daemon thread so neither pipe can fill up and stall the process.
     */
    private static final class StreamCollector implements Runnable {

        private final InputStream stream;
        private final int maxBytes;
        private final StringBuilder sink = new StringBuilder();
        private final Thread thread;
        private volatile boolean overflowed;

        private StreamCollector(InputStream stream, String name, int maxBytes) {
            this.stream = stream;
            this.maxBytes = maxBytes;
            this.thread = new Thread(this, name);
            this.thread.setDaemon(true);
        }

        static StreamCollector start(InputStream stream, String name, int maxBytes) {
            StreamCollector collector = new StreamCollector(stream, name, maxBytes);
            collector.thread.start();
            return collector;
        }

        @Override
        public void run() {
            byte[] buffer = new byte[8192];
            try (InputStream in = stream) {
                ByteArrayOutputStream bytes = new ByteArrayOutputStream();
                int read;
                while ((read = in.read(buffer)) != -1) {
                    int room = maxBytes - bytes.size();
                    if (read > room) {
                        overflowed = true;
                    }
                    if (room > 0) {
                        bytes.write(buffer, 0, Math.min(read, room));
                    }
                }
                synchronized (sink) {
                    sink.append(bytes.toString(StandardCharsets.UTF_8));
                }
            } catch (IOException e) {
                log.debug("Stream {} closed early: {}", thread.getName(), e.toString());
            }
        }

        void await(Duration timeout) throws InterruptedException {
            thread.join(timeout.toMillis());
        }

        /**
         * Whether the stream produced more than the cap. Kept bytes stop at the cap; the rest is discarded.
         */
        boolean overflowed() {
            return overflowed;
        }

        String text() {
            synchronized (sink) {
                return sink.toString();
            }
        }
    }
}
