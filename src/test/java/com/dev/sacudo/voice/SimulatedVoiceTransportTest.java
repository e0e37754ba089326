package com.dev.sacudo.voice;

import com.dev.sacudo.domain.Track;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SimulatedVoiceTransportTest {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final SimulatedVoiceTransport transport = new SimulatedVoiceTransport(scheduler, Duration.ofMillis(100));

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void trackFinishesAfterItsDuration() {
        VoiceConnection connection = transport.join("1", "general");

        CompletableFuture<TrackEnd> end = connection.play(track(Duration.ofMillis(50)), 100);

        assertThat(connection.getChannelId()).isEqualTo("general");
        assertThat(end.orTimeout(2, TimeUnit.SECONDS).join()).isEqualTo(TrackEnd.FINISHED);
    }

    @Test
    void unknownDurationUsesDefaultLength() {
        CompletableFuture<TrackEnd> end = transport.join("1", "general").play(track(Duration.ZERO), 100);

        await().atMost(Duration.ofSeconds(2)).until(end::isDone);
        assertThat(end.join()).isEqualTo(TrackEnd.FINISHED);
    }

    @Test
    void replacingATrackStopsThePreviousOne() {
        VoiceConnection connection = transport.join("1", "general");
        CompletableFuture<TrackEnd> first = connection.play(track(Duration.ofMinutes(1)), 100);

        connection.play(track(Duration.ofMinutes(1)), 100);

        assertThat(first).isCompletedWithValue(TrackEnd.STOPPED);
    }

    @Test
    void pausedTrackDoesNotFinish() throws Exception {
        VoiceConnection connection = transport.join("1", "general");
        CompletableFuture<TrackEnd> end = connection.play(track(Duration.ofMillis(150)), 100);

        connection.pause();
        Thread.sleep(300);
        assertThat(end).isNotDone();

        connection.resume();
        assertThat(end.orTimeout(2, TimeUnit.SECONDS).join()).isEqualTo(TrackEnd.FINISHED);
    }

    @Test
    void leavingStopsPlayback() {
        VoiceConnection connection = transport.join("1", "general");
        CompletableFuture<TrackEnd> end = connection.play(track(Duration.ofMinutes(1)), 100);

        connection.leave();

        assertThat(end).isCompletedWithValue(TrackEnd.STOPPED);
    }

    private static Track track(Duration duration) {
        return Track.builder()
                .id("t")
                .sourceUrl("https://example.org/t")
                .title("T")
                .thumbnailUrl("https://example.org/t.jpg")
                .duration(duration)
                .requestedBy("alice")
                .streamUri("https://cdn.example.org/t")
                .build();
    }
}
