package com.dev.sacudo.voice;

import com.dev.sacudo.domain.Track;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Voice transport that streams nothing: tracks "play" for their duration and then report {@link TrackEnd#FINISHED}.
 * Registered when no gateway-backed transport is present, so sessions can be driven and observed end to end.
 */
@Slf4j
public class SimulatedVoiceTransport implements VoiceTransport {

    private final ScheduledExecutorService scheduler;
    private final Duration defaultTrackLength;

    public SimulatedVoiceTransport(ScheduledExecutorService scheduler, Duration defaultTrackLength) {
        this.scheduler = scheduler;
        this.defaultTrackLength = defaultTrackLength;
    }

    @Override
    public VoiceConnection join(String guildId, String channelId) {
        log.info("Simulated voice join guild={} channel={}", guildId, channelId);
        return new SimulatedConnection(guildId, channelId);
    }

    private final class SimulatedConnection implements VoiceConnection {

        private final String guildId;
        private final String channelId;
        private CompletableFuture<TrackEnd> playing;
        private ScheduledFuture<?> completion;
        private Duration remaining = Duration.ZERO;
        private Instant startedAt;

        SimulatedConnection(String guildId, String channelId) {
            this.guildId = guildId;
            this.channelId = channelId;
        }

        @Override
        public String getChannelId() {
            return channelId;
        }

        @Override
        public String getGuildName() {
            return guildId;
        }

        @Override
        public int getListenerCount() {
            return 1;
        }

        @Override
        public synchronized CompletableFuture<TrackEnd> play(Track track, int volume) {
            end(TrackEnd.STOPPED);
            playing = new CompletableFuture<>();
            remaining = track.getDuration().isZero() ? defaultTrackLength : track.getDuration();
            schedule();
            log.debug("Simulated playback of '{}' for {} at volume {}", track.getTitle(), remaining, volume);
            return playing;
        }

        @Override
        public synchronized void pause() {
            if (completion != null && completion.cancel(false)) {
                remaining = remaining.minus(Duration.between(startedAt, Instant.now()));
                if (remaining.isNegative()) {
                    remaining = Duration.ZERO;
                }
                completion = null;
            }
        }

        @Override
        public synchronized void resume() {
            if (playing != null && !playing.isDone() && completion == null) {
                schedule();
            }
        }

        @Override
        public void setVolume(int volume) {
            log.debug("Simulated volume change to {}", volume);
        }

        @Override
        public synchronized void stopTrack() {
            end(TrackEnd.STOPPED);
        }

        @Override
        public synchronized void leave() {
            end(TrackEnd.STOPPED);
            log.info("Simulated voice leave guild={} channel={}", guildId, channelId);
        }

        private void schedule() {
            CompletableFuture<TrackEnd> current = playing;
            startedAt = Instant.now();
            completion = scheduler.schedule(() -> current.complete(TrackEnd.FINISHED),
                    remaining.toMillis(), TimeUnit.MILLISECONDS);
        }

        private void end(TrackEnd reason) {
            if (completion != null) {
                completion.cancel(false);
                completion = null;
            }
            if (playing != null) {
                playing.complete(reason);
                playing = null;
            }
        }
    }
}
