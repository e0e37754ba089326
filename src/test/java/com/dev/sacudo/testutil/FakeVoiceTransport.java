package com.dev.sacudo.testutil;

import com.dev.sacudo.domain.Track;
import com.dev.sacudo.voice.TrackEnd;
import com.dev.sacudo.voice.VoiceConnection;
import com.dev.sacudo.voice.VoiceTransport;
import com.dev.sacudo.web.TransportException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Voice transport whose tracks only end when a test says so.
 */
public final class FakeVoiceTransport implements VoiceTransport {

    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private final AtomicInteger failJoins = new AtomicInteger();
    private volatile CountDownLatch joinGate;

    @Override
    public VoiceConnection join(String guildId, String channelId) {
        CountDownLatch gate = joinGate;
        if (gate != null) {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failJoins.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransportException("Missing permissions for channel " + channelId);
        }
        FakeConnection connection = new FakeConnection(guildId, channelId);
        connections.add(connection);
        return connection;
    }

    public void failNextJoins(int count) {
        failJoins.set(count);
    }

    /**
     * Blocks joins until the returned latch is released.
     */
    public CountDownLatch holdJoins() {
        joinGate = new CountDownLatch(1);
        return joinGate;
    }

    public List<FakeConnection> connections() {
        return connections;
    }

    public FakeConnection lastConnection() {
        return connections.get(connections.size() - 1);
    }

    public static final class FakeConnection implements VoiceConnection {

        private final String guildId;
        private final String channelId;
        private final List<Track> played = new CopyOnWriteArrayList<>();
        private volatile CompletableFuture<TrackEnd> current;
        private volatile boolean paused;
        private volatile boolean left;
        private volatile int volume = -1;
        private volatile int listeners = 1;
        private volatile boolean failPlayback;

        FakeConnection(String guildId, String channelId) {
            this.guildId = guildId;
            this.channelId = channelId;
        }

        @Override
        public String getChannelId() {
            return channelId;
        }

        @Override
        public String getGuildName() {
            return "Guild " + guildId;
        }

        @Override
        public int getListenerCount() {
            return listeners;
        }

        @Override
        public synchronized CompletableFuture<TrackEnd> play(Track track, int volume) {
            if (failPlayback) {
                throw new TransportException("Stream refused");
            }
            if (current != null) {
                current.complete(TrackEnd.STOPPED);
            }
            played.add(track);
            this.volume = volume;
            paused = false;
            current = new CompletableFuture<>();
            return current;
        }

        @Override
        public void pause() {
            paused = true;
        }

        @Override
        public void resume() {
            paused = false;
        }

        @Override
        public void setVolume(int volume) {
            this.volume = volume;
        }

        @Override
        public synchronized void stopTrack() {
            if (current != null) {
                current.complete(TrackEnd.STOPPED);
            }
        }

        @Override
        public void leave() {
            stopTrack();
            left = true;
        }

        public void finishCurrent() {
            current.complete(TrackEnd.FINISHED);
        }

        public void breakCurrent() {
            current.complete(TrackEnd.TRANSPORT_ERROR);
        }

        public List<Track> played() {
            return played;
        }

        public boolean isPaused() {
            return paused;
        }

        public boolean hasLeft() {
            return left;
        }

        public int volume() {
            return volume;
        }

        public void setListeners(int listeners) {
            this.listeners = listeners;
        }

        public void failPlayback() {
            failPlayback = true;
        }
    }
}
