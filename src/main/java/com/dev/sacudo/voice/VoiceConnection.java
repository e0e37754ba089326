package com.dev.sacudo.voice;

import com.dev.sacudo.domain.Track;
import com.dev.sacudo.web.TransportException;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to one joined voice channel. Methods are invoked from the owning session's serialized context only.
 */
public interface VoiceConnection {

    String getChannelId();

    /**
     * Display name of the guild the channel belongs to, if the transport knows it.
     */
    String getGuildName();

    /**
     * Members in the channel, not counting the bot itself.
     */
    int getListenerCount();

    /**
     * Starts streaming {@code track}, replacing whatever was playing. The returned future completes exactly
     * once when this track stops being sent, with the reason it stopped.
     *
     * @throws TransportException if the stream cannot be started
     */
    CompletableFuture<TrackEnd> play(Track track, int volume);

    void pause();

    void resume();

    void setVolume(int volume);

    /**
     * Stops the current track; its completion future finishes with {@link TrackEnd#STOPPED}.
     */
    void stopTrack();

    void leave();
}
