package com.dev.sacudo.voice;

import com.dev.sacudo.web.TransportException;

/**
 * Entry point into the chat platform's voice layer.
 */
public interface VoiceTransport {

    /**
     * Connects to a voice channel. May block for the duration of the platform handshake; callers bound it
     * with their own timeout.
     *
     * @throws TransportException if the channel cannot be joined
     */
    VoiceConnection join(String guildId, String channelId);
}
