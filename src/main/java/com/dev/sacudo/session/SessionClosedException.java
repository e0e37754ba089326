package com.dev.sacudo.session;

/**
 * A command reached a session after it left voice and was dropped from the registry.
 */
public class SessionClosedException extends IllegalStateException {

    public SessionClosedException(String guildId) {
        super("Session for guild " + guildId + " is closed");
    }
}
