package com.dev.sacudo.web;

/**
 * Voice join, playback start or leave failed at the transport level.
 */
public class TransportException extends SacudoException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getKind() {
        return "TRANSPORT_ERROR";
    }
}
