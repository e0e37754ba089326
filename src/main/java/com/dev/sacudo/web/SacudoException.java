package com.dev.sacudo.web;

/**
 * Base class for failures reported back to whoever issued a command against a guild session.
 */
public abstract class SacudoException extends RuntimeException {

    protected SacudoException(String message) {
        super(message);
    }

    protected SacudoException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable, machine-readable error kind exposed to API clients.
     */
    public abstract String getKind();
}
