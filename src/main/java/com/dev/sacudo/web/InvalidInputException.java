package com.dev.sacudo.web;

/**
 * Malformed query or URL, out-of-range volume or queue index. Never retried.
 */
public class InvalidInputException extends SacudoException {

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public String getKind() {
        return "INPUT_ERROR";
    }
}
