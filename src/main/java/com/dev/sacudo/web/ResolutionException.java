package com.dev.sacudo.web;

import com.dev.sacudo.domain.ResolutionFailure;

public class ResolutionException extends SacudoException {

    private final ResolutionFailure failure;

    public ResolutionException(ResolutionFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ResolutionException(ResolutionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public ResolutionFailure getFailure() {
        return failure;
    }

    @Override
    public String getKind() {
        return failure.name();
    }
}
