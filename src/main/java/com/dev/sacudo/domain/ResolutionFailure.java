package com.dev.sacudo.domain;

public enum ResolutionFailure {
    NOT_FOUND(false),
    AUTH_REQUIRED(false),
    REGION_BLOCKED(false),
    RATE_LIMITED(true),
    TIMEOUT(true);

    private final boolean retryable;

    ResolutionFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
