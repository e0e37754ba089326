package com.dev.sacudo.domain;

/**
 * How a queue treats a track whose source URL is already queued.
 */
public enum DedupPolicy {
    /** Duplicates are queued like any other track. */
    NONE,
    /** The enqueue is rejected as invalid input. */
    REJECT,
    /** The earlier entry is dropped and the new one is appended at the tail. */
    RELOCATE
}
