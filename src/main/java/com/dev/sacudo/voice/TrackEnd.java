package com.dev.sacudo.voice;

/**
 * Why the transport stopped sending a track.
 */
public enum TrackEnd {
    /** The stream played to its end. */
    FINISHED,
    /** Playback was stopped through the connection, e.g. by skip, stop or leave. */
    STOPPED,
    /** The voice connection or the stream broke mid-track. */
    TRANSPORT_ERROR
}
