package com.dev.sacudo.broadcast;

@FunctionalInterface
public interface SessionObserver {

    void onEvent(SessionEvent event);
}
