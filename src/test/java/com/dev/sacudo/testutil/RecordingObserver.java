package com.dev.sacudo.testutil;

import com.dev.sacudo.broadcast.SessionEvent;
import com.dev.sacudo.broadcast.SessionObserver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingObserver implements SessionObserver {

    private final List<SessionEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(SessionEvent event) {
        events.add(event);
    }

    public List<SessionEvent> events() {
        return events;
    }

    public long count(SessionEvent.Kind kind) {
        return events.stream().filter(event -> event.kind() == kind).count();
    }

    public void clear() {
        events.clear();
    }
}
