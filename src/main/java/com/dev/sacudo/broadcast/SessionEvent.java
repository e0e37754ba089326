package com.dev.sacudo.broadcast;

/**
 * Change notification for one guild. Delivered best-effort; dashboards reconcile by pulling the guild state.
 */
public interface SessionEvent {

    String guildId();

    Kind kind();

    enum Kind {
        SONG_UPDATE("song_update"),
        QUEUE_UPDATE("queue_update");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }
}
