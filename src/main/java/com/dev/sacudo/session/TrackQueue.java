package com.dev.sacudo.session;

import com.dev.sacudo.domain.DedupPolicy;
import com.dev.sacudo.domain.Track;
import com.dev.sacudo.web.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered tracks waiting to be played. Positions are 0-based.
 *
 * <p>Not thread-safe: only the owning session's serialized context touches it.
 */
public class TrackQueue {

    private final List<Track> tracks = new ArrayList<>();
    private final DedupPolicy dedupPolicy;

    public TrackQueue(DedupPolicy dedupPolicy) {
        this.dedupPolicy = dedupPolicy;
    }

    public int enqueue(Track track) {
        return enqueue(track, null);
    }

    /**
     * Appends {@code track} and returns its position.
     *
     * @param current the track currently playing, taken into account by {@link DedupPolicy#REJECT}
     * @throws InvalidInputException if the policy rejects the track as a duplicate
     */
    public int enqueue(Track track, Track current) {
        switch (dedupPolicy) {
            case REJECT -> {
                boolean playing = current != null && current.getSourceUrl().equals(track.getSourceUrl());
                if (playing || containsSource(track.getSourceUrl())) {
                    throw new InvalidInputException("Already queued: " + track.getTitle());
                }
            }
            case RELOCATE -> tracks.removeIf(queued -> queued.getSourceUrl().equals(track.getSourceUrl()));
            case NONE -> {
            }
        }
        tracks.add(track);
        return tracks.size() - 1;
    }

    public Track remove(int index) {
        if (index < 0 || index >= tracks.size()) {
            throw new InvalidInputException("Queue index " + index + " is out of range (queue length "
                    + tracks.size() + ")");
        }
        return tracks.remove(index);
    }

    public Optional<Track> poll() {
        return tracks.isEmpty() ? Optional.empty() : Optional.of(tracks.remove(0));
    }

    public void clear() {
        tracks.clear();
    }

    public int size() {
        return tracks.size();
    }

    public boolean isEmpty() {
        return tracks.isEmpty();
    }

    public boolean containsSource(String sourceUrl) {
        return tracks.stream().anyMatch(track -> track.getSourceUrl().equals(sourceUrl));
    }

    public List<Track> snapshot() {
        return List.copyOf(tracks);
    }
}
