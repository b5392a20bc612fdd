package com.backtest.core.event;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Unbounded FIFO queue shared by all components of a single run.
 * Not thread-safe: a run is strictly single-threaded.
 */
public final class EventChannel {

    private final Deque<Event> queue = new ArrayDeque<>();

    public void put(Event event) {
        queue.addLast(Objects.requireNonNull(event, "event"));
    }

    public Optional<Event> poll() {
        return Optional.ofNullable(queue.pollFirst());
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }
}
