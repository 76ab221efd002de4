package io.github.drompincen.devgateway.runtime.channel.chat;

import io.github.drompincen.devgateway.protocol.event.ChatEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded event history. Appending to a full buffer first drops the oldest tenth (at least one
 * event), so the size never exceeds the capacity. Not thread safe; guarded by the owning session.
 */
public class EventRingBuffer {

    private final int capacity;
    private final int evictBatch;
    private final ArrayDeque<ChatEvent> events;

    public EventRingBuffer(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
        this.evictBatch = Math.max(1, capacity / 10);
        this.events = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(ChatEvent event) {
        if (events.size() >= capacity) {
            for (int i = 0; i < evictBatch && !events.isEmpty(); i++) {
                events.removeFirst();
            }
        }
        events.addLast(event);
    }

    public void appendAll(Collection<ChatEvent> history) {
        history.forEach(this::append);
    }

    public List<ChatEvent> snapshot() {
        return new ArrayList<>(events);
    }

    /** The most recent {@code n} events, oldest first. */
    public List<ChatEvent> tail(int n) {
        int skip = Math.max(0, events.size() - n);
        List<ChatEvent> out = new ArrayList<>(events.size() - skip);
        Iterator<ChatEvent> it = events.iterator();
        for (int i = 0; it.hasNext(); i++) {
            ChatEvent e = it.next();
            if (i >= skip) out.add(e);
        }
        return out;
    }

    public int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }
}
