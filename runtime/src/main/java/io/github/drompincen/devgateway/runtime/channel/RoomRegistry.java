package io.github.drompincen.devgateway.runtime.channel;

import io.github.drompincen.devgateway.protocol.ws.WsMessage;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Room name to member connections. Empty rooms are removed.
 */
public class RoomRegistry {

    private final Map<String, Set<Connection>> rooms = new ConcurrentHashMap<>();

    public void join(String room, Connection connection) {
        rooms.computeIfAbsent(room, k -> new CopyOnWriteArraySet<>()).add(connection);
    }

    public void leave(String room, Connection connection) {
        rooms.computeIfPresent(room, (k, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
    }

    public void leaveAll(Connection connection) {
        for (String room : rooms.keySet()) {
            leave(room, connection);
        }
    }

    public void close(String room) {
        rooms.remove(room);
    }

    public boolean isMember(String room, Connection connection) {
        Set<Connection> members = rooms.get(room);
        return members != null && members.contains(connection);
    }

    public Set<Connection> members(String room) {
        Set<Connection> members = rooms.get(room);
        return members != null ? Set.copyOf(members) : Set.of();
    }

    public void broadcast(String room, WsMessage message) {
        Set<Connection> members = rooms.get(room);
        if (members == null) return;
        for (Connection c : members) {
            if (c.isOpen()) c.send(message);
        }
    }
}
