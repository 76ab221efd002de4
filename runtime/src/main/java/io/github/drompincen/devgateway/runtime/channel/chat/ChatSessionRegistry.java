package io.github.drompincen.devgateway.runtime.channel.chat;

import io.github.drompincen.devgateway.runtime.channel.ChannelException;
import io.github.drompincen.devgateway.runtime.channel.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory chat sessions by id.
 */
public class ChatSessionRegistry {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    public Optional<ChatSession> find(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * Installs {@code session} under its id, replacing a finished session with the same id.
     *
     * @throws ChannelException ALREADY_RUNNING if the current holder of the id is still running
     */
    public void register(ChatSession session) {
        sessions.compute(session.getId(), (id, existing) -> {
            if (existing != null && existing.isRunning()) {
                throw new ChannelException(ErrorCode.ALREADY_RUNNING, "Session is already running: " + id, id);
            }
            return session;
        });
    }

    /** Removes the mapping only if it still points at {@code session}. */
    public boolean evict(ChatSession session) {
        return sessions.remove(session.getId(), session);
    }

    public List<ChatSession> all() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
