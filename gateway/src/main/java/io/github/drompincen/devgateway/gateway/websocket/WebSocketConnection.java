package io.github.drompincen.devgateway.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import io.github.drompincen.devgateway.runtime.channel.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link Connection} over a Spring {@link WebSocketSession}. The session is expected to be a
 * {@code ConcurrentWebSocketSessionDecorator} so sends from agent, reader and watcher threads
 * are serialized.
 */
public class WebSocketConnection implements Connection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;

    public WebSocketConnection(WebSocketSession session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(WsMessage message) {
        if (!session.isOpen()) return;
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize '{}' frame", message.event(), e);
            return;
        }
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send '{}' to {}: {}", message.event(), session.getId(), e.getMessage());
        }
    }
}
