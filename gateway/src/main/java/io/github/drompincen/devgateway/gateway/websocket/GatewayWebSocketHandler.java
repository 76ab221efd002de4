package io.github.drompincen.devgateway.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.devgateway.protocol.ws.ClientMessage;
import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import io.github.drompincen.devgateway.runtime.channel.ChannelManager;
import io.github.drompincen.devgateway.runtime.channel.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The message-framed endpoint. Every frame is handed to the {@link ChannelManager}; this class
 * only owns JSON parsing and the mapping from transport sessions to connections.
 */
@Component
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayWebSocketHandler.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int SEND_BUFFER_LIMIT = 4 * 1024 * 1024;

    private final ChannelManager channelManager;
    private final ObjectMapper objectMapper;
    private final Map<String, WebSocketConnection> connections = new ConcurrentHashMap<>();

    public GatewayWebSocketHandler(ChannelManager channelManager, ObjectMapper objectMapper) {
        this.channelManager = channelManager;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var decorated = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        var connection = new WebSocketConnection(decorated, objectMapper);
        connections.put(session.getId(), connection);
        channelManager.onConnect(connection);

        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("channels", channelManager.getChannelNames());
        welcome.put("connectionId", connection.id());
        connection.send(WsMessage.of(WsMessage.WELCOME, welcome));
        log.info("Connection {} opened from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketConnection connection = connections.get(session.getId());
        if (connection == null) return;

        ClientMessage frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed frame from {}: {}", session.getId(), e.getOriginalMessage());
            connection.send(WsMessage.error(null, null, ErrorCode.INVALID_REQUEST.name(),
                    "Malformed message", null));
            return;
        }
        channelManager.handle(connection, frame);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketConnection connection = connections.remove(session.getId());
        if (connection != null) {
            channelManager.onDisconnect(connection);
        }
        log.info("Connection {} closed ({})", session.getId(), status.getCode());
    }

    int openConnections() {
        return connections.size();
    }
}
