package io.github.drompincen.devgateway.gateway.tunnel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raw byte relay between a client WebSocket and one upstream per client. Frames are forwarded
 * without interpretation; either side closing closes the other.
 */
public abstract class AbstractTunnelHandler extends AbstractWebSocketHandler {

    /** 1011, sent when the upstream cannot be reached or fails mid-stream. */
    public static final CloseStatus UPSTREAM_UNAVAILABLE = CloseStatus.SERVER_ERROR.withReason("Upstream unavailable");

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final Map<String, Upstream> upstreams = new ConcurrentHashMap<>();

    /** One upstream connection, owned by the tunnel for the lifetime of the client session. */
    protected interface Upstream {

        void send(WebSocketMessage<?> message) throws IOException;

        void close();
    }

    protected abstract String name();

    protected abstract Upstream openUpstream(WebSocketSession downstream) throws IOException;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Upstream upstream;
        try {
            upstream = openUpstream(session);
        } catch (IOException e) {
            log.warn("{} tunnel: upstream unavailable for {}: {}", name(), session.getId(), e.getMessage());
            session.close(UPSTREAM_UNAVAILABLE);
            return;
        }
        upstreams.put(session.getId(), upstream);
        log.info("{} tunnel opened for {}", name(), session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        forward(session, message);
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) throws Exception {
        forward(session, message);
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
    }

    private void forward(WebSocketSession session, WebSocketMessage<?> message) throws IOException {
        Upstream upstream = upstreams.get(session.getId());
        if (upstream == null) return;
        try {
            upstream.send(message);
        } catch (IOException e) {
            log.warn("{} tunnel: write to upstream failed for {}: {}", name(), session.getId(), e.getMessage());
            closeDownstream(session, UPSTREAM_UNAVAILABLE);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("{} tunnel transport error on {}: {}", name(), session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Upstream upstream = upstreams.remove(session.getId());
        if (upstream != null) {
            upstream.close();
            log.info("{} tunnel closed for {} ({})", name(), session.getId(), status.getCode());
        }
    }

    /** Closes the client side; safe to call repeatedly and from upstream threads. */
    protected void closeDownstream(WebSocketSession session, CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("{} tunnel: close of {} failed: {}", name(), session.getId(), e.getMessage());
        }
    }

    int openTunnels() {
        return upstreams.size();
    }
}
