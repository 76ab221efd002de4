package io.github.drompincen.devgateway.gateway.tunnel;

import io.github.drompincen.devgateway.gateway.config.GatewayProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Forwards the dev server's hot-reload socket: each client connection opens a matching
 * WebSocket to the dev server on the same path and query, and frames flow both ways unchanged.
 */
@Component
public class DevServerTunnelHandler extends AbstractTunnelHandler {

    private static final long CONNECT_TIMEOUT_SECONDS = 5;

    private final WebSocketClient client;
    private final String host;
    private final int port;

    @Autowired
    public DevServerTunnelHandler(GatewayProperties properties) {
        this(properties, new StandardWebSocketClient());
    }

    DevServerTunnelHandler(GatewayProperties properties, WebSocketClient client) {
        this.client = client;
        this.host = properties.getDevServer().getHost();
        this.port = properties.getDevServer().getPort();
    }

    @Override
    protected String name() {
        return "dev-server";
    }

    URI upstreamUri(WebSocketSession downstream) {
        URI uri = downstream.getUri();
        String path = uri != null && uri.getRawPath() != null ? uri.getRawPath() : "/";
        String query = uri != null ? uri.getRawQuery() : null;
        return URI.create("ws://" + host + ":" + port + path + (query != null ? "?" + query : ""));
    }

    @Override
    protected Upstream openUpstream(WebSocketSession downstream) throws IOException {
        URI target = upstreamUri(downstream);
        WebSocketSession upstream;
        try {
            upstream = client.execute(new ReturnPath(downstream), new WebSocketHttpHeaders(), target)
                    .get(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Dev server handshake failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Dev server handshake timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to dev server", e);
        }
        return new Upstream() {
            @Override
            public void send(WebSocketMessage<?> message) throws IOException {
                upstream.sendMessage(message);
            }

            @Override
            public void close() {
                if (!upstream.isOpen()) return;
                try {
                    upstream.close();
                } catch (IOException e) {
                    log.debug("dev-server tunnel: upstream close failed: {}", e.getMessage());
                }
            }
        };
    }

    /** Upstream to client direction. */
    private final class ReturnPath extends AbstractWebSocketHandler {

        private final WebSocketSession downstream;

        ReturnPath(WebSocketSession downstream) {
            this.downstream = downstream;
        }

        @Override
        public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) throws Exception {
            if (downstream.isOpen()) {
                downstream.sendMessage(message);
            }
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.warn("dev-server tunnel: upstream error for {}: {}", downstream.getId(), exception.getMessage());
            closeDownstream(downstream, UPSTREAM_UNAVAILABLE);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closeDownstream(downstream, CloseStatus.NORMAL);
        }
    }
}
