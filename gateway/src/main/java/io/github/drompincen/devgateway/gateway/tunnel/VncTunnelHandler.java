package io.github.drompincen.devgateway.gateway.tunnel;

import io.github.drompincen.devgateway.gateway.config.GatewayProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Relays a browser VNC client to the local RFB server over TCP, websockify style: binary frames
 * are written to the socket as-is and socket reads come back as binary frames.
 */
@Component
public class VncTunnelHandler extends AbstractTunnelHandler {

    private static final int READ_BUFFER = 64 * 1024;

    private final String host;
    private final int port;
    private final int connectTimeoutMs;

    public VncTunnelHandler(GatewayProperties properties) {
        GatewayProperties.Desktop desktop = properties.getDesktop();
        this.host = desktop.getHost();
        this.port = desktop.getPort();
        this.connectTimeoutMs = (int) desktop.getProbeTimeout().toMillis();
    }

    @Override
    protected String name() {
        return "vnc";
    }

    @Override
    protected Upstream openUpstream(WebSocketSession downstream) throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        SocketUpstream upstream = new SocketUpstream(socket, downstream);
        Thread reader = new Thread(upstream::pump, "vnc-reader-" + downstream.getId());
        reader.setDaemon(true);
        reader.start();
        return upstream;
    }

    private final class SocketUpstream implements Upstream {

        private final Socket socket;
        private final OutputStream out;
        private final WebSocketSession downstream;
        private volatile boolean closed;

        SocketUpstream(Socket socket, WebSocketSession downstream) throws IOException {
            this.socket = socket;
            this.out = socket.getOutputStream();
            this.downstream = downstream;
        }

        @Override
        public void send(WebSocketMessage<?> message) throws IOException {
            byte[] bytes;
            if (message instanceof BinaryMessage binary) {
                ByteBuffer payload = binary.getPayload();
                bytes = new byte[payload.remaining()];
                payload.get(bytes);
            } else if (message instanceof TextMessage text) {
                bytes = text.getPayload().getBytes(StandardCharsets.UTF_8);
            } else {
                return;
            }
            synchronized (out) {
                out.write(bytes);
                out.flush();
            }
        }

        void pump() {
            byte[] buffer = new byte[READ_BUFFER];
            try (InputStream in = socket.getInputStream()) {
                int n;
                while ((n = in.read(buffer)) != -1) {
                    if (!downstream.isOpen()) break;
                    downstream.sendMessage(new BinaryMessage(Arrays.copyOf(buffer, n)));
                }
                if (!closed) {
                    log.info("vnc tunnel: server closed the connection for {}", downstream.getId());
                    closeDownstream(downstream, CloseStatus.NORMAL);
                }
            } catch (IOException e) {
                if (!closed) {
                    log.warn("vnc tunnel: relay failed for {}: {}", downstream.getId(), e.getMessage());
                    closeDownstream(downstream, UPSTREAM_UNAVAILABLE);
                }
            }
        }

        @Override
        public void close() {
            closed = true;
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("vnc tunnel: socket close failed: {}", e.getMessage());
            }
        }
    }
}
