package io.github.drompincen.devgateway.gateway.tunnel;

import io.github.drompincen.devgateway.gateway.config.GatewayProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VncTunnelHandlerTest {

    @Mock private WebSocketSession wsSession;

    private ServerSocket rfbServer;
    private GatewayProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        rfbServer = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        properties = new GatewayProperties();
        properties.getDesktop().setHost("127.0.0.1");
        properties.getDesktop().setPort(rfbServer.getLocalPort());
        properties.getDesktop().setProbeTimeout(Duration.ofSeconds(2));
        when(wsSession.getId()).thenReturn("v1");
    }

    @AfterEach
    void tearDown() throws Exception {
        rfbServer.close();
    }

    @Test
    void relaysBytesInBothDirections() throws Exception {
        when(wsSession.isOpen()).thenReturn(true);
        var handler = new VncTunnelHandler(properties);

        handler.afterConnectionEstablished(wsSession);
        try (Socket upstream = rfbServer.accept()) {
            upstream.setSoTimeout(5000);
            assertThat(handler.openTunnels()).isEqualTo(1);

            handler.handleMessage(wsSession, new BinaryMessage("RFB".getBytes(StandardCharsets.US_ASCII)));
            InputStream in = upstream.getInputStream();
            byte[] received = in.readNBytes(3);
            assertThat(new String(received, StandardCharsets.US_ASCII)).isEqualTo("RFB");

            OutputStream out = upstream.getOutputStream();
            out.write("RFB 003.008\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();

            ArgumentCaptor<BinaryMessage> captor = ArgumentCaptor.forClass(BinaryMessage.class);
            verify(wsSession, timeout(5000)).sendMessage(captor.capture());
            byte[] payload = new byte[captor.getValue().getPayloadLength()];
            captor.getValue().getPayload().get(payload);
            assertThat(new String(payload, StandardCharsets.US_ASCII)).isEqualTo("RFB 003.008\n");
        }

        verify(wsSession, timeout(5000)).close(CloseStatus.NORMAL);
    }

    @Test
    void clientCloseReleasesUpstream() throws Exception {
        var handler = new VncTunnelHandler(properties);

        handler.afterConnectionEstablished(wsSession);
        try (Socket upstream = rfbServer.accept()) {
            upstream.setSoTimeout(5000);

            handler.afterConnectionClosed(wsSession, CloseStatus.GOING_AWAY);

            assertThat(handler.openTunnels()).isZero();
            assertThat(upstream.getInputStream().read()).isEqualTo(-1);
        }
    }

    @Test
    void unreachableServerClosesClientWithServerError() throws Exception {
        int port = rfbServer.getLocalPort();
        rfbServer.close();
        properties.getDesktop().setPort(port);
        var handler = new VncTunnelHandler(properties);

        handler.afterConnectionEstablished(wsSession);

        verify(wsSession).close(AbstractTunnelHandler.UPSTREAM_UNAVAILABLE);
        assertThat(handler.openTunnels()).isZero();
    }
}
