package io.github.drompincen.devgateway.gateway.config;

import io.github.drompincen.devgateway.gateway.auth.AuthHandshakeInterceptor;
import io.github.drompincen.devgateway.gateway.tunnel.DevServerTunnelHandler;
import io.github.drompincen.devgateway.gateway.tunnel.VncTunnelHandler;
import io.github.drompincen.devgateway.gateway.websocket.GatewayWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String GATEWAY_PATH = "/ws";
    public static final String VNC_PATH = "/ws/vnc";

    private static final int MAX_MESSAGE_BYTES = 512 * 1024;

    private final GatewayWebSocketHandler gatewayHandler;
    private final VncTunnelHandler vncHandler;
    private final DevServerTunnelHandler devServerHandler;
    private final AuthHandshakeInterceptor authInterceptor;
    private final GatewayProperties properties;

    public WebSocketConfig(GatewayWebSocketHandler gatewayHandler,
                           VncTunnelHandler vncHandler,
                           DevServerTunnelHandler devServerHandler,
                           AuthHandshakeInterceptor authInterceptor,
                           GatewayProperties properties) {
        this.gatewayHandler = gatewayHandler;
        this.vncHandler = vncHandler;
        this.devServerHandler = devServerHandler;
        this.authInterceptor = authInterceptor;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(gatewayHandler, GATEWAY_PATH)
                .addInterceptors(authInterceptor)
                .setAllowedOrigins("*");
        registry.addHandler(vncHandler, VNC_PATH)
                .addInterceptors(authInterceptor)
                .setAllowedOrigins("*");
        registry.addHandler(devServerHandler, properties.getDevServer().getPath())
                .addInterceptors(authInterceptor)
                .setAllowedOrigins("*");
    }

    @Bean
    ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(MAX_MESSAGE_BYTES);
        container.setMaxBinaryMessageBufferSize(MAX_MESSAGE_BYTES);
        return container;
    }
}
