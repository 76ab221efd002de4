package io.github.drompincen.devgateway.gateway.controller;

import io.github.drompincen.devgateway.runtime.channel.ChannelManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock private ChannelManager channelManager;

    private HealthController controller;

    @BeforeEach
    void setUp() {
        controller = new HealthController(channelManager);
    }

    @Test
    void reportsChannelsAndConnections() {
        when(channelManager.getChannelNames()).thenReturn(List.of("chat", "terminal", "files"));
        when(channelManager.connectionCount()).thenReturn(2);

        var response = controller.health();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody())
                .containsEntry("status", "ok")
                .containsEntry("channels", List.of("chat", "terminal", "files"))
                .containsEntry("connections", 2);
    }
}
