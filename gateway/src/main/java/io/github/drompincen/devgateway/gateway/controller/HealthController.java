package io.github.drompincen.devgateway.gateway.controller;

import io.github.drompincen.devgateway.runtime.channel.ChannelManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ChannelManager channelManager;

    public HealthController(ChannelManager channelManager) {
        this.channelManager = channelManager;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("channels", channelManager.getChannelNames());
        body.put("connections", channelManager.connectionCount());
        return ResponseEntity.ok(body);
    }
}
