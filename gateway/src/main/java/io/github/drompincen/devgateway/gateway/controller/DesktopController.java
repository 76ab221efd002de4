package io.github.drompincen.devgateway.gateway.controller;

import io.github.drompincen.devgateway.protocol.api.DesktopStatus;
import io.github.drompincen.devgateway.runtime.desktop.DesktopServerManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/vnc")
public class DesktopController {

    private final DesktopServerManager desktop;

    public DesktopController(DesktopServerManager desktop) {
        this.desktop = desktop;
    }

    @GetMapping("/status")
    public ResponseEntity<DesktopStatus> status() {
        return ResponseEntity.ok(desktop.status());
    }

    /** Blocks until the server answers on its port or the start attempts run out. */
    @PostMapping("/start")
    public ResponseEntity<DesktopStatus> start() {
        DesktopStatus result = desktop.ensureRunning();
        if (result.running()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }
}
