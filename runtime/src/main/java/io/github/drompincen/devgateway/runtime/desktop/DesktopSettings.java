package io.github.drompincen.devgateway.runtime.desktop;

import java.nio.file.Path;
import java.time.Duration;

public record DesktopSettings(
        String host,
        int port,
        String display,
        String geometry,
        int depth,
        Duration probeTimeout,
        int startAttempts,
        Duration pollInterval,
        String serverCommand,
        Path sessionScript
) {}
