package io.github.drompincen.devgateway.runtime.channel.terminal;

import java.time.Duration;

public record TerminalSettings(
        int maxSessions,
        int scrollbackChars,
        Duration idleTimeout,
        Duration sweepInterval,
        String shell,
        String defaultCwd,
        int cols,
        int rows
) {}
