package io.github.drompincen.devgateway.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TerminalSessionSummary(
        String id,
        String title,
        String cwd,
        Instant createdAt,
        Instant lastActivityAt,
        @JsonProperty("isActive") boolean isActive,
        String preview,
        int cols,
        int rows
) {}
