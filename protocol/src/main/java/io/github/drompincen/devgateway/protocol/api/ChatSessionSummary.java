package io.github.drompincen.devgateway.protocol.api;

import java.time.Instant;

public record ChatSessionSummary(
        String id,
        SessionState state,
        Instant startedAt,
        Instant endedAt,
        String model,
        String title,
        String source
) {
    public static final String SOURCE_GATEWAY = "gateway";
    public static final String SOURCE_TRANSCRIPT = "transcript";
}
