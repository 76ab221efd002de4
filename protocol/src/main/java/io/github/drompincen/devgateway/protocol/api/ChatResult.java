package io.github.drompincen.devgateway.protocol.api;

/**
 * Aggregate usage for one agent run. Fields are null when the agent did not report them.
 */
public record ChatResult(
        Double costUsd,
        Integer turns,
        Long durationMs,
        Long inputTokens,
        Long outputTokens
) {
    public static ChatResult ofDuration(long durationMs) {
        return new ChatResult(null, null, durationMs, null, null);
    }

    public ChatResult withDuration(long durationMs) {
        return new ChatResult(costUsd, turns, durationMs, inputTokens, outputTokens);
    }
}
