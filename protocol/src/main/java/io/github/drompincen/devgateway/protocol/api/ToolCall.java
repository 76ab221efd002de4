package io.github.drompincen.devgateway.protocol.api;

public record ToolCall(
        String id,
        String name,
        String input,
        String output,
        String status
) {
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ERROR = "error";
}
