package io.github.drompincen.devgateway.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DesktopStatus(
        boolean running,
        String message,
        Integer port,
        String display
) {
    public static DesktopStatus of(boolean running, String message) {
        return new DesktopStatus(running, message, null, null);
    }
}
