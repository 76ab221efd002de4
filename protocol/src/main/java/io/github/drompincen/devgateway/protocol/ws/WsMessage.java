package io.github.drompincen.devgateway.protocol.ws;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A server to client frame. {@code event} is either a bare name ({@code welcome}, {@code error})
 * or channel scoped ({@code chat:event}, {@code terminal:data}).
 */
public record WsMessage(
        String event,
        Object data,
        Instant ts
) {
    public static final String WELCOME = "welcome";
    public static final String ERROR = "error";

    public static WsMessage of(String event, Object data) {
        return new WsMessage(event, data, Instant.now());
    }

    public static WsMessage error(String channel, String action, String code, String message, String sessionId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("channel", channel);
        if (action != null) data.put("action", action);
        data.put("code", code);
        data.put("message", message);
        if (sessionId != null) data.put("sessionId", sessionId);
        return of(ERROR, data);
    }
}
