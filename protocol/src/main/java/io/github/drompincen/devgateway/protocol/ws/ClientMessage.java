package io.github.drompincen.devgateway.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A client to server frame: {@code {"type":"subscribe","channel":"chat","params":{...}}},
 * {@code {"type":"unsubscribe","channel":"chat"}} or
 * {@code {"type":"message","channel":"terminal","action":"input","payload":{...}}}.
 */
public record ClientMessage(
        WsMessageType type,
        String channel,
        String action,
        JsonNode params,
        JsonNode payload
) {
    public static ClientMessage subscribe(String channel, JsonNode params) {
        return new ClientMessage(WsMessageType.SUBSCRIBE, channel, null, params, null);
    }

    public static ClientMessage unsubscribe(String channel) {
        return new ClientMessage(WsMessageType.UNSUBSCRIBE, channel, null, null, null);
    }

    public static ClientMessage message(String channel, String action, JsonNode payload) {
        return new ClientMessage(WsMessageType.MESSAGE, channel, action, null, payload);
    }
}
