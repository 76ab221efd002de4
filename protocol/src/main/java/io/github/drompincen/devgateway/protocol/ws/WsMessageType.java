package io.github.drompincen.devgateway.protocol.ws;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Frame types a client may send on the message-framed endpoint.
 */
public enum WsMessageType {
    SUBSCRIBE,
    UNSUBSCRIBE,
    MESSAGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static WsMessageType fromWire(String value) {
        if (value == null) return null;
        for (WsMessageType t : values()) {
            if (t.name().equalsIgnoreCase(value)) return t;
        }
        return null;
    }
}
