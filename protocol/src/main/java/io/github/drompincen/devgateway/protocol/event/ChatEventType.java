package io.github.drompincen.devgateway.protocol.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatEventType {
    USER("user"),
    INIT("init"),
    TEXT("text"),
    THINKING("thinking"),
    THINKING_START("thinking_start"),
    SIGNATURE("signature"),
    TOOL_START("tool_start"),
    TOOL_INPUT("tool_input"),
    TOOL_RESULT("tool_result"),
    TOOL_PROGRESS("tool_progress"),
    BLOCK_STOP("block_stop"),
    MESSAGE_START("message_start"),
    MESSAGE_DELTA("message_delta"),
    MESSAGE_STOP("message_stop"),
    STATUS("status"),
    HOOK_RESPONSE("hook_response"),
    AUTH_STATUS("auth_status"),
    RESULT("result"),
    ERROR("error");

    private final String wireName;

    ChatEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ChatEventType fromWire(String value) {
        for (ChatEventType t : values()) {
            if (t.wireName.equals(value)) return t;
        }
        throw new IllegalArgumentException("Unknown chat event type: " + value);
    }
}
