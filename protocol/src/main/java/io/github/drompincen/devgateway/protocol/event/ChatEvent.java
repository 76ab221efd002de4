package io.github.drompincen.devgateway.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;

/**
 * One atomic unit of agent output. Events are append-only and ordered by emission
 * within a session; the buffered sequence is the session's source of truth.
 */
public record ChatEvent(
        ChatEventType type,
        JsonNode data,
        Instant timestamp
) {
    public static ChatEvent of(ChatEventType type, JsonNode data) {
        return new ChatEvent(type, data != null ? data : JsonNodeFactory.instance.nullNode(), Instant.now());
    }

    public static ChatEvent text(ChatEventType type, String text) {
        return of(type, new TextNode(text));
    }
}
