package io.github.drompincen.devgateway.runtime.channel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A named subsystem reachable through subscribe, unsubscribe and message frames.
 *
 * <p>The {@link ChannelManager} computes and records the room for each subscription; joining
 * that room is left to {@link #onSubscribe} so a channel can do it atomically with sending its
 * initial state. {@link #onDisconnect} may be called for connections the channel has already
 * forgotten and must only drop subscriber state, never end a session.
 */
public interface Channel {

    String name();

    default void onRegister(ChannelContext context) {
    }

    /**
     * Room for a subscription: {@code name:sessionId} or {@code name:path} when the params
     * identify a sub-resource, otherwise the bare channel name.
     */
    default String roomFor(JsonNode params) {
        if (params != null) {
            if (params.hasNonNull("sessionId")) return name() + ":" + params.get("sessionId").asText();
            if (params.hasNonNull("path")) return name() + ":" + params.get("path").asText();
        }
        return name();
    }

    void onSubscribe(Connection connection, String room, JsonNode params);

    default void onUnsubscribe(Connection connection, String room) {
    }

    default boolean supportsMessages() {
        return true;
    }

    default void onMessage(Connection connection, String action, JsonNode payload) {
        throw new ChannelException(ErrorCode.UNSUPPORTED_MESSAGE, "Channel " + name() + " does not accept messages");
    }

    default void onDisconnect(Connection connection) {
    }

    default void onShutdown() {
    }
}
