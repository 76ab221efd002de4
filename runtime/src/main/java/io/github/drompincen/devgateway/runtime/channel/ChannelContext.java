package io.github.drompincen.devgateway.runtime.channel;

import io.github.drompincen.devgateway.protocol.ws.WsMessage;

/**
 * Room addressing handed to a channel when it is registered. Channels reach connections only
 * through rooms, never by holding on to them.
 */
public interface ChannelContext {

    void join(String room, Connection connection);

    void leave(String room, Connection connection);

    boolean isMember(String room, Connection connection);

    void broadcast(String room, WsMessage message);

    /** Drops every member of the room, for rooms whose subject no longer exists. */
    void closeRoom(String room);

    /** Sends to every open connection, subscribed or not. */
    void broadcastAll(WsMessage message);
}
