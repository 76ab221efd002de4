package io.github.drompincen.devgateway.runtime.channel;

import io.github.drompincen.devgateway.protocol.ws.ClientMessage;
import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pub/sub router between connections and channels. Every per-operation failure is caught here
 * and reported to the originating connection as an {@code error} frame.
 */
public class ChannelManager {

    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    private final Map<String, Channel> channels = new LinkedHashMap<>();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    /** connection id -> channel name -> room */
    private final Map<String, Map<String, String>> subscriptions = new ConcurrentHashMap<>();
    private final RoomRegistry rooms;
    private final ChannelContext context = new ManagerContext();

    public ChannelManager(RoomRegistry rooms) {
        this.rooms = rooms;
    }

    public ChannelManager(RoomRegistry rooms, List<Channel> channels) {
        this(rooms);
        channels.forEach(this::register);
    }

    public synchronized void register(Channel channel) {
        if (channels.containsKey(channel.name())) {
            throw new IllegalStateException("Channel already registered: " + channel.name());
        }
        channels.put(channel.name(), channel);
        channel.onRegister(context);
        log.info("Registered channel '{}'", channel.name());
    }

    public List<String> getChannelNames() {
        return new ArrayList<>(channels.keySet());
    }

    public int connectionCount() {
        return connections.size();
    }

    public void onConnect(Connection connection) {
        connections.put(connection.id(), connection);
        subscriptions.put(connection.id(), new ConcurrentHashMap<>());
        log.debug("Connection {} registered", connection.id());
    }

    public void handle(Connection connection, ClientMessage message) {
        if (message.type() == null || message.channel() == null || message.channel().isBlank()) {
            reportError(connection, message.channel(), message.action(),
                    ChannelException.invalidRequest("Frame needs a known type and a channel"));
            return;
        }
        switch (message.type()) {
            case SUBSCRIBE -> subscribe(connection, message.channel(), message.params());
            case UNSUBSCRIBE -> unsubscribe(connection, message.channel());
            case MESSAGE -> dispatch(connection, message.channel(), message.action(), message.payload());
        }
    }

    public void subscribe(Connection connection, String channelName, JsonNode params) {
        String room = null;
        try {
            Channel channel = require(channelName);
            room = channel.roomFor(params);
            String previous = subscriptionsOf(connection).put(channelName, room);
            if (previous != null && !previous.equals(room)) {
                rooms.leave(previous, connection);
                channel.onUnsubscribe(connection, previous);
            }
            log.debug("Connection {} subscribed to {}", connection.id(), room);
            channel.onSubscribe(connection, room, params);
        } catch (Exception e) {
            if (room != null) {
                subscriptionsOf(connection).remove(channelName, room);
                rooms.leave(room, connection);
            }
            reportError(connection, channelName, "subscribe", e);
        }
    }

    public void unsubscribe(Connection connection, String channelName) {
        try {
            Channel channel = require(channelName);
            String room = subscriptionsOf(connection).remove(channelName);
            if (room == null) return;
            rooms.leave(room, connection);
            channel.onUnsubscribe(connection, room);
            log.debug("Connection {} unsubscribed from {}", connection.id(), room);
        } catch (Exception e) {
            reportError(connection, channelName, "unsubscribe", e);
        }
    }

    public void dispatch(Connection connection, String channelName, String action, JsonNode payload) {
        try {
            Channel channel = require(channelName);
            if (!channel.supportsMessages()) {
                throw new ChannelException(ErrorCode.UNSUPPORTED_MESSAGE,
                        "Channel " + channelName + " does not accept messages");
            }
            if (action == null || action.isBlank()) {
                throw ChannelException.invalidRequest("Message frame has no action");
            }
            channel.onMessage(connection, action, payload);
        } catch (Exception e) {
            reportError(connection, channelName, action, e);
        }
    }

    /**
     * The single cleanup path for a closed transport. Every registered channel is told, since a
     * connection can hold channel state through messages alone without ever subscribing.
     */
    public void onDisconnect(Connection connection) {
        connections.remove(connection.id());
        Map<String, String> subs = subscriptions.remove(connection.id());
        rooms.leaveAll(connection);
        List<Channel> all;
        synchronized (this) {
            all = new ArrayList<>(channels.values());
        }
        for (Channel channel : all) {
            try {
                channel.onDisconnect(connection);
            } catch (RuntimeException e) {
                log.error("Channel '{}' failed to handle disconnect of {}", channel.name(), connection.id(), e);
            }
        }
        log.debug("Connection {} disconnected ({} subscriptions)", connection.id(), subs != null ? subs.size() : 0);
    }

    public void broadcastAll(WsMessage message) {
        for (Connection c : connections.values()) {
            if (c.isOpen()) c.send(message);
        }
    }

    public void shutdown() {
        List<Channel> all;
        synchronized (this) {
            all = new ArrayList<>(channels.values());
        }
        for (Channel channel : all) {
            try {
                channel.onShutdown();
            } catch (RuntimeException e) {
                log.error("Channel '{}' failed to shut down cleanly", channel.name(), e);
            }
        }
        log.info("Channel manager shut down");
    }

    private Channel require(String channelName) {
        Channel channel = channelName != null ? channels.get(channelName) : null;
        if (channel == null) {
            throw new ChannelException(ErrorCode.UNKNOWN_CHANNEL, "Unknown channel: " + channelName);
        }
        return channel;
    }

    private Map<String, String> subscriptionsOf(Connection connection) {
        return subscriptions.computeIfAbsent(connection.id(), k -> new ConcurrentHashMap<>());
    }

    private void reportError(Connection connection, String channelName, String action, Exception e) {
        String code;
        String sessionId = null;
        if (e instanceof ChannelException ce) {
            code = ce.getCode().name();
            sessionId = ce.getSessionId();
            log.debug("{} {} from {} failed: {} {}", channelName, action, connection.id(), code, e.getMessage());
        } else {
            code = ErrorCode.INTERNAL.name();
            log.error("Unexpected failure in {} {} from {}", channelName, action, connection.id(), e);
        }
        if (connection.isOpen()) {
            connection.send(WsMessage.error(channelName, action, code,
                    e.getMessage() != null ? e.getMessage() : code, sessionId));
        }
    }

    private final class ManagerContext implements ChannelContext {

        @Override
        public void join(String room, Connection connection) {
            rooms.join(room, connection);
        }

        @Override
        public void leave(String room, Connection connection) {
            rooms.leave(room, connection);
        }

        @Override
        public boolean isMember(String room, Connection connection) {
            return rooms.isMember(room, connection);
        }

        @Override
        public void broadcast(String room, WsMessage message) {
            rooms.broadcast(room, message);
        }

        @Override
        public void closeRoom(String room) {
            rooms.close(room);
        }

        @Override
        public void broadcastAll(WsMessage message) {
            ChannelManager.this.broadcastAll(message);
        }
    }
}
