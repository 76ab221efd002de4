package io.github.drompincen.devgateway.runtime.channel;

import io.github.drompincen.devgateway.protocol.ws.ClientMessage;
import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelManagerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RoomRegistry rooms;
    private ChannelManager manager;
    private EchoChannel echo;
    private RecordingConnection conn;

    @BeforeEach
    void setUp() {
        rooms = new RoomRegistry();
        manager = new ChannelManager(rooms);
        echo = new EchoChannel();
        manager.register(echo);
        manager.register(new ListenOnlyChannel());
        conn = new RecordingConnection("c1");
        manager.onConnect(conn);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> errorData(RecordingConnection c) {
        return (Map<String, Object>) c.last(WsMessage.ERROR).data();
    }

    @Test
    void subscribeJoinsSessionRoomAndDelegates() {
        ObjectNode params = objectMapper.createObjectNode().put("sessionId", "s1");

        manager.subscribe(conn, "echo", params);

        assertThat(echo.subscribedRooms).containsExactly("echo:s1");
        assertThat(rooms.isMember("echo:s1", conn)).isTrue();
    }

    @Test
    void subscribeWithoutParamsUsesChannelRoom() {
        manager.subscribe(conn, "echo", null);

        assertThat(rooms.isMember("echo", conn)).isTrue();
    }

    @Test
    void resubscribeToAnotherRoomLeavesThePreviousOne() {
        manager.subscribe(conn, "echo", objectMapper.createObjectNode().put("sessionId", "a"));
        manager.subscribe(conn, "echo", objectMapper.createObjectNode().put("sessionId", "b"));

        assertThat(rooms.isMember("echo:a", conn)).isFalse();
        assertThat(rooms.isMember("echo:b", conn)).isTrue();
        assertThat(echo.unsubscribedRooms).containsExactly("echo:a");
    }

    @Test
    void unknownChannelIsReportedNotThrown() {
        manager.subscribe(conn, "nope", null);

        Map<String, Object> error = errorData(conn);
        assertThat(error).containsEntry("code", "UNKNOWN_CHANNEL").containsEntry("channel", "nope");
    }

    @Test
    void messageToListenOnlyChannelIsUnsupported() {
        manager.dispatch(conn, "listen", "poke", null);

        assertThat(errorData(conn)).containsEntry("code", "UNSUPPORTED_MESSAGE").containsEntry("action", "poke");
    }

    @Test
    void channelExceptionCarriesCodeAndSession() {
        manager.dispatch(conn, "echo", "missing", null);

        assertThat(errorData(conn))
                .containsEntry("code", "SESSION_NOT_FOUND")
                .containsEntry("sessionId", "x");
    }

    @Test
    void unexpectedFailureIsReportedAsInternal() {
        manager.dispatch(conn, "echo", "explode", null);

        assertThat(errorData(conn)).containsEntry("code", "INTERNAL").containsEntry("message", "boom");
    }

    @Test
    void handleRoutesFramesByType() {
        manager.handle(conn, ClientMessage.subscribe("echo", null));
        manager.handle(conn, ClientMessage.message("echo", "ping", objectMapper.createObjectNode()));
        manager.handle(conn, ClientMessage.unsubscribe("echo"));

        assertThat(conn.eventNames()).containsExactly("echo:pong");
        assertThat(echo.unsubscribedRooms).containsExactly("echo");
        assertThat(rooms.isMember("echo", conn)).isFalse();
    }

    @Test
    void frameWithoutTypeIsInvalid() {
        manager.handle(conn, new ClientMessage(null, "echo", null, null, null));

        assertThat(errorData(conn)).containsEntry("code", "INVALID_REQUEST");
    }

    @Test
    void disconnectNotifiesSubscribedChannelsAndLeavesRooms() {
        manager.subscribe(conn, "echo", objectMapper.createObjectNode().put("sessionId", "s1"));

        manager.onDisconnect(conn);

        assertThat(echo.disconnected).containsExactly("c1");
        assertThat(rooms.members("echo:s1")).isEmpty();
        assertThat(manager.connectionCount()).isZero();
    }

    @Test
    void disconnectReachesChannelsTheConnectionOnlyMessaged() {
        manager.dispatch(conn, "echo", "ping", objectMapper.createObjectNode());

        manager.onDisconnect(conn);

        assertThat(echo.disconnected).containsExactly("c1");
    }

    @Test
    void broadcastAllReachesOnlyOpenConnections() {
        RecordingConnection closed = new RecordingConnection("c2");
        manager.onConnect(closed);
        closed.close();

        manager.broadcastAll(WsMessage.of("hello", Map.of()));

        assertThat(conn.eventNames()).containsExactly("hello");
        assertThat(closed.sent()).isEmpty();
    }

    @Test
    void duplicateRegistrationIsRejected() {
        assertThatThrownBy(() -> manager.register(new EchoChannel())).isInstanceOf(IllegalStateException.class);
        assertThat(manager.getChannelNames()).containsExactly("echo", "listen");
    }

    @Test
    void shutdownReachesEveryChannel() {
        manager.shutdown();

        assertThat(echo.shutdown).isTrue();
    }

    static class EchoChannel implements Channel {
        final List<String> subscribedRooms = new ArrayList<>();
        final List<String> unsubscribedRooms = new ArrayList<>();
        final List<String> disconnected = new ArrayList<>();
        boolean shutdown;
        ChannelContext context;

        @Override
        public String name() {
            return "echo";
        }

        @Override
        public void onRegister(ChannelContext context) {
            this.context = context;
        }

        @Override
        public void onSubscribe(Connection connection, String room, JsonNode params) {
            subscribedRooms.add(room);
            context.join(room, connection);
        }

        @Override
        public void onUnsubscribe(Connection connection, String room) {
            unsubscribedRooms.add(room);
        }

        @Override
        public void onMessage(Connection connection, String action, JsonNode payload) {
            switch (action) {
                case "ping" -> connection.send(WsMessage.of("echo:pong", Map.of()));
                case "missing" -> throw ChannelException.sessionNotFound("x");
                case "explode" -> throw new IllegalStateException("boom");
                default -> throw new ChannelException(ErrorCode.UNSUPPORTED_MESSAGE, action);
            }
        }

        @Override
        public void onDisconnect(Connection connection) {
            disconnected.add(connection.id());
        }

        @Override
        public void onShutdown() {
            shutdown = true;
        }
    }

    static class ListenOnlyChannel implements Channel {
        @Override
        public String name() {
            return "listen";
        }

        @Override
        public void onSubscribe(Connection connection, String room, JsonNode params) {
        }

        @Override
        public boolean supportsMessages() {
            return false;
        }
    }
}
