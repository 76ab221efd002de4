package io.github.drompincen.devgateway.runtime.channel;

import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RoomRegistryTest {

    private final RoomRegistry rooms = new RoomRegistry();

    @Test
    void broadcastReachesEveryMemberOfTheRoomOnly() {
        RecordingConnection a = new RecordingConnection("a");
        RecordingConnection b = new RecordingConnection("b");
        RecordingConnection other = new RecordingConnection("o");
        rooms.join("chat:s1", a);
        rooms.join("chat:s1", b);
        rooms.join("chat:s2", other);

        rooms.broadcast("chat:s1", WsMessage.of("chat:event", Map.of()));

        assertThat(a.sent()).hasSize(1);
        assertThat(b.sent()).hasSize(1);
        assertThat(other.sent()).isEmpty();
    }

    @Test
    void joiningTwiceKeepsOneMembership() {
        RecordingConnection a = new RecordingConnection("a");
        rooms.join("r", a);
        rooms.join("r", a);

        assertThat(rooms.members("r")).hasSize(1);
    }

    @Test
    void leaveAllEmptiesEveryRoom() {
        RecordingConnection a = new RecordingConnection("a");
        rooms.join("r1", a);
        rooms.join("r2", a);

        rooms.leaveAll(a);

        assertThat(rooms.members("r1")).isEmpty();
        assertThat(rooms.isMember("r2", a)).isFalse();
    }

    @Test
    void closeDropsEveryMember() {
        RecordingConnection a = new RecordingConnection("a");
        RecordingConnection b = new RecordingConnection("b");
        rooms.join("terminal:t1", a);
        rooms.join("terminal:t1", b);

        rooms.close("terminal:t1");
        rooms.broadcast("terminal:t1", WsMessage.of("terminal:data", Map.of()));

        assertThat(rooms.members("terminal:t1")).isEmpty();
        assertThat(a.sent()).isEmpty();
        assertThat(b.sent()).isEmpty();
    }
}
