package io.github.drompincen.devgateway.runtime.channel.chat;

import io.github.drompincen.devgateway.protocol.event.ChatEvent;
import io.github.drompincen.devgateway.protocol.event.ChatEventType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRingBufferTest {

    private static ChatEvent text(int i) {
        return ChatEvent.text(ChatEventType.TEXT, "t" + i);
    }

    private static List<String> texts(List<ChatEvent> events) {
        return events.stream().map(e -> e.data().asText()).toList();
    }

    @Test
    void keepsEventsInAppendOrder() {
        EventRingBuffer buffer = new EventRingBuffer(5);
        for (int i = 0; i < 3; i++) buffer.append(text(i));

        assertThat(texts(buffer.snapshot())).containsExactly("t0", "t1", "t2");
    }

    @Test
    void fullBufferDropsTheOldestTenth() {
        EventRingBuffer buffer = new EventRingBuffer(20);
        for (int i = 0; i < 20; i++) buffer.append(text(i));

        buffer.append(text(20));

        assertThat(buffer.size()).isEqualTo(19);
        assertThat(texts(buffer.snapshot())).startsWith("t2", "t3").endsWith("t20");
    }

    @Test
    void sizeNeverExceedsCapacity() {
        EventRingBuffer buffer = new EventRingBuffer(5000);
        for (int i = 0; i < 12_000; i++) {
            buffer.append(text(i));
            assertThat(buffer.size()).isLessThanOrEqualTo(5000);
        }
        assertThat(texts(buffer.tail(1))).containsExactly("t11999");
    }

    @Test
    void smallBufferDropsAtLeastOne() {
        EventRingBuffer buffer = new EventRingBuffer(3);
        for (int i = 0; i < 4; i++) buffer.append(text(i));

        assertThat(texts(buffer.snapshot())).containsExactly("t1", "t2", "t3");
    }

    @Test
    void tailReturnsMostRecentOldestFirst() {
        EventRingBuffer buffer = new EventRingBuffer(10);
        for (int i = 0; i < 6; i++) buffer.append(text(i));

        assertThat(texts(buffer.tail(3))).containsExactly("t3", "t4", "t5");
        assertThat(buffer.tail(100)).hasSize(6);
    }

    @Test
    void snapshotIsDetached() {
        EventRingBuffer buffer = new EventRingBuffer(10);
        buffer.append(text(0));
        List<ChatEvent> snapshot = buffer.snapshot();

        buffer.append(text(1));

        assertThat(snapshot).hasSize(1);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new EventRingBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
