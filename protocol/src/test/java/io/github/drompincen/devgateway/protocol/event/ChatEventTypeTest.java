package io.github.drompincen.devgateway.protocol.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatEventTypeTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void coreEventTypesUseSnakeCaseWireNames() {
        assertThat(ChatEventType.INIT.wireName()).isEqualTo("init");
        assertThat(ChatEventType.THINKING_START.wireName()).isEqualTo("thinking_start");
        assertThat(ChatEventType.TOOL_RESULT.wireName()).isEqualTo("tool_result");
        assertThat(ChatEventType.BLOCK_STOP.wireName()).isEqualTo("block_stop");
    }

    @Test
    void fromWireRejectsUnknownType() {
        assertThatThrownBy(() -> ChatEventType.fromWire("nope"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void chatEventSerializesTypeAsWireName() throws Exception {
        ChatEvent event = ChatEvent.of(ChatEventType.TOOL_START, new TextNode("x"));

        String json = mapper.writeValueAsString(event);
        ChatEvent back = mapper.readValue(json, ChatEvent.class);

        assertThat(json).contains("\"type\":\"tool_start\"");
        assertThat(back.type()).isEqualTo(ChatEventType.TOOL_START);
    }
}
