package io.github.drompincen.devgateway.runtime.agent;

import io.github.drompincen.devgateway.protocol.event.ChatEvent;
import io.github.drompincen.devgateway.protocol.event.ChatEventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps the agent CLI's {@code stream-json} messages to chat events. One instance per run:
 * it remembers the session id from the {@code init} message and whether partial messages are
 * being streamed, in which case the complete {@code assistant} messages that follow are skipped
 * so their text is not emitted twice.
 */
public class StreamJsonEventMapper {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private String sessionId;
    private boolean streaming;

    public String sessionId() {
        return sessionId;
    }

    public List<ChatEvent> map(JsonNode msg) {
        List<ChatEvent> events = new ArrayList<>();
        String type = msg.path("type").asText();
        switch (type) {
            case "system" -> mapSystem(msg, events);
            case "auth_status" -> {
                ObjectNode data = NODES.objectNode();
                copy(msg, "isAuthenticating", data, "isAuthenticating");
                copy(msg, "output", data, "output");
                copy(msg, "error", data, "error");
                events.add(ChatEvent.of(ChatEventType.AUTH_STATUS, data));
            }
            case "stream_event" -> {
                streaming = true;
                mapStreamEvent(msg.path("event"), events);
            }
            case "assistant" -> {
                if (!streaming) mapAssistant(msg.path("message"), events);
            }
            case "user" -> mapToolResults(msg, events);
            case "tool_progress" -> {
                ObjectNode data = NODES.objectNode();
                copy(msg, "tool_use_id", data, "id");
                copy(msg, "tool_name", data, "name");
                copy(msg, "elapsed_time_seconds", data, "elapsed");
                events.add(ChatEvent.of(ChatEventType.TOOL_PROGRESS, data));
            }
            case "result" -> events.add(ChatEvent.of(ChatEventType.RESULT, mapResult(msg)));
            default -> { }
        }
        return events;
    }

    private void mapSystem(JsonNode msg, List<ChatEvent> events) {
        switch (msg.path("subtype").asText()) {
            case "init" -> {
                if (msg.hasNonNull("session_id")) sessionId = msg.get("session_id").asText();
                ObjectNode data = NODES.objectNode();
                copy(msg, "model", data, "model");
                copy(msg, "session_id", data, "sessionId");
                copy(msg, "cwd", data, "cwd");
                copy(msg, "tools", data, "tools");
                copy(msg, "mcp_servers", data, "mcpServers");
                copy(msg, "permissionMode", data, "permissionMode");
                copy(msg, "slash_commands", data, "slashCommands");
                events.add(ChatEvent.of(ChatEventType.INIT, data));
            }
            case "status" -> {
                ObjectNode data = NODES.objectNode();
                copy(msg, "status", data, "status");
                events.add(ChatEvent.of(ChatEventType.STATUS, data));
            }
            case "compact_boundary" -> {
                JsonNode meta = msg.path("compact_metadata");
                ObjectNode data = NODES.objectNode().put("status", "compacting");
                copy(meta, "trigger", data, "trigger");
                copy(meta, "pre_tokens", data, "preTokens");
                events.add(ChatEvent.of(ChatEventType.STATUS, data));
            }
            case "hook_response" -> {
                ObjectNode data = NODES.objectNode();
                copy(msg, "hook_name", data, "hookName");
                copy(msg, "hook_event", data, "hookEvent");
                copy(msg, "stdout", data, "stdout");
                copy(msg, "stderr", data, "stderr");
                copy(msg, "exit_code", data, "exitCode");
                events.add(ChatEvent.of(ChatEventType.HOOK_RESPONSE, data));
            }
            default -> { }
        }
    }

    private void mapStreamEvent(JsonNode ev, List<ChatEvent> events) {
        switch (ev.path("type").asText()) {
            case "message_start" -> {
                JsonNode message = ev.path("message");
                ObjectNode data = NODES.objectNode();
                copy(message, "id", data, "id");
                copy(message, "model", data, "model");
                copy(message, "role", data, "role");
                events.add(ChatEvent.of(ChatEventType.MESSAGE_START, data));
            }
            case "message_delta" -> {
                ObjectNode data = NODES.objectNode();
                copy(ev.path("delta"), "stop_reason", data, "stopReason");
                copy(ev.path("usage"), "output_tokens", data, "outputTokens");
                events.add(ChatEvent.of(ChatEventType.MESSAGE_DELTA, data));
            }
            case "message_stop" -> events.add(ChatEvent.of(ChatEventType.MESSAGE_STOP, NODES.objectNode()));
            case "content_block_start" -> {
                JsonNode block = ev.path("content_block");
                String blockType = block.path("type").asText();
                if ("tool_use".equals(blockType)) {
                    ObjectNode data = NODES.objectNode();
                    copy(block, "id", data, "id");
                    copy(block, "name", data, "name");
                    events.add(ChatEvent.of(ChatEventType.TOOL_START, data));
                } else if ("thinking".equals(blockType)) {
                    ObjectNode data = NODES.objectNode();
                    copy(ev, "index", data, "index");
                    events.add(ChatEvent.of(ChatEventType.THINKING_START, data));
                }
            }
            case "content_block_delta" -> {
                JsonNode delta = ev.path("delta");
                switch (delta.path("type").asText()) {
                    case "text_delta" -> events.add(ChatEvent.text(ChatEventType.TEXT, delta.path("text").asText()));
                    case "thinking_delta" ->
                            events.add(ChatEvent.text(ChatEventType.THINKING, delta.path("thinking").asText()));
                    case "input_json_delta" ->
                            events.add(ChatEvent.text(ChatEventType.TOOL_INPUT, delta.path("partial_json").asText()));
                    case "signature_delta" ->
                            events.add(ChatEvent.text(ChatEventType.SIGNATURE, delta.path("signature").asText()));
                    default -> { }
                }
            }
            case "content_block_stop" -> {
                ObjectNode data = NODES.objectNode();
                copy(ev, "index", data, "index");
                events.add(ChatEvent.of(ChatEventType.BLOCK_STOP, data));
            }
            default -> { }
        }
    }

    private void mapAssistant(JsonNode message, List<ChatEvent> events) {
        JsonNode content = message.path("content");
        if (!content.isArray()) return;
        for (JsonNode block : content) {
            switch (block.path("type").asText()) {
                case "text" -> {
                    if (block.hasNonNull("text")) events.add(ChatEvent.text(ChatEventType.TEXT, block.get("text").asText()));
                }
                case "thinking" -> {
                    if (block.hasNonNull("thinking")) {
                        events.add(ChatEvent.text(ChatEventType.THINKING, block.get("thinking").asText()));
                    }
                }
                case "tool_use" -> {
                    ObjectNode data = NODES.objectNode();
                    copy(block, "id", data, "id");
                    copy(block, "name", data, "name");
                    events.add(ChatEvent.of(ChatEventType.TOOL_START, data));
                    JsonNode input = block.get("input");
                    if (input != null && !input.isNull()) {
                        String text = input.isTextual() ? input.asText() : input.toString();
                        events.add(ChatEvent.text(ChatEventType.TOOL_INPUT, text));
                    }
                }
                default -> { }
            }
        }
    }

    private void mapToolResults(JsonNode msg, List<ChatEvent> events) {
        JsonNode content = msg.path("message").path("content");
        if (!content.isArray()) return;
        for (JsonNode block : content) {
            if (!"tool_result".equals(block.path("type").asText())) continue;
            ObjectNode data = NODES.objectNode();
            copy(block, "tool_use_id", data, "id");
            JsonNode output = msg.hasNonNull("tool_use_result") ? msg.get("tool_use_result") : block.get("content");
            data.set("output", output);
            data.put("isError", block.path("is_error").asBoolean(false));
            events.add(ChatEvent.of(ChatEventType.TOOL_RESULT, data));
        }
    }

    private ObjectNode mapResult(JsonNode msg) {
        ObjectNode data = NODES.objectNode();
        copy(msg, "session_id", data, "sessionId");
        copy(msg, "total_cost_usd", data, "costUsd");
        copy(msg, "num_turns", data, "turns");
        copy(msg, "duration_ms", data, "durationMs");
        copy(msg, "is_error", data, "isError");
        copy(msg, "errors", data, "errors");
        JsonNode usage = msg.path("usage");
        copy(usage, "input_tokens", data, "inputTokens");
        copy(usage, "output_tokens", data, "outputTokens");
        copy(usage, "cache_read_input_tokens", data, "cacheReadTokens");
        copy(usage, "cache_creation_input_tokens", data, "cacheCreationTokens");

        JsonNode modelUsage = msg.path("modelUsage");
        if (modelUsage.isObject()) {
            ArrayNode perModel = data.putArray("modelUsage");
            Iterator<Map.Entry<String, JsonNode>> it = modelUsage.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                ObjectNode u = perModel.addObject().put("model", e.getKey());
                copy(e.getValue(), "inputTokens", u, "inputTokens");
                copy(e.getValue(), "outputTokens", u, "outputTokens");
                copy(e.getValue(), "cacheReadInputTokens", u, "cacheReadTokens");
                copy(e.getValue(), "costUSD", u, "costUsd");
                copy(e.getValue(), "contextWindow", u, "contextWindow");
            }
        }
        return data;
    }

    private static void copy(JsonNode from, String field, ObjectNode to, String as) {
        JsonNode value = from.get(field);
        if (value != null) to.set(as, value);
    }
}
