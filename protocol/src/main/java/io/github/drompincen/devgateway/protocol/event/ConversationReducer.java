package io.github.drompincen.devgateway.protocol.event;

import io.github.drompincen.devgateway.protocol.api.ConversationMessage;
import io.github.drompincen.devgateway.protocol.api.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a session's chat events into a conversation timeline. This is the same reduction a
 * client applies to live events, so reducing a replayed buffer yields the same view as having
 * watched the session live.
 */
public class ConversationReducer {

    private static final int MAX_TOOL_TEXT = 5000;

    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, Entry> toolsById = new HashMap<>();
    private Entry currentAssistant;
    private Entry currentThinking;
    private Entry lastTool;
    private String model;

    public static List<ConversationMessage> reduce(List<ChatEvent> events) {
        ConversationReducer reducer = new ConversationReducer();
        events.forEach(reducer::apply);
        return reducer.messages();
    }

    public void apply(ChatEvent event) {
        JsonNode data = event.data();
        Instant ts = event.timestamp();
        switch (event.type()) {
            case USER -> {
                closeBlocks();
                entries.add(new Entry(ConversationMessage.USER, ts).append(data.asText()));
            }
            case INIT -> model = textOrNull(data.path("model"), model);
            case MESSAGE_START -> {
                closeBlocks();
                model = textOrNull(data.path("model"), model);
            }
            case TEXT -> {
                if (currentAssistant == null) {
                    currentAssistant = new Entry(ConversationMessage.ASSISTANT, ts);
                    currentAssistant.model = model;
                    entries.add(currentAssistant);
                }
                currentAssistant.append(data.asText());
            }
            case THINKING_START -> currentThinking = null;
            case THINKING -> {
                if (currentThinking == null) {
                    currentThinking = new Entry(ConversationMessage.THINKING, ts);
                    entries.add(currentThinking);
                }
                currentThinking.append(data.asText());
            }
            case TOOL_START -> {
                closeBlocks();
                Entry tool = new Entry(ConversationMessage.TOOL, ts);
                tool.toolId = data.path("id").asText(null);
                tool.toolName = data.path("name").asText(null);
                tool.toolStatus = ToolCall.STATUS_RUNNING;
                if (tool.toolId != null) toolsById.put(tool.toolId, tool);
                lastTool = tool;
                entries.add(tool);
            }
            case TOOL_INPUT -> {
                if (lastTool != null) lastTool.append(data.asText());
            }
            case TOOL_RESULT -> {
                Entry tool = toolsById.getOrDefault(data.path("id").asText(""), lastTool);
                if (tool != null) {
                    JsonNode output = data.path("output");
                    tool.toolOutput = truncate(output.isTextual() ? output.asText() : output.toString());
                    tool.toolStatus = data.path("isError").asBoolean(false)
                            ? ToolCall.STATUS_ERROR : ToolCall.STATUS_COMPLETED;
                }
            }
            case ERROR -> {
                closeBlocks();
                String message = data.isTextual() ? data.asText() : data.path("message").asText("Unknown error");
                entries.add(new Entry(ConversationMessage.ERROR, ts).append(message));
            }
            default -> {
                // status, progress and usage markers do not change the timeline
            }
        }
    }

    public List<ConversationMessage> messages() {
        List<ConversationMessage> out = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            out.add(e.toMessage());
        }
        return out;
    }

    private void closeBlocks() {
        currentAssistant = null;
        currentThinking = null;
    }

    private static String textOrNull(JsonNode node, String fallback) {
        return node.isTextual() ? node.asText() : fallback;
    }

    private static String truncate(String s) {
        return s.length() > MAX_TOOL_TEXT ? s.substring(0, MAX_TOOL_TEXT) : s;
    }

    private static final class Entry {
        final String type;
        final Instant ts;
        final StringBuilder text = new StringBuilder();
        String model;
        String toolId;
        String toolName;
        String toolOutput;
        String toolStatus;

        Entry(String type, Instant ts) {
            this.type = type;
            this.ts = ts;
        }

        Entry append(String s) {
            text.append(s);
            return this;
        }

        ConversationMessage toMessage() {
            return switch (type) {
                case ConversationMessage.TOOL -> ConversationMessage.tool(
                        new ToolCall(toolId, toolName, truncate(text.toString()), toolOutput, toolStatus), ts);
                case ConversationMessage.THINKING -> ConversationMessage.thinking(text.toString(), ts);
                case ConversationMessage.ASSISTANT -> ConversationMessage.assistant(text.toString(), ts, model);
                case ConversationMessage.ERROR -> ConversationMessage.error(text.toString(), ts);
                default -> ConversationMessage.user(text.toString(), ts);
            };
        }
    }
}
