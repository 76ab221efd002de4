package io.github.drompincen.devgateway.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One entry of a read-only conversation timeline, as sent by {@code chat:conversation}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationMessage(
        String type,
        String content,
        Instant timestamp,
        String model,
        ToolCall tool,
        String thinking
) {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";
    public static final String THINKING = "thinking";
    public static final String ERROR = "error";

    public static ConversationMessage user(String content, Instant ts) {
        return new ConversationMessage(USER, content, ts, null, null, null);
    }

    public static ConversationMessage assistant(String content, Instant ts, String model) {
        return new ConversationMessage(ASSISTANT, content, ts, model, null, null);
    }

    public static ConversationMessage tool(ToolCall tool, Instant ts) {
        return new ConversationMessage(TOOL, "", ts, null, tool, null);
    }

    public static ConversationMessage thinking(String thinking, Instant ts) {
        return new ConversationMessage(THINKING, "", ts, null, null, thinking);
    }

    public static ConversationMessage error(String message, Instant ts) {
        return new ConversationMessage(ERROR, message, ts, null, null, null);
    }
}
