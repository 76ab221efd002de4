package io.github.drompincen.devgateway.persistence.transcript;

import io.github.drompincen.devgateway.protocol.api.ChatSessionSummary;
import io.github.drompincen.devgateway.protocol.api.ConversationMessage;
import io.github.drompincen.devgateway.protocol.api.SessionState;
import io.github.drompincen.devgateway.protocol.api.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the agent CLI's own JSONL transcripts ({@code <projectsDir>/<project>/<sessionId>.jsonl}).
 * Used to list sessions that were not started through the gateway and to rebuild a read-only
 * conversation for them. Unparseable lines are skipped.
 */
public class AgentTranscriptReader {

    private static final Logger log = LoggerFactory.getLogger(AgentTranscriptReader.class);

    private static final String EXTENSION = ".jsonl";
    private static final int MAX_TOOL_TEXT = 5000;
    private static final int TITLE_LENGTH = 50;

    private final Path projectsDir;
    private final ObjectMapper objectMapper;

    public AgentTranscriptReader(Path projectsDir, ObjectMapper objectMapper) {
        this.projectsDir = projectsDir;
        this.objectMapper = objectMapper;
    }

    public List<ChatSessionSummary> listSessions(int limit) {
        List<ChatSessionSummary> sessions = new ArrayList<>();
        if (!Files.isDirectory(projectsDir)) return sessions;

        try (Stream<Path> projects = Files.list(projectsDir)) {
            for (Path project : projects.filter(Files::isDirectory).toList()) {
                try (Stream<Path> files = Files.list(project)) {
                    for (Path file : files.filter(f -> f.getFileName().toString().endsWith(EXTENSION)).toList()) {
                        summarize(file).ifPresent(sessions::add);
                    }
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list agent transcripts under {}: {}", projectsDir, e.getMessage());
        }

        sessions.sort(Comparator.comparing(ChatSessionSummary::endedAt).reversed());
        return sessions.size() > limit ? new ArrayList<>(sessions.subList(0, limit)) : sessions;
    }

    public Optional<Path> findTranscript(String sessionId) {
        if (sessionId == null || sessionId.contains("/") || sessionId.contains("..")) return Optional.empty();
        if (!Files.isDirectory(projectsDir)) return Optional.empty();
        try (Stream<Path> projects = Files.list(projectsDir)) {
            return projects.filter(Files::isDirectory)
                    .map(p -> p.resolve(sessionId + EXTENSION))
                    .filter(Files::isRegularFile)
                    .findFirst();
        } catch (IOException e) {
            log.warn("Failed to search agent transcripts for {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    Optional<ChatSessionSummary> summarize(Path file) {
        String id = file.getFileName().toString();
        id = id.substring(0, id.length() - EXTENSION.length());

        String title = null;
        String summaryTitle = null;
        String model = null;
        Instant startedAt = null;
        Instant endedAt = null;
        int messageCount = 0;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                JsonNode entry = parseLine(line);
                if (entry == null) continue;
                // sidechain transcripts are internal warmup runs
                if (entry.path("isSidechain").asBoolean(false)) return Optional.empty();

                Instant ts = timestamp(entry);
                if (ts != null) {
                    if (startedAt == null) startedAt = ts;
                    endedAt = ts;
                }
                String type = entry.path("type").asText();
                if ("summary".equals(type) && entry.hasNonNull("summary")) {
                    summaryTitle = entry.get("summary").asText();
                }
                if ("user".equals(type) && entry.has("message") && !entry.path("isMeta").asBoolean(false)) {
                    messageCount++;
                    String content = userText(entry.get("message").path("content"));
                    if (title == null && isVisibleUserText(content)) {
                        title = content.length() > TITLE_LENGTH ? content.substring(0, TITLE_LENGTH) + "..." : content;
                    }
                }
                if ("assistant".equals(type)) {
                    messageCount++;
                    if (model == null && entry.path("message").hasNonNull("model")) {
                        model = entry.get("message").get("model").asText();
                    }
                }
            }
        } catch (IOException e) {
            log.debug("Skipping unreadable transcript {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        if (messageCount == 0) return Optional.empty();
        Instant now = Instant.now();
        String resolvedTitle = summaryTitle != null ? summaryTitle : title != null ? title : "(Untitled)";
        return Optional.of(new ChatSessionSummary(id, SessionState.COMPLETED,
                startedAt != null ? startedAt : now, endedAt != null ? endedAt : now,
                model, resolvedTitle, ChatSessionSummary.SOURCE_TRANSCRIPT));
    }

    public List<ConversationMessage> loadConversation(String sessionId) {
        List<ConversationMessage> messages = new ArrayList<>();
        Optional<Path> file = findTranscript(sessionId);
        if (file.isEmpty()) return messages;

        Map<String, PendingTool> pendingTools = new HashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(file.get(), StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                JsonNode entry = parseLine(line);
                if (entry == null || entry.path("isSidechain").asBoolean(false)) continue;
                Instant ts = timestamp(entry);
                if (ts == null) ts = Instant.now();
                JsonNode message = entry.get("message");
                if (message == null) continue;

                switch (entry.path("type").asText()) {
                    case "user" -> {
                        if (entry.path("isMeta").asBoolean(false)) break;
                        collectToolResults(entry, message.path("content"), pendingTools, messages);
                        String content = userText(message.path("content"));
                        if (isVisibleUserText(content)) {
                            messages.add(ConversationMessage.user(content, ts));
                        }
                    }
                    case "assistant" -> collectAssistant(message, ts, pendingTools, messages);
                    default -> { }
                }
            }
        } catch (IOException e) {
            log.error("Failed to load conversation {}", sessionId, e);
        }
        return messages;
    }

    private void collectToolResults(JsonNode entry, JsonNode content, Map<String, PendingTool> pendingTools,
                                    List<ConversationMessage> messages) {
        if (!content.isArray()) return;
        for (JsonNode block : content) {
            if (!"tool_result".equals(block.path("type").asText()) || !block.hasNonNull("tool_use_id")) continue;
            String toolId = block.get("tool_use_id").asText();
            PendingTool pending = pendingTools.remove(toolId);
            if (pending == null) continue;

            String output = "";
            JsonNode toolUseResult = entry.get("toolUseResult");
            if (toolUseResult != null) {
                if (toolUseResult.isTextual()) output = toolUseResult.asText();
                else if (toolUseResult.hasNonNull("result")) output = toolUseResult.get("result").asText();
                else if (toolUseResult.hasNonNull("stdout")) output = toolUseResult.get("stdout").asText();
            }
            if (output.isEmpty() && block.path("content").isTextual()) {
                output = block.get("content").asText();
            }
            String status = block.path("is_error").asBoolean(false) ? ToolCall.STATUS_ERROR : ToolCall.STATUS_COMPLETED;
            messages.add(ConversationMessage.tool(
                    new ToolCall(toolId, pending.name(), pending.input(), truncate(output), status),
                    pending.timestamp()));
        }
    }

    private void collectAssistant(JsonNode message, Instant ts, Map<String, PendingTool> pendingTools,
                                  List<ConversationMessage> messages) {
        JsonNode content = message.path("content");
        StringBuilder text = new StringBuilder();
        StringBuilder thinking = new StringBuilder();
        if (content.isArray()) {
            for (JsonNode block : content) {
                switch (block.path("type").asText()) {
                    case "text" -> text.append(block.path("text").asText(""));
                    case "thinking" -> thinking.append(block.path("thinking").asText(""));
                    case "tool_use" -> {
                        if (!block.hasNonNull("id")) break;
                        pendingTools.put(block.get("id").asText(),
                                new PendingTool(block.path("name").asText(), toolInput(block.get("input")), ts));
                    }
                    default -> { }
                }
            }
        } else if (content.isTextual()) {
            text.append(content.asText());
        }

        if (thinking.length() > 0) {
            messages.add(ConversationMessage.thinking(thinking.toString(), ts));
        }
        if (text.length() > 0) {
            String model = message.hasNonNull("model") ? message.get("model").asText() : null;
            messages.add(ConversationMessage.assistant(text.toString(), ts, model));
        }
    }

    private String toolInput(JsonNode input) {
        if (input == null || input.isNull()) return "";
        if (input.isTextual()) return truncate(input.asText());
        try {
            return truncate(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(input));
        } catch (JsonProcessingException e) {
            return truncate(input.toString());
        }
    }

    private JsonNode parseLine(String line) {
        if (line.isBlank()) return null;
        try {
            return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static Instant timestamp(JsonNode entry) {
        if (!entry.hasNonNull("timestamp")) return null;
        try {
            return Instant.parse(entry.get("timestamp").asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String userText(JsonNode content) {
        if (content.isArray()) {
            for (JsonNode c : content) {
                if ("text".equals(c.path("type").asText())) return c.path("text").asText("");
            }
            return "";
        }
        return content.isMissingNode() || content.isNull() ? "" : content.asText();
    }

    private static boolean isVisibleUserText(String content) {
        return !content.isEmpty()
                && !content.startsWith("<ide_")
                && !content.startsWith("<command-")
                && !content.equals("Warmup");
    }

    private static String truncate(String s) {
        return s.length() > MAX_TOOL_TEXT ? s.substring(0, MAX_TOOL_TEXT) : s;
    }

    private record PendingTool(String name, String input, Instant timestamp) {}
}
