package io.github.drompincen.devgateway.runtime.channel.chat;

import io.github.drompincen.devgateway.persistence.store.ChatSessionRecord;
import io.github.drompincen.devgateway.persistence.store.ChatSessionRepository;
import io.github.drompincen.devgateway.persistence.transcript.AgentTranscriptReader;
import io.github.drompincen.devgateway.protocol.api.ChatResult;
import io.github.drompincen.devgateway.protocol.api.ChatSessionSummary;
import io.github.drompincen.devgateway.protocol.api.ConversationMessage;
import io.github.drompincen.devgateway.protocol.api.SessionState;
import io.github.drompincen.devgateway.protocol.event.ChatEvent;
import io.github.drompincen.devgateway.protocol.event.ChatEventType;
import io.github.drompincen.devgateway.protocol.event.ConversationReducer;
import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import io.github.drompincen.devgateway.runtime.agent.AgentRequest;
import io.github.drompincen.devgateway.runtime.agent.AgentRun;
import io.github.drompincen.devgateway.runtime.agent.AgentRunner;
import io.github.drompincen.devgateway.runtime.agent.AgentRunnerException;
import io.github.drompincen.devgateway.runtime.channel.Channel;
import io.github.drompincen.devgateway.runtime.channel.ChannelContext;
import io.github.drompincen.devgateway.runtime.channel.ChannelException;
import io.github.drompincen.devgateway.runtime.channel.Connection;
import io.github.drompincen.devgateway.runtime.channel.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * Agent conversations. Each started session runs its agent on the agent executor; the session's
 * events are buffered for replay and broadcast to the {@code chat:<sessionId>} room.
 */
public class ChatChannel implements Channel {

    private static final Logger log = LoggerFactory.getLogger(ChatChannel.class);

    public static final String NAME = "chat";

    private static final int TITLE_LENGTH = 50;
    private static final Duration TRANSCRIPT_CACHE_TTL = Duration.ofSeconds(30);
    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final ChatSettings settings;
    private final ChatSessionRegistry registry;
    private final AgentRunner runner;
    private final ChatSessionRepository repository;
    private final AgentTranscriptReader transcripts;
    private final TaskScheduler scheduler;
    private final Executor agentExecutor;
    private final Clock clock;
    /** connection id -> room of the session it is currently viewing */
    private final Map<String, String> focus = new ConcurrentHashMap<>();

    private ChannelContext context;
    private volatile List<ChatSessionSummary> transcriptCache;
    private volatile Instant transcriptCachedAt = Instant.EPOCH;

    public ChatChannel(ChatSettings settings,
                       ChatSessionRegistry registry,
                       AgentRunner runner,
                       ChatSessionRepository repository,
                       AgentTranscriptReader transcripts,
                       TaskScheduler scheduler,
                       Executor agentExecutor,
                       Clock clock) {
        this.settings = settings;
        this.registry = registry;
        this.runner = runner;
        this.repository = repository;
        this.transcripts = transcripts;
        this.scheduler = scheduler;
        this.agentExecutor = agentExecutor;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void onRegister(ChannelContext context) {
        this.context = context;
    }

    static String roomOf(String sessionId) {
        return NAME + ":" + sessionId;
    }

    // ---- subscription ----

    @Override
    public void onSubscribe(Connection connection, String room, JsonNode params) {
        connection.send(WsMessage.of("chat:sessions", Map.of("sessions", sessionSummaries())));
        String sessionId = text(params, "sessionId");
        Optional<ChatSession> session = sessionId != null ? registry.find(sessionId) : Optional.empty();
        if (session.isPresent()) {
            attach(connection, session.get());
        } else {
            focusOn(connection, room);
            connection.send(WsMessage.of("chat:ready", data("sessionId", null)));
        }
    }

    @Override
    public void onUnsubscribe(Connection connection, String room) {
        String current = focus.remove(connection.id());
        if (current != null) context.leave(current, connection);
    }

    @Override
    public void onDisconnect(Connection connection) {
        focus.remove(connection.id());
    }

    /**
     * Joins the session's room, then sends the state snapshot and the full buffer. Appends
     * broadcast under the same monitor, so the connection sees every event exactly once and in
     * order.
     */
    private void attach(Connection connection, ChatSession session) {
        synchronized (session) {
            focusOn(connection, roomOf(session.getId()));
            connection.send(WsMessage.of("chat:state", session.stateView()));
            connection.send(WsMessage.of("chat:replay",
                    data("sessionId", session.getId(), "events", session.buffer().snapshot())));
        }
    }

    private void focusOn(Connection connection, String room) {
        String previous = focus.put(connection.id(), room);
        if (previous != null && !previous.equals(room)) {
            context.leave(previous, connection);
        }
        context.join(room, connection);
    }

    // ---- messages ----

    @Override
    public void onMessage(Connection connection, String action, JsonNode payload) {
        switch (action) {
            case "start" -> start(connection, payload);
            case "abort" -> abort(requireText(payload, "sessionId"));
            case "status" -> status(connection, requireText(payload, "sessionId"));
            case "list" -> connection.send(WsMessage.of("chat:sessions", Map.of("sessions", sessionSummaries())));
            case "load" -> load(connection, requireText(payload, "sessionId"));
            case "models" -> connection.send(WsMessage.of("chat:models", Map.of("models", settings.models())));
            default -> throw new ChannelException(ErrorCode.UNSUPPORTED_MESSAGE, "Unknown chat action: " + action);
        }
    }

    public ChatSession start(Connection connection, JsonNode payload) {
        String message = requireText(payload, "message");
        String requestedId = text(payload, "sessionId");
        String cwd = Optional.ofNullable(text(payload, "cwd")).orElse(settings.defaultCwd());
        String model = text(payload, "model");
        String currentPath = text(payload, "currentPath");
        String permissionMode = Optional.ofNullable(text(payload, "permissionMode")).orElse(settings.permissionMode());

        ChatSession prior = null;
        ChatSessionRecord priorRecord = null;
        String resumeToken = null;
        String sessionId;
        if (requestedId == null) {
            sessionId = UUID.randomUUID().toString();
        } else {
            sessionId = requestedId;
            prior = registry.find(requestedId).orElse(null);
            if (prior != null) {
                if (prior.isRunning()) {
                    throw new ChannelException(ErrorCode.ALREADY_RUNNING, "Session is already running: " + sessionId, sessionId);
                }
                resumeToken = prior.getResumeToken();
            } else {
                priorRecord = repository.findById(requestedId).orElse(null);
                if (priorRecord != null) {
                    resumeToken = priorRecord.getResumeToken();
                } else if (UUID_PATTERN.matcher(requestedId).matches()) {
                    // a transcript session started outside the gateway, resumable by its own id
                    resumeToken = requestedId;
                } else {
                    throw ChannelException.sessionNotFound(requestedId);
                }
            }
        }

        ChatSession session = new ChatSession(sessionId, clock.instant(), cwd, settings.maxBufferEvents());
        session.setResumeToken(resumeToken);
        if (prior != null) {
            session.buffer().appendAll(prior.buffer().snapshot());
            session.setTitle(prior.getTitle());
            session.setModel(prior.getModel());
        } else if (priorRecord != null) {
            session.buffer().appendAll(priorRecord.getEvents());
            session.setTitle(priorRecord.getTitle());
            session.setModel(priorRecord.getModel());
        }
        if (session.getTitle() == null) session.setTitle(titleOf(message));
        if (model != null) session.setModel(model);

        registry.register(session);
        log.info("Chat session {} started{} in {}", sessionId, resumeToken != null ? " (resume)" : "", cwd);

        synchronized (session) {
            focusOn(connection, roomOf(sessionId));
            context.broadcast(roomOf(sessionId), WsMessage.of("chat:started",
                    data("sessionId", sessionId, "title", session.getTitle(), "resumed", resumeToken != null)));
            emit(session, ChatEvent.text(ChatEventType.USER, message));
        }
        persist(session);
        broadcastSessionList();

        String prompt = currentPath != null ? "[current file: " + currentPath + "]\n\n" + message : message;
        AgentRequest request = new AgentRequest(prompt, resumeToken, cwd, model, permissionMode);
        agentExecutor.execute(() -> run(session, request));
        return session;
    }

    void run(ChatSession session, AgentRequest request) {
        Instant started = clock.instant();
        ChatResult reported = null;
        AgentRun run = null;
        try {
            run = runner.start(request, session.cancellation());
            Optional<ChatEvent> next;
            while (!session.cancellation().isCancelled() && (next = run.next()).isPresent()) {
                ChatEvent event = next.get();
                if (event.type() == ChatEventType.INIT) {
                    JsonNode data = event.data();
                    if (data.hasNonNull("sessionId")) session.setResumeToken(data.get("sessionId").asText());
                    if (data.hasNonNull("model")) session.setModel(data.get("model").asText());
                } else if (event.type() == ChatEventType.RESULT) {
                    reported = resultOf(event.data());
                }
                if (!emit(session, event)) break;
            }
            if (run.resumeToken() != null) session.setResumeToken(run.resumeToken());
            if (!session.cancellation().isCancelled()) {
                long durationMs = Duration.between(started, clock.instant()).toMillis();
                complete(session, reported != null ? reported.withDuration(
                        reported.durationMs() != null ? reported.durationMs() : durationMs)
                        : ChatResult.ofDuration(durationMs));
            }
        } catch (AgentRunnerException | RuntimeException e) {
            if (session.cancellation().isCancelled()) {
                log.debug("Chat session {} ended after abort: {}", session.getId(), e.getMessage());
            } else {
                log.warn("Chat session {} failed: {}", session.getId(), e.getMessage());
                fail(session, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        } finally {
            if (run != null) run.close();
        }
    }

    /**
     * Appends to the buffer and broadcasts. Events arriving after the session left
     * {@code running} are discarded.
     */
    private boolean emit(ChatSession session, ChatEvent event) {
        synchronized (session) {
            if (!session.isRunning()) return false;
            session.buffer().append(event);
            context.broadcast(roomOf(session.getId()),
                    WsMessage.of("chat:event", data("sessionId", session.getId(), "event", event)));
            return true;
        }
    }

    private void complete(ChatSession session, ChatResult result) {
        synchronized (session) {
            if (!session.complete(result, clock.instant())) return;
            context.broadcast(roomOf(session.getId()),
                    WsMessage.of("chat:completed", data("sessionId", session.getId(), "result", result)));
        }
        log.info("Chat session {} completed", session.getId());
        afterTerminal(session);
    }

    private void fail(ChatSession session, String error) {
        synchronized (session) {
            if (!session.isRunning()) return;
            ObjectNode errorData = JsonNodeFactory.instance.objectNode().put("message", error);
            emit(session, ChatEvent.of(ChatEventType.ERROR, errorData));
            session.fail(error, clock.instant());
            context.broadcast(roomOf(session.getId()),
                    WsMessage.of("chat:error", data("sessionId", session.getId(), "error", error)));
        }
        afterTerminal(session);
    }

    public void abort(String sessionId) {
        ChatSession session = registry.find(sessionId).orElseThrow(() -> ChannelException.sessionNotFound(sessionId));
        synchronized (session) {
            if (!session.abort(clock.instant())) {
                log.debug("Abort of finished chat session {} ignored", sessionId);
                return;
            }
            context.broadcast(roomOf(sessionId), WsMessage.of("chat:aborted", data("sessionId", sessionId)));
        }
        session.cancellation().cancel();
        log.info("Chat session {} aborted", sessionId);
        afterTerminal(session);
    }

    private void afterTerminal(ChatSession session) {
        persist(session);
        broadcastSessionList();
        scheduler.schedule(() -> {
            if (registry.evict(session)) {
                log.info("Evicted chat session {} from memory", session.getId());
            }
        }, clock.instant().plus(settings.evictionDelay()));
    }

    private void persist(ChatSession session) {
        try {
            repository.save(session.toRecord(settings.persistedEvents()));
        } catch (RuntimeException e) {
            log.error("Failed to persist chat session {}", session.getId(), e);
        }
    }

    private void status(Connection connection, String sessionId) {
        Optional<ChatSession> session = registry.find(sessionId);
        Map<String, Object> status = data("sessionId", sessionId, "exists", session.isPresent());
        session.ifPresent(s -> {
            status.put("state", s.getState());
            status.put("startedAt", s.getStartedAt());
            synchronized (s) {
                status.put("bufferSize", s.buffer().size());
            }
        });
        connection.send(WsMessage.of("chat:status", status));
    }

    private void load(Connection connection, String sessionId) {
        Optional<ChatSession> live = registry.find(sessionId);
        if (live.isPresent()) {
            attach(connection, live.get());
            return;
        }
        connection.send(WsMessage.of("chat:loading", data("sessionId", sessionId)));

        List<ConversationMessage> messages;
        Optional<ChatSessionRecord> stored = repository.findById(sessionId);
        if (stored.isPresent() && !stored.get().getEvents().isEmpty()) {
            messages = ConversationReducer.reduce(stored.get().getEvents());
        } else {
            messages = transcripts.loadConversation(sessionId);
        }
        if (messages.isEmpty() && stored.isEmpty()) {
            throw ChannelException.sessionNotFound(sessionId);
        }
        connection.send(WsMessage.of("chat:conversation", data(
                "sessionId", sessionId, "state", SessionState.COMPLETED, "messages", messages)));
    }

    // ---- listing ----

    public List<ChatSessionSummary> sessionSummaries() {
        Map<String, ChatSessionSummary> byId = new LinkedHashMap<>();
        for (ChatSession s : registry.all()) {
            byId.put(s.getId(), s.summary());
        }
        for (ChatSessionRecord rec : repository.findRecent(settings.historyLimit())) {
            byId.putIfAbsent(rec.getId(), new ChatSessionSummary(rec.getId(), rec.getState(), rec.getStartedAt(),
                    rec.getEndedAt(), rec.getModel(), rec.getTitle(), ChatSessionSummary.SOURCE_GATEWAY));
        }
        for (ChatSessionSummary t : transcriptSummaries()) {
            byId.putIfAbsent(t.id(), t);
        }
        List<ChatSessionSummary> all = new ArrayList<>(byId.values());
        all.sort(Comparator.comparing((ChatSessionSummary s) -> s.state() != SessionState.RUNNING)
                .thenComparing(ChatChannel::lastActivity, Comparator.reverseOrder()));
        return all.size() > settings.historyLimit() ? new ArrayList<>(all.subList(0, settings.historyLimit())) : all;
    }

    private List<ChatSessionSummary> transcriptSummaries() {
        Instant now = clock.instant();
        List<ChatSessionSummary> cached = transcriptCache;
        if (cached == null || now.isAfter(transcriptCachedAt.plus(TRANSCRIPT_CACHE_TTL))) {
            cached = transcripts.listSessions(settings.historyLimit());
            transcriptCache = cached;
            transcriptCachedAt = now;
        }
        return cached;
    }

    private static Instant lastActivity(ChatSessionSummary s) {
        if (s.endedAt() != null) return s.endedAt();
        return s.startedAt() != null ? s.startedAt() : Instant.EPOCH;
    }

    private void broadcastSessionList() {
        context.broadcastAll(WsMessage.of("chat:sessions", Map.of("sessions", sessionSummaries())));
    }

    // ---- shutdown ----

    @Override
    public void onShutdown() {
        for (ChatSession session : registry.all()) {
            if (!session.abort(clock.instant())) continue;
            session.cancellation().cancel();
            persist(session);
            log.info("Chat session {} aborted at shutdown", session.getId());
        }
    }

    // ---- helpers ----

    static String titleOf(String message) {
        String firstLine = message.strip();
        return firstLine.length() > TITLE_LENGTH ? firstLine.substring(0, TITLE_LENGTH) + "..." : firstLine;
    }

    private static ChatResult resultOf(JsonNode data) {
        return new ChatResult(
                data.hasNonNull("costUsd") ? data.get("costUsd").asDouble() : null,
                data.hasNonNull("turns") ? data.get("turns").asInt() : null,
                data.hasNonNull("durationMs") ? data.get("durationMs").asLong() : null,
                data.hasNonNull("inputTokens") ? data.get("inputTokens").asLong() : null,
                data.hasNonNull("outputTokens") ? data.get("outputTokens").asLong() : null);
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) return null;
        String value = node.get(field).asText();
        return value.isBlank() ? null : value;
    }

    private static String requireText(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) throw ChannelException.invalidRequest("Missing '" + field + "'");
        return value;
    }

    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
