package io.github.drompincen.devgateway.runtime.channel.terminal;

import io.github.drompincen.devgateway.protocol.api.TerminalSessionSummary;
import io.github.drompincen.devgateway.protocol.ws.WsMessage;
import io.github.drompincen.devgateway.runtime.channel.Channel;
import io.github.drompincen.devgateway.runtime.channel.ChannelContext;
import io.github.drompincen.devgateway.runtime.channel.ChannelException;
import io.github.drompincen.devgateway.runtime.channel.Connection;
import io.github.drompincen.devgateway.runtime.channel.ErrorCode;
import io.github.drompincen.devgateway.runtime.process.ProcessDriver;
import io.github.drompincen.devgateway.runtime.process.ProcessListener;
import io.github.drompincen.devgateway.runtime.process.ProcessSpawnException;
import io.github.drompincen.devgateway.runtime.process.SpawnRequest;
import io.github.drompincen.devgateway.runtime.process.TerminalProcess;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Pool of pseudo-terminal sessions. A session outlives its subscribers: leaving or
 * disconnecting never kills the process, only {@code terminate}, process exit or the idle
 * sweep does.
 */
public class TerminalChannel implements Channel {

    private static final Logger log = LoggerFactory.getLogger(TerminalChannel.class);

    public static final String NAME = "terminal";

    private static final int TITLE_LENGTH = 50;
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int ID_LENGTH = 8;

    private final TerminalSettings settings;
    private final ProcessDriver driver;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();
    /** connection id -> ids of the sessions it has joined */
    private final Map<String, Set<String>> joined = new ConcurrentHashMap<>();
    private final Object createLock = new Object();

    private ChannelContext context;
    private ScheduledFuture<?> sweepTask;

    public TerminalChannel(TerminalSettings settings, ProcessDriver driver, TaskScheduler scheduler, Clock clock) {
        this.settings = settings;
        this.driver = driver;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void onRegister(ChannelContext context) {
        this.context = context;
        this.sweepTask = scheduler.scheduleAtFixedRate(() -> sweepIdleSessions(clock.instant()),
                settings.sweepInterval());
    }

    /** Every terminal subscriber shares the channel room; sessions have their own rooms. */
    @Override
    public String roomFor(JsonNode params) {
        return NAME;
    }

    static String roomOf(String sessionId) {
        return NAME + ":" + sessionId;
    }

    @Override
    public void onSubscribe(Connection connection, String room, JsonNode params) {
        context.join(room, connection);
        connection.send(sessionsFrame());

        String requested = text(params, "sessionId");
        if (requested != null && sessions.containsKey(requested)) {
            join(connection, requested);
            return;
        }
        Optional<TerminalSession> oldest = sessions.values().stream()
                .min(Comparator.comparing(TerminalSession::getCreatedAt));
        if (oldest.isPresent()) {
            join(connection, oldest.get().getId());
        } else {
            TerminalSession created = create(null, null);
            join(connection, created.getId());
        }
    }

    @Override
    public void onUnsubscribe(Connection connection, String room) {
        leaveAll(connection);
    }

    @Override
    public void onDisconnect(Connection connection) {
        leaveAll(connection);
    }

    private void leaveAll(Connection connection) {
        Set<String> ids = joined.remove(connection.id());
        if (ids == null || ids.isEmpty()) return;
        for (String id : ids) {
            TerminalSession session = sessions.get(id);
            if (session != null) session.removeSubscriber(connection.id());
            context.leave(roomOf(id), connection);
        }
        broadcastSessionList();
    }

    @Override
    public void onMessage(Connection connection, String action, JsonNode payload) {
        switch (action) {
            case "create" -> {
                TerminalSession session = create(text(payload, "title"), text(payload, "cwd"));
                join(connection, session.getId());
            }
            case "join" -> join(connection, requireText(payload, "sessionId"));
            case "leave" -> leave(connection, requireText(payload, "sessionId"));
            case "terminate" -> terminate(requireText(payload, "sessionId"));
            case "list" -> connection.send(sessionsFrame());
            case "rename" -> rename(requireText(payload, "sessionId"), requireText(payload, "title"));
            case "input" -> input(requireText(payload, "sessionId"), payload.path("data").asText(""));
            case "resize" -> resize(requireText(payload, "sessionId"),
                    payload.path("cols").asInt(0), payload.path("rows").asInt(0));
            case "inject" -> inject(requireText(payload, "sessionId"), requireText(payload, "command"));
            default -> throw new ChannelException(ErrorCode.UNSUPPORTED_MESSAGE, "Unknown terminal action: " + action);
        }
    }

    public TerminalSession create(String title, String cwd) {
        TerminalSession session;
        synchronized (createLock) {
            if (sessions.size() >= settings.maxSessions()) {
                throw new ChannelException(ErrorCode.SESSION_LIMIT,
                        "Maximum of " + settings.maxSessions() + " terminal sessions reached");
            }
            String id = newId();
            String sessionCwd = cwd != null ? cwd : settings.defaultCwd();
            String sessionTitle = title != null ? truncateTitle(title) : "Session " + (sessions.size() + 1);
            session = new TerminalSession(id, sessionTitle, sessionCwd, settings.cols(), settings.rows(),
                    settings.scrollbackChars(), clock.instant());

            TerminalProcess process;
            try {
                process = driver.spawn(new SpawnRequest(List.of(settings.shell()), Path.of(sessionCwd), Map.of(),
                        settings.cols(), settings.rows()), new SessionListener(session));
            } catch (ProcessSpawnException e) {
                log.warn("Terminal session could not be spawned: {}", e.getMessage());
                throw new ChannelException(ErrorCode.PROCESS_SPAWN_FAILURE, e.getMessage(), null, e);
            }
            synchronized (session) {
                session.attach(process);
                if (!session.isExited()) sessions.put(id, session);
            }
        }
        log.info("Terminal session {} created ({}) in {}", session.getId(), session.getTitle(), session.getCwd());
        broadcastSessionList();
        return session;
    }

    public void join(Connection connection, String sessionId) {
        TerminalSession session = require(sessionId);
        synchronized (session) {
            session.addSubscriber(connection.id());
            joined.computeIfAbsent(connection.id(), k -> ConcurrentHashMap.newKeySet()).add(sessionId);
            context.join(roomOf(sessionId), connection);
            connection.send(WsMessage.of("terminal:joined", session.joinedView()));
        }
        log.debug("Connection {} joined terminal {}", connection.id(), sessionId);
        broadcastSessionList();
    }

    public void leave(Connection connection, String sessionId) {
        TerminalSession session = sessions.get(sessionId);
        if (session == null) return;
        session.removeSubscriber(connection.id());
        Set<String> ids = joined.get(connection.id());
        if (ids != null) ids.remove(sessionId);
        context.leave(roomOf(sessionId), connection);
        broadcastSessionList();
    }

    public void terminate(String sessionId) {
        TerminalSession session = sessions.remove(sessionId);
        if (session == null) throw ChannelException.sessionNotFound(sessionId);
        context.broadcast(roomOf(sessionId), WsMessage.of("terminal:terminated", Map.of("sessionId", sessionId)));
        context.closeRoom(roomOf(sessionId));
        joined.values().forEach(ids -> ids.remove(sessionId));
        session.kill();
        log.info("Terminal session {} terminated", sessionId);
        broadcastSessionList();
    }

    private void rename(String sessionId, String title) {
        require(sessionId).setTitle(truncateTitle(title));
        broadcastSessionList();
    }

    private void input(String sessionId, String data) {
        TerminalSession session = require(sessionId);
        write(session, data);
    }

    private void inject(String sessionId, String command) {
        TerminalSession session = require(sessionId);
        write(session, command + "\n");
        log.info("Injected command into terminal {}: {}", sessionId, command);
    }

    private void write(TerminalSession session, String data) {
        try {
            session.process().write(data);
            session.touch(clock.instant());
        } catch (IOException e) {
            throw new ChannelException(ErrorCode.INTERNAL, "Failed to write to terminal: " + e.getMessage(),
                    session.getId(), e);
        }
    }

    private void resize(String sessionId, int cols, int rows) {
        TerminalSession session = require(sessionId);
        if (cols <= 0 || rows <= 0) return;
        session.resize(cols, rows);
    }

    /**
     * Kills sessions that have no subscribers and no input or output for longer than the idle
     * timeout.
     */
    public int sweepIdleSessions(Instant now) {
        int reaped = 0;
        for (TerminalSession session : sessions.values()) {
            if (session.isIdle(now, settings.idleTimeout()) && sessions.remove(session.getId(), session)) {
                log.info("Reaping idle terminal session {}", session.getId());
                session.kill();
                reaped++;
            }
        }
        if (reaped > 0) broadcastSessionList();
        return reaped;
    }

    public List<TerminalSessionSummary> sessionSummaries() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(TerminalSession::getCreatedAt))
                .map(TerminalSession::summary)
                .toList();
    }

    public Optional<TerminalSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void onShutdown() {
        if (sweepTask != null) sweepTask.cancel(false);
        sessions.values().forEach(TerminalSession::kill);
        log.info("Killed {} terminal sessions on shutdown", sessions.size());
        sessions.clear();
    }

    private TerminalSession require(String sessionId) {
        TerminalSession session = sessions.get(sessionId);
        if (session == null) throw ChannelException.sessionNotFound(sessionId);
        return session;
    }

    private WsMessage sessionsFrame() {
        return WsMessage.of("terminal:sessions", Map.of("sessions", sessionSummaries()));
    }

    private void broadcastSessionList() {
        context.broadcast(NAME, sessionsFrame());
    }

    private String newId() {
        String id;
        do {
            StringBuilder sb = new StringBuilder(ID_LENGTH);
            for (int i = 0; i < ID_LENGTH; i++) {
                sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
            }
            id = sb.toString();
        } while (sessions.containsKey(id));
        return id;
    }

    private static String truncateTitle(String title) {
        return title.length() > TITLE_LENGTH ? title.substring(0, TITLE_LENGTH) : title;
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

    private final class SessionListener implements ProcessListener {

        private final TerminalSession session;

        SessionListener(TerminalSession session) {
            this.session = session;
        }

        @Override
        public void onOutput(String data) {
            synchronized (session) {
                session.appendOutput(data, clock.instant());
                context.broadcast(roomOf(session.getId()),
                        WsMessage.of("terminal:data", Map.of("sessionId", session.getId(), "data", data)));
            }
        }

        @Override
        public void onExit(int exitCode) {
            synchronized (session) {
                session.markExited();
            }
            if (sessions.remove(session.getId(), session)) {
                log.info("Terminal session {} exited with code {}", session.getId(), exitCode);
                context.broadcast(roomOf(session.getId()), WsMessage.of("terminal:exit",
                        Map.of("sessionId", session.getId(), "code", exitCode)));
                context.closeRoom(roomOf(session.getId()));
                joined.values().forEach(ids -> ids.remove(session.getId()));
                broadcastSessionList();
            }
        }
    }
}
