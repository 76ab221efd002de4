package io.github.drompincen.devgateway.runtime.channel.chat;

import io.github.drompincen.devgateway.protocol.api.ChatResult;
import io.github.drompincen.devgateway.protocol.api.ChatSessionSummary;
import io.github.drompincen.devgateway.protocol.api.SessionState;
import io.github.drompincen.devgateway.persistence.store.ChatSessionRecord;
import io.github.drompincen.devgateway.runtime.agent.CancellationToken;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One agent conversation held in memory. All mutable state is guarded by the session's own
 * monitor; the channel appends and broadcasts under that same monitor so joins and replays
 * see a consistent buffer.
 */
public class ChatSession {

    private final String id;
    private final Instant startedAt;
    private final String cwd;
    private final EventRingBuffer buffer;
    private final CancellationToken cancellation = new CancellationToken();

    private SessionState state = SessionState.RUNNING;
    private Instant endedAt;
    private String model;
    private String title;
    private String resumeToken;
    private ChatResult result;
    private String error;

    public ChatSession(String id, Instant startedAt, String cwd, int bufferCapacity) {
        this.id = id;
        this.startedAt = startedAt;
        this.cwd = cwd;
        this.buffer = new EventRingBuffer(bufferCapacity);
    }

    public String getId() { return id; }
    public Instant getStartedAt() { return startedAt; }
    public String getCwd() { return cwd; }
    public CancellationToken cancellation() { return cancellation; }

    public synchronized EventRingBuffer buffer() { return buffer; }
    public synchronized SessionState getState() { return state; }
    public synchronized boolean isRunning() { return state == SessionState.RUNNING; }
    public synchronized Instant getEndedAt() { return endedAt; }
    public synchronized String getModel() { return model; }
    public synchronized void setModel(String model) { this.model = model; }
    public synchronized String getTitle() { return title; }
    public synchronized void setTitle(String title) { this.title = title; }
    public synchronized String getResumeToken() { return resumeToken; }
    public synchronized void setResumeToken(String resumeToken) { this.resumeToken = resumeToken; }
    public synchronized ChatResult getResult() { return result; }
    public synchronized String getError() { return error; }

    public synchronized boolean complete(ChatResult result, Instant at) {
        if (state != SessionState.RUNNING) return false;
        this.result = result;
        return finish(SessionState.COMPLETED, at);
    }

    public synchronized boolean fail(String error, Instant at) {
        if (state != SessionState.RUNNING) return false;
        this.error = error;
        return finish(SessionState.ERROR, at);
    }

    public synchronized boolean abort(Instant at) {
        if (state != SessionState.RUNNING) return false;
        return finish(SessionState.ABORTED, at);
    }

    private boolean finish(SessionState terminal, Instant at) {
        this.state = terminal;
        this.endedAt = at;
        return true;
    }

    public synchronized ChatSessionSummary summary() {
        return new ChatSessionSummary(id, state, startedAt, endedAt, model, title, ChatSessionSummary.SOURCE_GATEWAY);
    }

    /** Frame payload for {@code chat:state}. */
    public synchronized Map<String, Object> stateView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("sessionId", id);
        view.put("state", state);
        view.put("startedAt", startedAt);
        view.put("endedAt", endedAt);
        view.put("title", title);
        view.put("model", model);
        view.put("result", result);
        view.put("error", error);
        view.put("bufferSize", buffer.size());
        return view;
    }

    public synchronized ChatSessionRecord toRecord(int persistedEvents) {
        ChatSessionRecord rec = new ChatSessionRecord();
        rec.setId(id);
        rec.setResumeToken(resumeToken);
        rec.setState(state);
        rec.setStartedAt(startedAt);
        rec.setEndedAt(endedAt);
        rec.setCwd(cwd);
        rec.setModel(model);
        rec.setTitle(title);
        rec.setResult(result);
        rec.setError(error);
        rec.setEvents(buffer.tail(persistedEvents));
        return rec;
    }

    public synchronized Instant lastActivity() {
        return endedAt != null ? endedAt : startedAt;
    }
}
