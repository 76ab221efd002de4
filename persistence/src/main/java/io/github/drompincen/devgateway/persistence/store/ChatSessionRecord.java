package io.github.drompincen.devgateway.persistence.store;

import io.github.drompincen.devgateway.protocol.api.ChatResult;
import io.github.drompincen.devgateway.protocol.api.SessionState;
import io.github.drompincen.devgateway.protocol.event.ChatEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of a chat session. {@code events} holds only the most recent tail of the
 * session's buffer.
 */
public class ChatSessionRecord {

    private String id;
    private String resumeToken;
    private SessionState state;
    private Instant startedAt;
    private Instant endedAt;
    private String cwd;
    private String model;
    private String title;
    private ChatResult result;
    private String error;
    private List<ChatEvent> events = new ArrayList<>();

    public ChatSessionRecord() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getResumeToken() { return resumeToken; }
    public void setResumeToken(String resumeToken) { this.resumeToken = resumeToken; }

    public SessionState getState() { return state; }
    public void setState(SessionState state) { this.state = state; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getEndedAt() { return endedAt; }
    public void setEndedAt(Instant endedAt) { this.endedAt = endedAt; }

    public String getCwd() { return cwd; }
    public void setCwd(String cwd) { this.cwd = cwd; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public ChatResult getResult() { return result; }
    public void setResult(ChatResult result) { this.result = result; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public List<ChatEvent> getEvents() { return events; }
    public void setEvents(List<ChatEvent> events) { this.events = events != null ? events : new ArrayList<>(); }

    /** Sort key for listing: end time when finished, otherwise start time. */
    public Instant lastActivity() {
        if (endedAt != null) return endedAt;
        return startedAt != null ? startedAt : Instant.EPOCH;
    }
}
