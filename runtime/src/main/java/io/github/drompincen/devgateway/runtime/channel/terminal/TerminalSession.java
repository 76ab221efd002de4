package io.github.drompincen.devgateway.runtime.channel.terminal;

import io.github.drompincen.devgateway.protocol.api.TerminalSessionSummary;
import io.github.drompincen.devgateway.runtime.process.TerminalProcess;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One pseudo-terminal process and its scrollback. Guarded by its own monitor; output is
 * appended and broadcast under it so a join sees either all of a chunk or none of it.
 */
public class TerminalSession {

    private final String id;
    private final String cwd;
    private final Instant createdAt;
    private final ScrollbackBuffer scrollback;
    private final Set<String> subscribers = new HashSet<>();

    private TerminalProcess process;
    private String title;
    private int cols;
    private int rows;
    private Instant lastActivityAt;
    private boolean exited;

    public TerminalSession(String id, String title, String cwd, int cols, int rows, int scrollbackChars, Instant now) {
        this.id = id;
        this.title = title;
        this.cwd = cwd;
        this.cols = cols;
        this.rows = rows;
        this.createdAt = now;
        this.lastActivityAt = now;
        this.scrollback = new ScrollbackBuffer(scrollbackChars);
    }

    public String getId() { return id; }
    public String getCwd() { return cwd; }
    public Instant getCreatedAt() { return createdAt; }

    public synchronized TerminalProcess process() { return process; }
    synchronized void attach(TerminalProcess process) { this.process = process; }

    public synchronized String getTitle() { return title; }
    public synchronized void setTitle(String title) { this.title = title; }
    public synchronized int getCols() { return cols; }
    public synchronized int getRows() { return rows; }
    public synchronized Instant getLastActivityAt() { return lastActivityAt; }
    public synchronized boolean isExited() { return exited; }
    synchronized void markExited() { this.exited = true; }

    public synchronized void touch(Instant now) {
        this.lastActivityAt = now;
    }

    public synchronized void appendOutput(String data, Instant now) {
        scrollback.append(data);
        lastActivityAt = now;
    }

    public synchronized String scrollback() {
        return scrollback.contents();
    }

    public synchronized void resize(int cols, int rows) {
        this.cols = cols;
        this.rows = rows;
        if (process != null) process.resize(cols, rows);
    }

    public synchronized boolean addSubscriber(String connectionId) { return subscribers.add(connectionId); }
    public synchronized boolean removeSubscriber(String connectionId) { return subscribers.remove(connectionId); }
    public synchronized int subscriberCount() { return subscribers.size(); }

    public synchronized boolean isIdle(Instant now, Duration timeout) {
        return subscribers.isEmpty() && Duration.between(lastActivityAt, now).compareTo(timeout) > 0;
    }

    public synchronized void kill() {
        if (process != null) process.kill();
    }

    public synchronized TerminalSessionSummary summary() {
        return new TerminalSessionSummary(id, title, cwd, createdAt, lastActivityAt, !subscribers.isEmpty(),
                scrollback.preview(), cols, rows);
    }

    /** Frame payload for {@code terminal:joined}. */
    public synchronized Map<String, Object> joinedView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("sessionId", id);
        view.put("buffer", scrollback.contents());
        view.put("cols", cols);
        view.put("rows", rows);
        view.put("title", title);
        view.put("cwd", cwd);
        return view;
    }
}
