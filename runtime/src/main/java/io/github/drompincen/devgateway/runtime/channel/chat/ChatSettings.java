package io.github.drompincen.devgateway.runtime.channel.chat;

import io.github.drompincen.devgateway.protocol.api.ModelOption;

import java.time.Duration;
import java.util.List;

/**
 * @param maxBufferEvents in-memory events kept per session
 * @param persistedEvents most recent events written to the session record; a session reloaded
 *                        after a restart replays only these
 */
public record ChatSettings(
        int maxBufferEvents,
        int persistedEvents,
        Duration evictionDelay,
        String defaultCwd,
        String permissionMode,
        int historyLimit,
        List<ModelOption> models
) {
    public ChatSettings {
        models = models == null ? List.of() : List.copyOf(models);
    }
}
