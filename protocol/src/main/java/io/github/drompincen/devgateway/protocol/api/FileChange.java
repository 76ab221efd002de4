package io.github.drompincen.devgateway.protocol.api;

import java.time.Instant;

/**
 * A debounced filesystem notification. {@code path} is relative to the watched root.
 */
public record FileChange(
        FileChangeType type,
        String path,
        String fullPath,
        Instant timestamp
) {}
