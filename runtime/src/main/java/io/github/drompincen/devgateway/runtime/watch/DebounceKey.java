package io.github.drompincen.devgateway.runtime.watch;

import io.github.drompincen.devgateway.protocol.api.FileChangeType;

/** Coalescing key for file events: one pending notification per change type and relative path. */
public record DebounceKey(FileChangeType type, String relativePath) {}
