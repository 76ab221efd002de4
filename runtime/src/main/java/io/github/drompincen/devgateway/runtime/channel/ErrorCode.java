package io.github.drompincen.devgateway.runtime.channel;

public enum ErrorCode {
    UNAUTHORIZED,
    UNKNOWN_CHANNEL,
    UNSUPPORTED_MESSAGE,
    INVALID_REQUEST,
    SESSION_NOT_FOUND,
    ALREADY_RUNNING,
    SESSION_LIMIT,
    RUNNER_FAILURE,
    PROCESS_SPAWN_FAILURE,
    UPSTREAM_UNAVAILABLE,
    INTERNAL
}
