package io.github.drompincen.devgateway.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionState {
    RUNNING,
    COMPLETED,
    ERROR,
    ABORTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static SessionState fromWire(String value) {
        return valueOf(value.toUpperCase());
    }
}
