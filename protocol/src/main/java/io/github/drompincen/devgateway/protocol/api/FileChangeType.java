package io.github.drompincen.devgateway.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FileChangeType {
    ADD("add"),
    CHANGE("change"),
    UNLINK("unlink"),
    ADD_DIR("addDir"),
    UNLINK_DIR("unlinkDir");

    private final String wireName;

    FileChangeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
