package io.github.drompincen.devgateway.protocol.api;

/** An agent model the client may pick, as listed by {@code chat:models}. */
public record ModelOption(String value, String displayName, String description) {}
