package io.github.drompincen.devgateway.runtime.channel;

import io.github.drompincen.devgateway.protocol.ws.WsMessage;

/**
 * One client's message-framed transport, as seen by channels. Implementations must make
 * {@link #send} safe to call from any thread and must not throw on a closed transport.
 */
public interface Connection {

    String id();

    boolean isOpen();

    void send(WsMessage message);
}
