package io.github.drompincen.devgateway.runtime.channel;

/**
 * A per-operation failure reported back to the requesting connection as an {@code error} frame.
 */
public class ChannelException extends RuntimeException {

    private final ErrorCode code;
    private final String sessionId;

    public ChannelException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public ChannelException(ErrorCode code, String message, String sessionId) {
        this(code, message, sessionId, null);
    }

    public ChannelException(ErrorCode code, String message, String sessionId, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.sessionId = sessionId;
    }

    public static ChannelException sessionNotFound(String sessionId) {
        return new ChannelException(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId, sessionId);
    }

    public static ChannelException invalidRequest(String message) {
        return new ChannelException(ErrorCode.INVALID_REQUEST, message);
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getSessionId() {
        return sessionId;
    }
}
