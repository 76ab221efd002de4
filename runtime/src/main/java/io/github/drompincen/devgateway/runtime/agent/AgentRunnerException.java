package io.github.drompincen.devgateway.runtime.agent;

public class AgentRunnerException extends Exception {

    public AgentRunnerException(String message) {
        super(message);
    }

    public AgentRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
