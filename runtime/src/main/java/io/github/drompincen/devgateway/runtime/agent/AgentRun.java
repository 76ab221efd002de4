package io.github.drompincen.devgateway.runtime.agent;

import io.github.drompincen.devgateway.protocol.event.ChatEvent;

import java.util.Optional;

/**
 * A started agent run, read as a blocking sequence of events.
 */
public interface AgentRun extends AutoCloseable {

    /**
     * Blocks until the next event is available.
     *
     * @return the next event, or empty once the run has finished normally
     * @throws AgentRunnerException if the pipeline failed
     */
    Optional<ChatEvent> next() throws AgentRunnerException;

    /** The token to resume this conversation later, once the agent has reported it. */
    String resumeToken();

    @Override
    void close();
}
