package io.github.drompincen.devgateway.runtime.agent;

public interface AgentRunner {

    AgentRun start(AgentRequest request, CancellationToken cancellation) throws AgentRunnerException;
}
