package io.github.drompincen.devgateway.runtime.agent;

/**
 * Input for one agent run. {@code resumeToken} continues an earlier conversation when set.
 */
public record AgentRequest(
        String prompt,
        String resumeToken,
        String cwd,
        String model,
        String permissionMode
) {}
