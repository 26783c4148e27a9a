package dev.collab.backend;

import dev.collab.model.AgentType;

/**
 * Input for one agent turn.
 */
public record AgentRequest(
    String agentName,
    AgentType agentType,
    Workspace workspace,
    String prompt
) {}
