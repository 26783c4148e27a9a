package dev.collab.backend;

/**
 * Abstraction over the coding agent that acts on a turn (Aider, a CLI agent, a test double).
 * Implementations may block for a long time; the driver applies its own timeout.
 */
public interface AgentProxy {

    /**
     * Send a rendered prompt to the agent and return its raw text.
     *
     * @param request agent identity, capability tag, shared workspace and prompt
     * @return the raw response, or a failed response with an error message
     */
    AgentResponse invoke(AgentRequest request);

    /** Get proxy display name. */
    String getName();
}
