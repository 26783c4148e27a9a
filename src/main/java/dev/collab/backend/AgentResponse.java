package dev.collab.backend;

/**
 * Raw answer from an agent proxy invocation.
 */
public record AgentResponse(
    boolean success,
    String responseText,
    String error
) {
    public static AgentResponse ok(String responseText) {
        return new AgentResponse(true, responseText, null);
    }

    public static AgentResponse failed(String error) {
        return new AgentResponse(false, null, error);
    }
}
