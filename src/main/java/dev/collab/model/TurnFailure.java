package dev.collab.model;

/**
 * Diagnostics for the turn that aborted a run. {@code rawResponse} is null when
 * the agent never answered.
 */
public record TurnFailure(
    int turn,
    String state,
    String agent,
    String prompt,
    String rawResponse,
    String error
) {}
