package dev.collab.model;

/**
 * A declared participant of a workflow.
 */
public record AgentSpec(String name, AgentType type) {}
