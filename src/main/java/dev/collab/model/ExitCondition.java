package dev.collab.model;

import dev.collab.condition.Condition;

/**
 * A global condition checked before every turn, regardless of the current state.
 */
public record ExitCondition(Condition condition, ExitAction action) {}
