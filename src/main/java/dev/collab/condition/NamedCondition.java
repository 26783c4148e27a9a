package dev.collab.condition;

import dev.collab.model.DecisionValue;

import java.util.Map;

/**
 * A workflow-specific predicate registered under a name. A bare identifier with
 * that name in a condition evaluates the predicate instead of a decision lookup.
 */
@FunctionalInterface
public interface NamedCondition {

    boolean test(Map<String, DecisionValue> variables);
}
