package dev.collab.model;

import dev.collab.condition.Condition;

/**
 * A conditioned edge leaving a state. The target is either another state or {@link #END}.
 */
public record Transition(String to, Condition condition) {

    public static final String END = "END";

    public boolean endsRun() {
        return END.equals(to);
    }
}
