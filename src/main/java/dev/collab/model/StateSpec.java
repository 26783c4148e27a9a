package dev.collab.model;

import dev.collab.template.PromptTemplate;

import java.util.List;

/**
 * A named point in the workflow where one agent acts once per visit.
 * Transitions are evaluated in declared order; the first match wins.
 */
public record StateSpec(
    String name,
    String agent,
    boolean start,
    PromptTemplate prompt,
    List<Transition> transitions
) {
    public StateSpec {
        transitions = List.copyOf(transitions);
    }
}
