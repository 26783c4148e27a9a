package dev.collab.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A validated, immutable workflow: agents, states, transitions and exit conditions.
 * States live in a name-indexed table, so cycles between states are plain name references.
 * Instances are safe to share between concurrently running sessions.
 */
public record WorkflowDefinition(
    String name,
    String description,
    String initialMessage,
    int maxTurns,
    Map<String, AgentSpec> agents,
    Map<String, StateSpec> states,
    List<ExitCondition> exitConditions
) {
    public WorkflowDefinition {
        agents = Collections.unmodifiableMap(new LinkedHashMap<>(agents));
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        exitConditions = List.copyOf(exitConditions);
    }

    public Optional<StateSpec> state(String stateName) {
        return Optional.ofNullable(states.get(stateName));
    }

    public StateSpec startState() {
        return states.values().stream()
            .filter(StateSpec::start)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Workflow '%s' has no start state".formatted(name)));
    }

    /** Agent type for the agent acting in the given state. */
    public AgentType agentTypeOf(StateSpec state) {
        AgentSpec agent = agents.get(state.agent());
        if (agent == null) {
            throw new IllegalStateException("State '%s' references unknown agent '%s'"
                .formatted(state.name(), state.agent()));
        }
        return agent.type();
    }
}
