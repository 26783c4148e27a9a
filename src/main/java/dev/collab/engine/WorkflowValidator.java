package dev.collab.engine;

import dev.collab.model.AgentSpec;
import dev.collab.model.StateSpec;
import dev.collab.model.Transition;
import dev.collab.model.WorkflowDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks the cross-reference invariants of a workflow definition.
 */
public final class WorkflowValidator {

    private WorkflowValidator() {}

    /**
     * Validate a workflow definition. Returns an empty list if valid,
     * or every violation found if invalid.
     */
    public static List<String> validate(WorkflowDefinition workflow) {
        var errors = new ArrayList<String>();

        if (workflow.name() == null || workflow.name().isBlank()) {
            errors.add("Workflow has missing or empty name");
        }
        if (workflow.maxTurns() <= 0) {
            errors.add("max_turns must be greater than 0, got " + workflow.maxTurns());
        }
        if (workflow.agents().isEmpty()) {
            errors.add("Workflow declares no agents");
        }
        if (workflow.states().isEmpty()) {
            errors.add("Workflow declares no states");
        }

        for (var entry : workflow.agents().entrySet()) {
            AgentSpec agent = entry.getValue();
            if (!entry.getKey().equals(agent.name())) {
                errors.add("Agent '%s' is registered under a different key '%s'".formatted(agent.name(), entry.getKey()));
            }
            if (agent.type() == null) {
                errors.add("Agent '%s' has no type".formatted(agent.name()));
            }
        }

        List<String> startStates = workflow.states().values().stream()
            .filter(StateSpec::start)
            .map(StateSpec::name)
            .collect(Collectors.toList());
        if (!workflow.states().isEmpty() && startStates.isEmpty()) {
            errors.add("No state is marked start: true");
        } else if (startStates.size() > 1) {
            errors.add("Exactly one start state allowed, found %d: %s".formatted(startStates.size(), startStates));
        }

        for (var entry : workflow.states().entrySet()) {
            validateState(entry.getKey(), entry.getValue(), workflow.agents(), workflow.states(), errors);
        }

        return errors;
    }

    private static void validateState(String key, StateSpec state, Map<String, AgentSpec> agents,
                                      Map<String, StateSpec> states, List<String> errors) {
        if (!key.equals(state.name())) {
            errors.add("State '%s' is registered under a different key '%s'".formatted(state.name(), key));
        }
        if (state.agent() == null || !agents.containsKey(state.agent())) {
            errors.add("State '%s': agent '%s' is not declared".formatted(state.name(), state.agent()));
        }
        if (state.prompt() == null) {
            errors.add("State '%s' has no prompt".formatted(state.name()));
        }

        List<Transition> transitions = state.transitions();
        for (int i = 0; i < transitions.size(); i++) {
            Transition transition = transitions.get(i);
            String target = transition.to();
            if (target == null || target.isBlank()) {
                errors.add("State '%s': transition #%d has no target".formatted(state.name(), i + 1));
            } else if (!transition.endsRun() && !states.containsKey(target)) {
                errors.add("State '%s': transition #%d target '%s' not found in states"
                    .formatted(state.name(), i + 1, target));
            }
            if (transition.condition() == null) {
                errors.add("State '%s': transition #%d has no compiled condition".formatted(state.name(), i + 1));
            }
        }
    }
}
