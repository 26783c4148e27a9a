package dev.collab.engine;

import dev.collab.model.RunResult;
import dev.collab.model.StateSpec;
import dev.collab.model.TurnRecord;

/**
 * Lifecycle hooks around a run. All methods default to no-ops.
 */
public interface WorkflowListener {

    WorkflowListener NONE = new WorkflowListener() {};

    default void onRunStart(ExecutionContext context) {}

    default void onStateEnter(ExecutionContext context, StateSpec state) {}

    default void onStateExit(ExecutionContext context, StateSpec state, TurnRecord record) {}

    default void onRunEnd(RunResult result) {}
}
