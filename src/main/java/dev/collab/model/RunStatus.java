package dev.collab.model;

/**
 * Lifecycle of a single run.
 */
public enum RunStatus {
    IDLE,
    RUNNING,
    /** Workflow-directed completion: END, no matching transition, or an exit condition. */
    TERMINATED,
    /** A turn failed: unparseable response, proxy failure or timeout. */
    ABORTED,
    /** Safety stop: max_turns reached before the workflow ended itself. */
    HALTED,
    /** Cooperative cancellation at the top of a turn. */
    CANCELLED;

    public boolean resumable() {
        return this == RUNNING || this == ABORTED || this == CANCELLED;
    }
}
