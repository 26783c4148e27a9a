package dev.collab.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of driving a session until it stopped.
 */
public record RunResult(
    String sessionId,
    RunStatus status,
    String finalState,
    int turnCount,
    boolean errorFlag,
    String reason,
    Map<String, DecisionValue> decisions,
    List<TurnRecord> history,
    TurnFailure failure // null unless the run aborted
) {
    public RunResult {
        decisions = Map.copyOf(decisions);
        history = List.copyOf(history);
    }

    public String lastContent() {
        return history.isEmpty() ? "" : history.get(history.size() - 1).content();
    }
}
