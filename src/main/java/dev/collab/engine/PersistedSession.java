package dev.collab.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.collab.model.RunStatus;
import dev.collab.model.TurnFailure;

import java.util.List;
import java.util.Map;

/**
 * On-disk form of an execution context: enough to resume a running session or
 * audit a finished one.
 */
public record PersistedSession(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("workflow_name") String workflowName,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("current_state") String currentState,
    @JsonProperty("turn_count") int turnCount,
    @JsonProperty("error") String error,
    @JsonProperty("reason") String reason,
    @JsonProperty("workspace") String workspace,
    @JsonProperty("accumulated_decisions") ObjectNode accumulatedDecisions,
    @JsonProperty("state_turn_counts") Map<String, Integer> stateTurnCounts,
    @JsonProperty("turn_history") List<Turn> turnHistory,
    @JsonProperty("failure") TurnFailure failure
) {
    public PersistedSession {
        stateTurnCounts = stateTurnCounts == null ? Map.of() : Map.copyOf(stateTurnCounts);
        turnHistory = turnHistory == null ? List.of() : List.copyOf(turnHistory);
    }

    public record Turn(
        @JsonProperty("turn") int turn,
        @JsonProperty("state") String state,
        @JsonProperty("agent") String agent,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("raw_response") String rawResponse,
        @JsonProperty("content") String content,
        @JsonProperty("decisions") ObjectNode decisions
    ) {}
}
