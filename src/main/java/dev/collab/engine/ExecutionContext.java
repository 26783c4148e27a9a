package dev.collab.engine;

import dev.collab.backend.Workspace;
import dev.collab.model.DecisionValue;
import dev.collab.model.RunResult;
import dev.collab.model.RunStatus;
import dev.collab.model.StateSpec;
import dev.collab.model.TurnFailure;
import dev.collab.model.TurnRecord;
import dev.collab.model.WorkflowDefinition;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable state of one run. Owned by the driver running it; not thread-safe.
 *
 * <p>Decisions accumulate for the whole run: each turn's keys overwrite earlier
 * values of the same name and every other key is kept. The workspace handle never
 * changes, so later turns see earlier turns' files.
 */
public final class ExecutionContext {

    private final String sessionId;
    private final WorkflowDefinition workflow;
    private final Workspace workspace;
    private String currentState;
    private int turnCount;
    private RunStatus status;
    private String error;
    private String reason;
    private TurnFailure failure;
    private final Map<String, DecisionValue> decisions;
    private final List<TurnRecord> history;
    private final Map<String, Integer> stateTurnCounts;

    private ExecutionContext(String sessionId, WorkflowDefinition workflow, Workspace workspace, String currentState) {
        this.sessionId = sessionId;
        this.workflow = workflow;
        this.workspace = workspace;
        this.currentState = currentState;
        this.turnCount = 0;
        this.status = RunStatus.IDLE;
        this.decisions = new LinkedHashMap<>();
        this.history = new ArrayList<>();
        this.stateTurnCounts = new HashMap<>();
    }

    /**
     * Create a fresh context positioned at the workflow's start state.
     */
    public static ExecutionContext start(WorkflowDefinition workflow, Workspace workspace) {
        return new ExecutionContext(UUID.randomUUID().toString(), workflow, workspace, workflow.startState().name());
    }

    public String sessionId() { return sessionId; }
    public WorkflowDefinition workflow() { return workflow; }
    public Workspace workspace() { return workspace; }
    public String currentState() { return currentState; }
    public int turnCount() { return turnCount; }
    public RunStatus status() { return status; }
    public String error() { return error; }
    public String reason() { return reason; }
    public TurnFailure failure() { return failure; }

    public Map<String, DecisionValue> decisions() {
        return Collections.unmodifiableMap(decisions);
    }

    public List<TurnRecord> history() {
        return Collections.unmodifiableList(history);
    }

    public boolean errorOccurred() {
        return error != null;
    }

    public int stateTurnCount(String agent, String state) {
        return stateTurnCounts.getOrDefault(counterKey(agent, state), 0);
    }

    void markRunning() {
        this.status = RunStatus.RUNNING;
        this.reason = null;
        // a resumed abort keeps error_occurred set but drops the stale failure
        this.failure = null;
    }

    /**
     * Merge one turn's decisions: new keys win, all other accumulated keys are kept.
     */
    public void mergeDecisions(Map<String, DecisionValue> turnDecisions) {
        decisions.putAll(turnDecisions);
    }

    /**
     * Append a completed turn and advance the turn counter.
     */
    public void recordTurn(TurnRecord record) {
        history.add(record);
        turnCount++;
        stateTurnCounts.merge(counterKey(record.agent(), record.state()), 1, Integer::sum);
    }

    public void moveTo(String nextState) {
        this.currentState = nextState;
    }

    public void flagError(String message) {
        this.error = message;
    }

    void finish(RunStatus finalStatus, String finalReason) {
        this.status = finalStatus;
        this.reason = finalReason;
    }

    void abort(TurnFailure turnFailure) {
        this.failure = turnFailure;
        this.error = turnFailure.error();
        finish(RunStatus.ABORTED, turnFailure.error());
    }

    /**
     * Flat variables visible to conditions: accumulated decisions plus derived
     * keys. Derived keys shadow decisions with the same name.
     */
    public Map<String, DecisionValue> conditionVariables() {
        var variables = new LinkedHashMap<String, DecisionValue>(decisions);
        stateTurnCounts.forEach((key, count) -> variables.put("turn_count_" + key, DecisionValue.of(count)));
        variables.put("turn_count", DecisionValue.of(turnCount));
        variables.put("max_turns", DecisionValue.of(workflow.maxTurns()));
        variables.put("max_turns_exceeded", DecisionValue.of(turnCount >= workflow.maxTurns()));
        variables.put("error_occurred", DecisionValue.of(errorOccurred()));
        variables.put("current_state", DecisionValue.of(currentState));
        variables.put("last_agent", DecisionValue.of(lastTurn() == null ? "" : lastTurn().agent()));
        return variables;
    }

    /**
     * Variables visible to prompt templates: accumulated decisions plus the fixed
     * set describing the previous turn. Fixed names win over decision keys.
     */
    public Map<String, DecisionValue> templateVariables() {
        TurnRecord last = lastTurn();
        var variables = new LinkedHashMap<String, DecisionValue>(decisions);
        variables.put("initial_message", DecisionValue.of(workflow.initialMessage()));
        variables.put("workflow_name", DecisionValue.of(workflow.name()));
        variables.put("current_state", DecisionValue.of(currentState));
        variables.put("turn_count", DecisionValue.of(turnCount));
        variables.put("last_agent_name", DecisionValue.of(last == null ? "" : last.agent()));
        variables.put("last_agent_content", DecisionValue.of(last == null ? "" : last.content()));
        variables.put("last_agent_decisions", DecisionValue.of(
            last == null ? "{}" : DecisionValue.mapToJson(last.decisions()).toString()));
        return variables;
    }

    private TurnRecord lastTurn() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public RunResult toResult() {
        return new RunResult(sessionId, status, currentState, turnCount, errorOccurred(), reason,
            decisions, history, failure);
    }

    public PersistedSession toPersisted() {
        var turns = new ArrayList<PersistedSession.Turn>(history.size());
        for (TurnRecord record : history) {
            turns.add(new PersistedSession.Turn(record.turn(), record.state(), record.agent(), record.prompt(),
                record.rawResponse(), record.content(), DecisionValue.mapToJson(record.decisions())));
        }
        return new PersistedSession(sessionId, workflow.name(), status, currentState, turnCount, error, reason,
            workspace == null ? null : workspace.root().toString(), DecisionValue.mapToJson(decisions),
            stateTurnCounts, turns, failure);
    }

    /**
     * Rebuild a context from its persisted form.
     *
     * @param workspace workspace to continue in; when null the persisted path is reused
     * @throws IllegalArgumentException if the session belongs to another workflow or
     *                                  names a state the workflow does not declare
     */
    public static ExecutionContext restore(WorkflowDefinition workflow, PersistedSession persisted, Workspace workspace) {
        if (!workflow.name().equals(persisted.workflowName())) {
            throw new IllegalArgumentException("Session %s belongs to workflow '%s', not '%s'"
                .formatted(persisted.sessionId(), persisted.workflowName(), workflow.name()));
        }
        StateSpec state = workflow.state(persisted.currentState()).orElseThrow(() -> new IllegalArgumentException(
            "Session %s is at state '%s', which workflow '%s' does not declare"
                .formatted(persisted.sessionId(), persisted.currentState(), workflow.name())));

        Workspace resolved = workspace;
        if (resolved == null && persisted.workspace() != null) {
            resolved = new Workspace(Path.of(persisted.workspace()));
        }

        var context = new ExecutionContext(persisted.sessionId(), workflow, resolved, state.name());
        context.turnCount = persisted.turnCount();
        context.status = persisted.status();
        context.error = persisted.error();
        context.reason = persisted.reason();
        context.failure = persisted.failure();
        context.decisions.putAll(DecisionValue.mapFromJson(persisted.accumulatedDecisions()));
        context.stateTurnCounts.putAll(persisted.stateTurnCounts());
        for (PersistedSession.Turn turn : persisted.turnHistory()) {
            context.history.add(new TurnRecord(turn.turn(), turn.state(), turn.agent(), turn.prompt(),
                turn.rawResponse(), turn.content(), DecisionValue.mapFromJson(turn.decisions())));
        }
        return context;
    }

    private static String counterKey(String agent, String state) {
        return agent + "_" + state;
    }
}
