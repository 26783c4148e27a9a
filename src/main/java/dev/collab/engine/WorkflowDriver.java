package dev.collab.engine;

import dev.collab.backend.AgentProxy;
import dev.collab.backend.AgentRequest;
import dev.collab.backend.AgentResponse;
import dev.collab.backend.Workspace;
import dev.collab.condition.ConditionEvaluator;
import dev.collab.model.DecisionValue;
import dev.collab.model.ExitAction;
import dev.collab.model.ExitCondition;
import dev.collab.model.ExtractionResult;
import dev.collab.model.RunResult;
import dev.collab.model.RunStatus;
import dev.collab.model.StateSpec;
import dev.collab.model.Transition;
import dev.collab.model.TurnFailure;
import dev.collab.model.TurnRecord;
import dev.collab.model.WorkflowDefinition;
import dev.collab.template.PromptRenderer;
import dev.collab.template.RenderedPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a workflow turn by turn. Each turn, in order:
 *
 * <ol>
 *   <li>stop if cancelled</li>
 *   <li>check exit conditions (always before any state-local logic)</li>
 *   <li>halt if max_turns turns have completed</li>
 *   <li>render the state's prompt</li>
 *   <li>invoke the agent</li>
 *   <li>extract the trailing control block</li>
 *   <li>merge decisions into the session</li>
 *   <li>pick the first matching transition</li>
 *   <li>record the turn</li>
 * </ol>
 *
 * <p>A driver holds no per-run state; one instance can drive many sessions
 * concurrently, each on its own thread with its own context.
 */
public final class WorkflowDriver {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDriver.class);

    private final AgentProxy agentProxy;
    private final SessionStore sessionStore;
    private final DriverConfig config;
    private final ConditionEvaluator evaluator;
    private final PromptRenderer renderer;
    private final WorkflowListener listener;

    public WorkflowDriver(AgentProxy agentProxy, SessionStore sessionStore) {
        this(agentProxy, sessionStore, DriverConfig.defaults());
    }

    public WorkflowDriver(AgentProxy agentProxy, SessionStore sessionStore, DriverConfig config) {
        this(agentProxy, sessionStore, config, new ConditionEvaluator(), WorkflowListener.NONE);
    }

    public WorkflowDriver(AgentProxy agentProxy, SessionStore sessionStore, DriverConfig config,
                          ConditionEvaluator evaluator, WorkflowListener listener) {
        this.agentProxy = agentProxy;
        this.sessionStore = sessionStore;
        this.config = config;
        this.evaluator = evaluator;
        this.renderer = new PromptRenderer(config.collaborationGuide());
        this.listener = listener;
    }

    /**
     * Start a new session at the workflow's start state and drive it to a stop.
     */
    public RunResult run(WorkflowDefinition workflow, Workspace workspace) {
        return run(workflow, workspace, CancellationToken.none());
    }

    public RunResult run(WorkflowDefinition workflow, Workspace workspace, CancellationToken cancellation) {
        ExecutionContext context = ExecutionContext.start(workflow, workspace);
        log.info("Starting workflow '{}' session {} at state '{}'",
            workflow.name(), context.sessionId(), context.currentState());
        return drive(context, cancellation);
    }

    /**
     * Continue a persisted session from its current state.
     *
     * @throws IllegalStateException if the session already terminated or halted
     */
    public RunResult resume(WorkflowDefinition workflow, PersistedSession persisted, Workspace workspace) {
        return resume(workflow, persisted, workspace, CancellationToken.none());
    }

    public RunResult resume(WorkflowDefinition workflow, PersistedSession persisted, Workspace workspace,
                            CancellationToken cancellation) {
        if (persisted.status() == null || !persisted.status().resumable()) {
            throw new IllegalStateException("Session %s is %s and cannot be resumed"
                .formatted(persisted.sessionId(), persisted.status()));
        }
        ExecutionContext context = ExecutionContext.restore(workflow, persisted, workspace);
        log.info("Resuming workflow '{}' session {} at state '{}' after {} turns",
            workflow.name(), context.sessionId(), context.currentState(), context.turnCount());
        return drive(context, cancellation);
    }

    private RunResult drive(ExecutionContext context, CancellationToken cancellation) {
        WorkflowDefinition workflow = context.workflow();
        context.markRunning();
        listener.onRunStart(context);

        while (true) {
            if (cancellation.isCancelled()) {
                log.info("Session {} cancelled before turn {}", context.sessionId(), context.turnCount() + 1);
                return stop(context, RunStatus.CANCELLED, "cancelled");
            }

            Optional<ExitCondition> exit = firstMatchingExit(context);
            if (exit.isPresent()) {
                ExitCondition hit = exit.get();
                log.warn("Exit condition '{}' matched in session {}, action {}",
                    hit.condition(), context.sessionId(), hit.action().id());
                if (hit.action() == ExitAction.SAVE_AND_END) {
                    context.flagError("Exit condition matched: " + hit.condition());
                }
                return stop(context, RunStatus.TERMINATED, "exit condition: " + hit.condition());
            }

            if (context.turnCount() >= workflow.maxTurns()) {
                log.warn("Session {} halted after {} turns (max_turns={})",
                    context.sessionId(), context.turnCount(), workflow.maxTurns());
                return stop(context, RunStatus.HALTED, "max_turns reached");
            }

            StateSpec state = workflow.state(context.currentState()).orElseThrow(() -> new IllegalStateException(
                "Unknown state '%s' in workflow '%s'".formatted(context.currentState(), workflow.name())));
            int turn = context.turnCount() + 1;
            listener.onStateEnter(context, state);

            RenderedPrompt prompt = renderer.render(state.prompt(), context.templateVariables());
            log.info("Turn {}: state '{}' agent '{}'", turn, state.name(), state.agent());

            AgentResponse response = invokeAgent(new AgentRequest(state.agent(), workflow.agentTypeOf(state),
                context.workspace(), prompt.text()));
            if (!response.success()) {
                return abort(context, new TurnFailure(turn, state.name(), state.agent(), prompt.text(),
                    response.responseText(), response.error()));
            }

            ExtractionResult extraction = ResponseExtractor.extract(response.responseText());
            if (extraction instanceof ExtractionResult.Failure failure) {
                return abort(context, new TurnFailure(turn, state.name(), state.agent(), prompt.text(),
                    response.responseText(), "Response format error: " + failure.error()));
            }
            var success = (ExtractionResult.Success) extraction;
            context.mergeDecisions(success.decisions());

            Optional<Transition> next = firstMatchingTransition(state, context.conditionVariables());

            var record = new TurnRecord(turn, state.name(), state.agent(), prompt.text(),
                response.responseText(), success.content(), success.decisions());
            context.recordTurn(record);
            listener.onStateExit(context, state, record);

            if (next.isEmpty()) {
                if (config.noMatchPolicy() == NoMatchPolicy.STAY) {
                    log.debug("No transition matched in state '{}', staying", state.name());
                    checkpoint(context);
                    continue;
                }
                log.info("No transition matched in state '{}', terminating", state.name());
                return stop(context, RunStatus.TERMINATED, "no transition matched in state '%s'".formatted(state.name()));
            }
            Transition transition = next.get();
            if (transition.endsRun()) {
                log.info("State '{}' transitioned to END", state.name());
                return stop(context, RunStatus.TERMINATED, "reached END");
            }
            log.info("Transition '{}' -> '{}' on '{}'", state.name(), transition.to(), transition.condition());
            context.moveTo(transition.to());
            checkpoint(context);
        }
    }

    private Optional<ExitCondition> firstMatchingExit(ExecutionContext context) {
        Map<String, DecisionValue> variables = context.conditionVariables();
        return context.workflow().exitConditions().stream()
            .filter(exit -> evaluator.evaluate(exit.condition(), variables))
            .findFirst();
    }

    private Optional<Transition> firstMatchingTransition(StateSpec state, Map<String, DecisionValue> variables) {
        return state.transitions().stream()
            .filter(transition -> evaluator.evaluate(transition.condition(), variables))
            .findFirst();
    }

    /**
     * Call the agent proxy, applying the per-turn timeout when one is configured.
     * Proxy exceptions and timeouts come back as failed responses.
     */
    private AgentResponse invokeAgent(AgentRequest request) {
        if (config.turnTimeout() == null) {
            try {
                return agentProxy.invoke(request);
            } catch (RuntimeException e) {
                log.warn("Agent proxy '{}' failed for '{}'", agentProxy.getName(), request.agentName(), e);
                return AgentResponse.failed("Agent proxy failed: " + e.getMessage());
            }
        }

        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "agent-" + request.agentName());
            thread.setDaemon(true);
            return thread;
        });
        Future<AgentResponse> future = executor.submit(() -> agentProxy.invoke(request));
        try {
            return future.get(config.turnTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return AgentResponse.failed("Agent '%s' timed out after %s".formatted(request.agentName(), config.turnTimeout()));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Agent proxy '{}' failed for '{}'", agentProxy.getName(), request.agentName(), cause);
            return AgentResponse.failed("Agent proxy failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return AgentResponse.failed("Interrupted while waiting for agent '%s'".formatted(request.agentName()));
        } finally {
            executor.shutdownNow();
        }
    }

    private RunResult abort(ExecutionContext context, TurnFailure failure) {
        log.warn("Session {} aborted on turn {} in state '{}': {}",
            context.sessionId(), failure.turn(), failure.state(), failure.error());
        context.abort(failure);
        persist(context);
        RunResult result = context.toResult();
        listener.onRunEnd(result);
        return result;
    }

    private RunResult stop(ExecutionContext context, RunStatus status, String reason) {
        context.finish(status, reason);
        persist(context);
        RunResult result = context.toResult();
        log.info("Workflow '{}' session {} finished {} after {} turns: {}",
            context.workflow().name(), context.sessionId(), status, context.turnCount(), reason);
        listener.onRunEnd(result);
        return result;
    }

    private void checkpoint(ExecutionContext context) {
        if (config.checkpointEachTurn()) {
            persist(context);
        }
    }

    private void persist(ExecutionContext context) {
        try {
            sessionStore.save(context.toPersisted());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist session " + context.sessionId(), e);
        }
    }
}
