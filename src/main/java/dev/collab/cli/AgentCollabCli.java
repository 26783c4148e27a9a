package dev.collab.cli;

import dev.collab.backend.CommandAgentProxy;
import dev.collab.backend.Workspace;
import dev.collab.condition.ConditionEvaluator;
import dev.collab.engine.DriverConfig;
import dev.collab.engine.ExecutionContext;
import dev.collab.engine.JsonSessionStore;
import dev.collab.engine.NoMatchPolicy;
import dev.collab.engine.PersistedSession;
import dev.collab.engine.WorkflowDriver;
import dev.collab.engine.WorkflowListener;
import dev.collab.engine.WorkflowLoader;
import dev.collab.engine.WorkflowValidationException;
import dev.collab.engine.WorkflowValidator;
import dev.collab.model.DecisionValue;
import dev.collab.model.RunResult;
import dev.collab.model.RunStatus;
import dev.collab.model.StateSpec;
import dev.collab.model.Transition;
import dev.collab.model.TurnRecord;
import dev.collab.model.WorkflowDefinition;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI entry point for agent-collab.
 */
@Command(
    name = "agent-collab",
    mixinStandardHelpOptions = true,
    description = "Run declarative multi-agent collaboration workflows."
)
public class AgentCollabCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_FAILED = 2;
    static final int EXIT_HALTED = 3;

    @Parameters(index = "0", arity = "0..1",
        description = "Workflow file, or a workflow name looked up in --workflows-dir")
    private String workflow;

    @Option(names = "--workflows-dir", defaultValue = "workflows", description = "Directory of workflow definitions")
    private Path workflowsDir;

    @Option(names = "--list", description = "List all workflows in --workflows-dir")
    private boolean list;

    @Option(names = "--validate", description = "Validate the workflow and report every violation")
    private boolean validate;

    @Option(names = "--dry-run", description = "Print workflow structure without executing")
    private boolean dryRun;

    @Option(names = "--verbose", description = "Print every turn and transition")
    private boolean verbose;

    @Option(names = "--agent-command",
        description = "Command that runs one agent turn, one argument per occurrence "
            + "(e.g. --agent-command sh --agent-command=-c --agent-command 'my-agent --yes'); "
            + "prompt on stdin, response on stdout")
    private List<String> agentCommand;

    @Option(names = "--workspace", description = "Shared workspace directory (default: workspaces/<workflow>)")
    private Path workspaceDir;

    @Option(names = "--sessions-dir", defaultValue = ".collab/sessions", description = "Where sessions are persisted")
    private Path sessionsDir;

    @Option(names = "--max-turns", description = "Override max_turns of the workflow")
    private Integer maxTurns;

    @Option(names = "--timeout", description = "Per-turn agent timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = "--guide-file", description = "Replace the default collaboration guide with this file's text")
    private Path guideFile;

    @Option(names = "--stay-on-no-match", description = "Re-run the current state when no transition matches")
    private boolean stayOnNoMatch;

    @Option(names = "--resume", description = "Resume the persisted session with this id")
    private String resumeSessionId;

    @Option(names = "--show-session", description = "Print a persisted session and exit")
    private String showSessionId;

    @Option(names = "--list-sessions", description = "List persisted sessions in --sessions-dir")
    private boolean listSessions;

    private final PrintStream out;
    private final PrintStream err;

    public AgentCollabCli() {
        this(System.out, System.err);
    }

    AgentCollabCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        try {
            if (list) {
                return listWorkflows();
            }
            if (showSessionId != null) {
                return showSession(showSessionId);
            }
            if (listSessions) {
                return printSessions();
            }
            if (workflow == null) {
                err.println("Error: workflow required. Use --list to see available workflows.");
                return EXIT_INVALID;
            }

            WorkflowDefinition definition = resolveWorkflow(workflow);
            if (maxTurns != null) {
                definition = new WorkflowDefinition(definition.name(), definition.description(),
                    definition.initialMessage(), maxTurns, definition.agents(), definition.states(),
                    definition.exitConditions());
                List<String> violations = WorkflowValidator.validate(definition);
                if (!violations.isEmpty()) {
                    throw new WorkflowValidationException("--max-turns " + maxTurns, violations);
                }
            }

            if (validate) {
                out.printf("Workflow '%s' is valid (%d agents, %d states).%n",
                    definition.name(), definition.agents().size(), definition.states().size());
                return EXIT_OK;
            }
            if (dryRun) {
                printStructure(definition);
                return EXIT_OK;
            }
            return execute(definition);
        } catch (WorkflowValidationException e) {
            err.println("Workflow is invalid:");
            e.violations().forEach(v -> err.println("  - " + v));
            return EXIT_INVALID;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID;
        }
    }

    private int execute(WorkflowDefinition definition) throws IOException {
        if (agentCommand == null || agentCommand.isEmpty()) {
            err.println("Error: --agent-command is required to run a workflow.");
            return EXIT_INVALID;
        }

        DriverConfig config = DriverConfig.defaults()
            .withNoMatchPolicy(stayOnNoMatch ? NoMatchPolicy.STAY : NoMatchPolicy.TERMINATE);
        if (timeoutSeconds != null) {
            config = config.withTurnTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (guideFile != null) {
            config = config.withCollaborationGuide(Files.readString(guideFile, StandardCharsets.UTF_8));
        }

        var store = new JsonSessionStore(sessionsDir);
        var driver = new WorkflowDriver(CommandAgentProxy.forAllTypes(agentCommand), store, config,
            new ConditionEvaluator(), verbose ? new ConsoleListener(out) : WorkflowListener.NONE);

        Path defaultRoot = Path.of("workspaces", definition.name());
        RunResult result;
        if (resumeSessionId != null) {
            Optional<PersistedSession> persisted = store.load(resumeSessionId);
            if (persisted.isEmpty()) {
                err.println("Error: no session '%s' in %s".formatted(resumeSessionId, sessionsDir));
                return EXIT_INVALID;
            }
            // a resumed session stays in the workspace it started in unless told otherwise
            Path root = workspaceDir;
            if (root == null) {
                root = persisted.get().workspace() != null ? Path.of(persisted.get().workspace()) : defaultRoot;
            }
            Workspace workspace = Workspace.create(root, definition.agents().keySet());
            try {
                result = driver.resume(definition, persisted.get(), workspace);
            } catch (IllegalStateException | IllegalArgumentException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_INVALID;
            }
        } else {
            Path root = workspaceDir != null ? workspaceDir : defaultRoot;
            result = driver.run(definition, Workspace.create(root, definition.agents().keySet()));
        }
        return report(result);
    }

    private int report(RunResult result) {
        out.printf("Session %s: %s after %d turns (%s)%n",
            result.sessionId(), result.status(), result.turnCount(), result.reason());
        if (!result.lastContent().isEmpty()) {
            out.println("Last content: " + result.lastContent());
        }
        if (result.failure() != null) {
            err.printf("Turn %d in state '%s' (agent '%s') failed: %s%n", result.failure().turn(),
                result.failure().state(), result.failure().agent(), result.failure().error());
            if (result.failure().rawResponse() != null) {
                err.println("Raw response:");
                err.println(result.failure().rawResponse());
            }
            err.println("Session persisted in " + sessionsDir.resolve(result.sessionId() + ".json"));
        }
        if (result.status() == RunStatus.HALTED) {
            return EXIT_HALTED;
        }
        if (result.status() == RunStatus.ABORTED || result.errorFlag()) {
            return EXIT_FAILED;
        }
        return EXIT_OK;
    }

    private WorkflowDefinition resolveWorkflow(String ref) throws IOException {
        Path path = Path.of(ref);
        if (Files.isRegularFile(path)) {
            return WorkflowLoader.loadFromFile(path);
        }
        for (String ext : List.of(".yaml", ".yml", ".json")) {
            Path candidate = workflowsDir.resolve(ref + ext);
            if (Files.isRegularFile(candidate)) {
                return WorkflowLoader.loadFromFile(candidate);
            }
        }
        throw new IOException("Workflow '%s' not found as a file or in %s".formatted(ref, workflowsDir));
    }

    private int listWorkflows() throws IOException {
        if (!Files.isDirectory(workflowsDir)) {
            err.println("Error: workflows directory not found: " + workflowsDir);
            return EXIT_INVALID;
        }
        Map<String, WorkflowDefinition> workflows = WorkflowLoader.loadFromDirectory(workflowsDir);
        out.println("Available workflows:");
        workflows.values().forEach(w -> out.printf("  %-24s %s%n", w.name(), w.description()));
        return EXIT_OK;
    }

    private int printSessions() throws IOException {
        var store = new JsonSessionStore(sessionsDir);
        List<String> ids = store.list();
        if (ids.isEmpty()) {
            out.println("No sessions in " + sessionsDir);
            return EXIT_OK;
        }
        for (String id : ids) {
            store.load(id).ifPresent(s -> out.printf("  %-36s %-20s %-10s %s (%d turns)%n",
                s.sessionId(), s.workflowName(), s.status(), s.currentState(), s.turnCount()));
        }
        return EXIT_OK;
    }

    private int showSession(String sessionId) throws IOException {
        Optional<PersistedSession> persisted = new JsonSessionStore(sessionsDir).load(sessionId);
        if (persisted.isEmpty()) {
            err.println("Error: no session '%s' in %s".formatted(sessionId, sessionsDir));
            return EXIT_INVALID;
        }
        PersistedSession session = persisted.get();
        out.printf("Session %s (workflow '%s')%n", session.sessionId(), session.workflowName());
        out.printf("  status: %s, state: %s, turns: %d%n", session.status(), session.currentState(), session.turnCount());
        if (session.error() != null) {
            out.println("  error: " + session.error());
        }
        out.println("  decisions: " + session.accumulatedDecisions());
        for (PersistedSession.Turn turn : session.turnHistory()) {
            out.printf("  #%d %s/%s: %s%n", turn.turn(), turn.state(), turn.agent(), turn.content());
        }
        return EXIT_OK;
    }

    private void printStructure(WorkflowDefinition definition) {
        out.printf("Workflow: %s (max_turns=%d)%n", definition.name(), definition.maxTurns());
        if (!definition.description().isBlank()) {
            out.println("  " + definition.description());
        }
        out.println("Agents:");
        definition.agents().values().forEach(a -> out.printf("  %s (%s)%n", a.name(), a.type().id()));
        out.println("States:");
        for (StateSpec state : definition.states().values()) {
            out.printf("  %s%s [agent: %s]%n", state.name(), state.start() ? " (start)" : "", state.agent());
            for (Transition t : state.transitions()) {
                out.printf("    -> %s when %s%n", t.to(), t.condition());
            }
        }
        if (!definition.exitConditions().isEmpty()) {
            out.println("Exit conditions:");
            definition.exitConditions().forEach(e -> out.printf("  %s when %s%n", e.action().id(), e.condition()));
        }
    }

    private static final class ConsoleListener implements WorkflowListener {

        private final PrintStream out;

        ConsoleListener(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onStateEnter(ExecutionContext context, StateSpec state) {
            out.printf("[turn %d] %s -> agent %s%n", context.turnCount() + 1, state.name(), state.agent());
        }

        @Override
        public void onStateExit(ExecutionContext context, StateSpec state, TurnRecord record) {
            out.printf("[turn %d] %s: %s %s%n", record.turn(), record.agent(), record.content(),
                DecisionValue.mapToJson(record.decisions()));
        }
    }
}
