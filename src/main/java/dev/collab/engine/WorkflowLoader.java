package dev.collab.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import dev.collab.condition.Condition;
import dev.collab.condition.ConditionSyntaxException;
import dev.collab.model.AgentSpec;
import dev.collab.model.AgentType;
import dev.collab.model.ExitAction;
import dev.collab.model.ExitCondition;
import dev.collab.model.StateSpec;
import dev.collab.model.Transition;
import dev.collab.model.WorkflowDefinition;
import dev.collab.template.PromptTemplate;
import dev.collab.template.TemplateSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads workflow definitions from YAML (or JSON) and validates them in one pass.
 * Every condition and prompt template is compiled here, so a loaded workflow
 * cannot fail on syntax during a run.
 */
public final class WorkflowLoader {

    public static final int DEFAULT_MAX_TURNS = 10;

    private static final Logger log = LoggerFactory.getLogger(WorkflowLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());

    private WorkflowLoader() {}

    /**
     * Load a single workflow from a YAML or JSON file.
     */
    public static WorkflowDefinition loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return load(root, path.toString());
    }

    /**
     * Load a single workflow from a YAML or JSON string.
     */
    public static WorkflowDefinition loadFromString(String raw) throws IOException {
        JsonNode root = MAPPER.readTree(raw);
        return load(root, "<string>");
    }

    /**
     * Load all workflows from a directory of {@code .yaml}, {@code .yml} and {@code .json} files,
     * keyed by workflow name.
     */
    public static Map<String, WorkflowDefinition> loadFromDirectory(Path dir) throws IOException {
        var workflows = new LinkedHashMap<String, WorkflowDefinition>();
        try (Stream<Path> files = Files.list(dir)) {
            List<Path> sorted = files.filter(WorkflowLoader::isWorkflowFile).sorted().collect(Collectors.toList());
            for (Path p : sorted) {
                WorkflowDefinition workflow = loadFromFile(p);
                if (workflows.putIfAbsent(workflow.name(), workflow) != null) {
                    log.warn("Duplicate workflow name '{}' in {}, keeping the first", workflow.name(), p);
                }
            }
        }
        return workflows;
    }

    private static boolean isWorkflowFile(Path p) {
        String name = p.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    /**
     * Build and validate a workflow from a parsed tree.
     *
     * @throws WorkflowValidationException listing every violation found
     */
    public static WorkflowDefinition load(JsonNode root, String source) {
        var errors = new ArrayList<String>();
        if (root == null || !root.isObject()) {
            throw new WorkflowValidationException(source, List.of("Workflow definition must be a mapping"));
        }

        String name = text(root, "name", "");
        String description = text(root, "description", "");
        String initialMessage = text(root, "initial_message", "");
        int maxTurns = DEFAULT_MAX_TURNS;
        JsonNode maxTurnsNode = root.get("max_turns");
        if (maxTurnsNode != null && !maxTurnsNode.isNull()) {
            if (maxTurnsNode.canConvertToInt() && maxTurnsNode.isIntegralNumber()) {
                maxTurns = maxTurnsNode.intValue();
            } else {
                errors.add("max_turns must be an integer, got '%s'".formatted(maxTurnsNode.asText()));
            }
        }

        Map<String, AgentSpec> agents = parseAgents(root.get("agents"), errors);
        Map<String, StateSpec> states = parseStates(root.get("states"), errors);
        List<ExitCondition> exitConditions = parseExitConditions(root.get("exit_conditions"), errors);

        var workflow = new WorkflowDefinition(name, description, initialMessage, maxTurns,
            agents, states, exitConditions);
        errors.addAll(WorkflowValidator.validate(workflow));

        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(source, errors);
        }
        log.debug("Loaded workflow '{}' with {} states from {}", name, states.size(), source);
        return workflow;
    }

    private static Map<String, AgentSpec> parseAgents(JsonNode node, List<String> errors) {
        var agents = new LinkedHashMap<String, AgentSpec>();
        if (node == null || !node.isArray()) {
            errors.add("'agents' must be a list");
            return agents;
        }
        int index = 0;
        for (JsonNode agentNode : node) {
            index++;
            String agentName = text(agentNode, "name", null);
            if (agentName == null || agentName.isBlank()) {
                errors.add("Agent #%d has missing or empty name".formatted(index));
                continue;
            }
            String typeId = text(agentNode, "type", null);
            AgentType type = AgentType.fromId(typeId).orElse(null);
            if (type == null) {
                errors.add("Agent '%s': unknown type '%s'. Valid types: %s"
                    .formatted(agentName, typeId, Arrays.stream(AgentType.values()).map(AgentType::id).collect(Collectors.toList())));
                continue;
            }
            if (agents.putIfAbsent(agentName, new AgentSpec(agentName, type)) != null) {
                errors.add("Duplicate agent name '%s'".formatted(agentName));
            }
        }
        return agents;
    }

    private static Map<String, StateSpec> parseStates(JsonNode node, List<String> errors) {
        var states = new LinkedHashMap<String, StateSpec>();
        if (node == null || !node.isArray()) {
            errors.add("'states' must be a list");
            return states;
        }
        int index = 0;
        for (JsonNode stateNode : node) {
            index++;
            String stateName = text(stateNode, "name", null);
            if (stateName == null || stateName.isBlank()) {
                errors.add("State #%d has missing or empty name".formatted(index));
                continue;
            }
            if (Transition.END.equals(stateName)) {
                errors.add("State name '%s' is reserved".formatted(Transition.END));
                continue;
            }
            StateSpec state = parseState(stateName, stateNode, errors);
            if (states.putIfAbsent(stateName, state) != null) {
                errors.add("Duplicate state name '%s'".formatted(stateName));
            }
        }
        return states;
    }

    private static StateSpec parseState(String stateName, JsonNode node, List<String> errors) {
        String agent = text(node, "agent", null);
        boolean start = node.has("start") && node.get("start").asBoolean(false);

        PromptTemplate prompt;
        String promptSource = text(node, "prompt", null);
        if (promptSource == null) {
            errors.add("State '%s' has missing prompt".formatted(stateName));
            prompt = PromptTemplate.compile("");
        } else {
            try {
                prompt = PromptTemplate.compile(promptSource);
            } catch (TemplateSyntaxException e) {
                errors.add("State '%s': prompt template error: %s".formatted(stateName, e.getMessage()));
                prompt = PromptTemplate.compile("");
            }
        }

        var transitions = new ArrayList<Transition>();
        JsonNode transitionsNode = node.get("transitions");
        if (transitionsNode != null && !transitionsNode.isNull()) {
            if (!transitionsNode.isArray()) {
                errors.add("State '%s': 'transitions' must be a list".formatted(stateName));
            } else {
                int index = 0;
                for (JsonNode transitionNode : transitionsNode) {
                    index++;
                    String where = "State '%s': transition #%d".formatted(stateName, index);
                    String to = text(transitionNode, "to", null);
                    if (to == null || to.isBlank()) {
                        errors.add(where + " has missing 'to'");
                        continue;
                    }
                    Condition condition = compileCondition(transitionNode.get("condition"), where, errors);
                    // keep the target checked even when the condition did not compile
                    transitions.add(new Transition(to, condition != null ? condition : Condition.ALWAYS));
                }
            }
        }
        return new StateSpec(stateName, agent, start, prompt, transitions);
    }

    private static List<ExitCondition> parseExitConditions(JsonNode node, List<String> errors) {
        var exitConditions = new ArrayList<ExitCondition>();
        if (node == null || node.isNull()) {
            return exitConditions;
        }
        if (!node.isArray()) {
            errors.add("'exit_conditions' must be a list");
            return exitConditions;
        }
        int index = 0;
        for (JsonNode exitNode : node) {
            index++;
            String where = "Exit condition #%d".formatted(index);
            String actionId = text(exitNode, "action", null);
            ExitAction action = ExitAction.fromId(actionId).orElse(null);
            if (action == null) {
                errors.add("%s: unknown action '%s'. Valid actions: %s".formatted(where, actionId,
                    Arrays.stream(ExitAction.values()).map(ExitAction::id).collect(Collectors.toList())));
            }
            Condition condition = compileCondition(exitNode.get("condition"), where, errors);
            if (action != null && condition != null) {
                exitConditions.add(new ExitCondition(condition, action));
            }
        }
        return exitConditions;
    }

    private static Condition compileCondition(JsonNode node, String where, List<String> errors) {
        // YAML turns `condition: true` into a boolean node; asText() gives it back as source.
        String source = node == null || node.isNull() ? "" : node.asText();
        try {
            return Condition.compile(source);
        } catch (ConditionSyntaxException e) {
            errors.add("%s: %s".formatted(where, e.getMessage()));
            return null;
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }
}
