package dev.collab.engine;

import dev.collab.condition.Expression;
import dev.collab.model.AgentType;
import dev.collab.model.ExitAction;
import dev.collab.model.Transition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowLoaderTest {

    private static final String MINIMAL = """
        name: minimal
        agents:
          - name: coder
            type: coder
        states:
          - name: build
            agent: coder
            start: true
            prompt: "Build {{initial_message}}"
            transitions:
              - to: END
                condition: true
        """;

    @Test
    void loadsBundledWorkflow() throws Exception {
        Path path = Path.of(getClass().getResource("/workflows/design-build-review.yaml").toURI());

        var wf = WorkflowLoader.loadFromFile(path);

        assertThat(wf.name()).isEqualTo("design-build-review");
        assertThat(wf.maxTurns()).isEqualTo(12);
        assertThat(wf.agents()).containsOnlyKeys("architect", "coder", "reviewer");
        assertThat(wf.agents().get("reviewer").type()).isEqualTo(AgentType.ASK);
        assertThat(wf.states()).containsOnlyKeys("design", "build", "review");
        assertThat(wf.startState().name()).isEqualTo("design");
        assertThat(wf.state("review").orElseThrow().transitions())
            .extracting(Transition::to)
            .containsExactly("END", "design", "build");
        assertThat(wf.exitConditions()).hasSize(1);
        assertThat(wf.exitConditions().get(0).action()).isEqualTo(ExitAction.SAVE_AND_END);
    }

    @Test
    void appliesDefaultsAndReadsYamlBooleans() throws Exception {
        var wf = WorkflowLoader.loadFromString(MINIMAL);

        assertThat(wf.maxTurns()).isEqualTo(WorkflowLoader.DEFAULT_MAX_TURNS);
        assertThat(wf.description()).isEmpty();
        assertThat(wf.exitConditions()).isEmpty();
        var transition = wf.startState().transitions().get(0);
        assertThat(transition.endsRun()).isTrue();
        assertThat(transition.condition().expression()).isEqualTo(new Expression.Constant(true));
    }

    @Test
    void missingConditionAlwaysHolds() throws Exception {
        var wf = WorkflowLoader.loadFromString("""
            name: open
            agents: [{name: coder, type: coder}]
            states:
              - name: build
                agent: coder
                start: true
                prompt: go
                transitions:
                  - to: END
            """);

        assertThat(wf.startState().transitions().get(0).condition().expression())
            .isEqualTo(new Expression.Constant(true));
    }

    @Test
    void acceptsJson() throws Exception {
        var wf = WorkflowLoader.loadFromString("""
            {"name": "json", "max_turns": 4,
             "agents": [{"name": "a", "type": "ask"}],
             "states": [{"name": "s", "agent": "a", "start": true, "prompt": "hi", "transitions": []}]}
            """);

        assertThat(wf.name()).isEqualTo("json");
        assertThat(wf.maxTurns()).isEqualTo(4);
    }

    @Test
    void reportsEveryViolationInOnePass() {
        String broken = """
            name: broken
            max_turns: 0
            agents:
              - name: coder
                type: wizard
              - name: reviewer
                type: ask
              - name: reviewer
                type: ask
            states:
              - name: a
                agent: ghost
                start: true
                prompt: '{% if x == "1" %}{% if y == "2" %}z{% endif %}{% endif %}'
                transitions:
                  - to: nowhere
                    condition: "done AND"
                  - to: b
                    condition: "(ok"
              - name: a
                agent: reviewer
                prompt: hi
            exit_conditions:
              - condition: "x = 1"
                action: explode
            """;

        assertThatThrownBy(() -> WorkflowLoader.loadFromString(broken))
            .isInstanceOfSatisfying(WorkflowValidationException.class, e -> assertThat(e.violations())
                .anyMatch(v -> v.startsWith("Agent 'coder': unknown type 'wizard'"))
                .anyMatch(v -> v.equals("Duplicate agent name 'reviewer'"))
                .anyMatch(v -> v.startsWith("State 'a': prompt template error: Nested"))
                .anyMatch(v -> v.startsWith("State 'a': transition #1: Unexpected end"))
                .anyMatch(v -> v.startsWith("State 'a': transition #2: Missing ')'"))
                .anyMatch(v -> v.equals("Duplicate state name 'a'"))
                .anyMatch(v -> v.startsWith("Exit condition #1: unknown action 'explode'"))
                .anyMatch(v -> v.startsWith("Exit condition #1: Unknown operator '='"))
                .anyMatch(v -> v.equals("max_turns must be greater than 0, got 0"))
                .anyMatch(v -> v.equals("State 'a': agent 'ghost' is not declared")));
    }

    @Test
    void checksTargetOfTransitionWithBrokenCondition() {
        assertThatThrownBy(() -> WorkflowLoader.loadFromString("""
            name: bad-target
            agents: [{name: coder, type: coder}]
            states:
              - name: a
                agent: coder
                start: true
                prompt: go
                transitions:
                  - to: nowhere
                    condition: "done AND"
            """))
            .isInstanceOfSatisfying(WorkflowValidationException.class, e -> assertThat(e.violations())
                .anyMatch(v -> v.startsWith("State 'a': transition #1: Unexpected end"))
                .contains("State 'a': transition #1 target 'nowhere' not found in states"));
    }

    @Test
    void rejectsReservedEndStateAndBadAgentsShape() {
        assertThatThrownBy(() -> WorkflowLoader.loadFromString("""
            name: reserved
            agents: coder
            states:
              - name: END
                agent: coder
                start: true
                prompt: x
            """))
            .isInstanceOfSatisfying(WorkflowValidationException.class, e -> assertThat(e.violations())
                .contains("'agents' must be a list", "State name 'END' is reserved"));
    }

    @Test
    void rejectsNonIntegerMaxTurns() {
        assertThatThrownBy(() -> WorkflowLoader.loadFromString(MINIMAL + "max_turns: lots\n"))
            .isInstanceOfSatisfying(WorkflowValidationException.class, e -> assertThat(e.violations())
                .containsExactly("max_turns must be an integer, got 'lots'"));
    }

    @Test
    void loadsDirectoryKeyedByName(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("one.yaml"), MINIMAL);
        Files.writeString(dir.resolve("two.yml"), MINIMAL.replace("name: minimal", "name: second"));
        Files.writeString(dir.resolve("notes.txt"), "not a workflow");

        var workflows = WorkflowLoader.loadFromDirectory(dir);

        assertThat(workflows).containsOnlyKeys("minimal", "second");
    }
}
