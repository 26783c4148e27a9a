package dev.collab.template;

import dev.collab.model.DecisionValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptRendererTest {

    private final PromptRenderer renderer = new PromptRenderer();

    private String render(String template, Map<String, DecisionValue> variables) {
        return renderer.render(PromptTemplate.compile(template), variables).text();
    }

    @Test
    void conditionalPicksThenBranchOnMatch() {
        String template = "{% if last_agent_name == \"architect\" %}X{% else %}Y{% endif %}";

        assertThat(render(template, Map.of("last_agent_name", DecisionValue.of("architect")))).isEqualTo("X");
        assertThat(render(template, Map.of("last_agent_name", DecisionValue.of("coder")))).isEqualTo("Y");
    }

    @Test
    void conditionalWithoutElseRendersNothingOnMismatch() {
        String template = "A{% if flag == 'yes' %}B{% endif %}C";

        assertThat(render(template, Map.of())).isEqualTo("AC");
        assertThat(render(template, Map.of("flag", DecisionValue.of("yes")))).isEqualTo("ABC");
    }

    @Test
    void conditionalBranchesSubstituteVariables() {
        String template = """
            {% if last_agent_name == "reviewer" %}Address feedback: {{last_agent_content}}{% else %}Start: {{initial_message}}{% endif %}""";

        var vars = Map.of(
            "last_agent_name", DecisionValue.of("reviewer"),
            "last_agent_content", DecisionValue.of("rename foo"),
            "initial_message", DecisionValue.of("build a CLI"));

        assertThat(render(template, vars)).isEqualTo("Address feedback: rename foo");
    }

    @Test
    void missingVariableRendersEmptyWithNote() {
        var rendered = renderer.render(PromptTemplate.compile("Hello {{who}}!"), Map.of());

        assertThat(rendered.text()).isEqualTo("Hello !");
        assertThat(rendered.notes()).containsExactly("Variable 'who' is not defined, rendered as empty");
    }

    @Test
    void dottedNamesReadNestedDecisions() {
        var review = new DecisionValue.Mapping(Map.of("score", DecisionValue.of(9), "verdict", DecisionValue.of("ship")));
        String template = "score={{review.score}}{% if review.verdict == \"ship\" %} ready{% endif %}";

        var rendered = renderer.render(PromptTemplate.compile(template), Map.of("review", review));

        assertThat(rendered.text()).isEqualTo("score=9 ready");
        assertThat(rendered.notes()).isEmpty();
        assertThat(renderer.render(PromptTemplate.compile("{{review.missing}}"), Map.of("review", review)).notes())
            .containsExactly("Variable 'review.missing' is not defined, rendered as empty");
    }

    @Test
    void whitespaceInsidePlaceholderIsIgnored() {
        assertThat(render("{{ name }}", Map.of("name", DecisionValue.of("coder")))).isEqualTo("coder");
    }

    @Test
    void nonTextDecisionsRenderCanonically() {
        var vars = Map.<String, DecisionValue>of(
            "score", DecisionValue.of(8),
            "approved", DecisionValue.TRUE,
            "files", new DecisionValue.Array(List.of(DecisionValue.of("a.py"))),
            "nothing", DecisionValue.NULL);

        assertThat(render("{{score}} {{approved}} {{files}} [{{nothing}}]", vars))
            .isEqualTo("8 true [\"a.py\"] []");
    }

    @Test
    void collaborationGuideComesFromRenderer() {
        var custom = new PromptRenderer("Write files under collab/.");
        var template = PromptTemplate.compile("{{collaboration_guide}}");

        assertThat(custom.render(template, Map.of("collaboration_guide", DecisionValue.of("ignored"))).text())
            .isEqualTo("Write files under collab/.");
        assertThat(renderer.render(template, Map.of()).text()).isEqualTo(CollaborationGuide.DEFAULT);
    }

    @Test
    void textWithSingleBracesIsLiteral() {
        String template = "Reply with {\"content\": \"...\"} at the end.";

        assertThat(render(template, Map.of())).isEqualTo(template);
    }

    @Test
    void rejectsNestedConditionals() {
        assertThatThrownBy(() -> PromptTemplate.compile(
            "{% if a == \"1\" %}{% if b == \"2\" %}x{% endif %}{% endif %}"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("Nested");
    }

    @Test
    void rejectsUnsupportedConditions() {
        assertThatThrownBy(() -> PromptTemplate.compile("{% if a != \"1\" %}x{% endif %}"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("Unsupported condition");
    }

    @Test
    void rejectsUnknownTags() {
        assertThatThrownBy(() -> PromptTemplate.compile("{% for x in items %}{{x}}{% endfor %}"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("Unknown tag");
    }

    @Test
    void rejectsUnbalancedBlocks() {
        assertThatThrownBy(() -> PromptTemplate.compile("{% if a == \"1\" %}x"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("Missing {% endif %}");
        assertThatThrownBy(() -> PromptTemplate.compile("x{% endif %}"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("without {% if %}");
        assertThatThrownBy(() -> PromptTemplate.compile("{% else %}"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("without {% if %}");
    }

    @Test
    void rejectsMalformedPlaceholders() {
        assertThatThrownBy(() -> PromptTemplate.compile("Hello {{name"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("Unclosed '{{'");
        assertThatThrownBy(() -> PromptTemplate.compile("{{ two words }}"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("Invalid variable name");
    }
}
