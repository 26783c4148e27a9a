package dev.collab.template;

import dev.collab.condition.ConditionEvaluator;
import dev.collab.model.DecisionValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders compiled prompt templates. Missing variables render as empty text and
 * are reported as notes; rendering never fails.
 */
public final class PromptRenderer {

    public static final String GUIDE_VARIABLE = "collaboration_guide";

    private static final Logger log = LoggerFactory.getLogger(PromptRenderer.class);

    private final String collaborationGuide;

    public PromptRenderer() {
        this(CollaborationGuide.DEFAULT);
    }

    public PromptRenderer(String collaborationGuide) {
        this.collaborationGuide = Objects.requireNonNull(collaborationGuide, "collaborationGuide");
    }

    public String collaborationGuide() {
        return collaborationGuide;
    }

    /**
     * Render a template against the given variables. {@code collaboration_guide}
     * always resolves to this renderer's guide text.
     */
    public RenderedPrompt render(PromptTemplate template, Map<String, DecisionValue> variables) {
        var out = new StringBuilder();
        var notes = new ArrayList<String>();
        renderSegments(template.segments(), variables, out, notes);
        notes.forEach(note -> log.debug("Rendering note: {}", note));
        return new RenderedPrompt(out.toString(), notes);
    }

    private void renderSegments(List<Segment> segments, Map<String, DecisionValue> variables,
                                StringBuilder out, List<String> notes) {
        for (Segment segment : segments) {
            if (segment instanceof Segment.Text text) {
                out.append(text.text());
            } else if (segment instanceof Segment.Variable variable) {
                String value = lookup(variable.name(), variables);
                if (value == null) {
                    notes.add("Variable '%s' is not defined, rendered as empty".formatted(variable.name()));
                    value = "";
                }
                out.append(value);
            } else if (segment instanceof Segment.Conditional conditional) {
                String value = lookup(conditional.variable(), variables);
                boolean matches = conditional.literal().equals(value == null ? "" : value);
                renderSegments(matches ? conditional.then() : conditional.otherwise(), variables, out, notes);
            }
        }
    }

    private String lookup(String name, Map<String, DecisionValue> variables) {
        if (GUIDE_VARIABLE.equals(name)) {
            return collaborationGuide;
        }
        DecisionValue direct = variables.get(name);
        if (direct != null) {
            return direct.render();
        }
        // dotted names walk nested decisions the way conditions do
        DecisionValue nested = ConditionEvaluator.resolve(name, variables);
        return nested instanceof DecisionValue.Null ? null : nested.render();
    }
}
