package dev.collab.template;

import java.util.List;

/**
 * Piece of a compiled prompt template.
 */
public sealed interface Segment {

    record Text(String text) implements Segment {}

    /** {@code {{name}}} */
    record Variable(String name) implements Segment {}

    /** {@code {% if name == "literal" %} ... {% else %} ... {% endif %}}; never nested. */
    record Conditional(String variable, String literal, List<Segment> then, List<Segment> otherwise) implements Segment {
        public Conditional {
            then = List.copyOf(then);
            otherwise = List.copyOf(otherwise);
        }
    }
}
