package dev.collab.engine;

import java.util.List;

/**
 * A workflow definition violated one or more invariants. Carries every violation
 * found, not just the first.
 */
public class WorkflowValidationException extends RuntimeException {

    private final List<String> violations;

    public WorkflowValidationException(String source, List<String> violations) {
        super("Invalid workflow %s:%n  - %s".formatted(source, String.join(System.lineSeparator() + "  - ", violations)));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
