package dev.collab.condition;

/**
 * Raised when a condition string cannot be compiled. Only thrown at load time.
 */
public class ConditionSyntaxException extends RuntimeException {

    private final String source;
    private final int position;

    public ConditionSyntaxException(String message, String source, int position) {
        super("%s at position %d in condition '%s'".formatted(message, position, source));
        this.source = source;
        this.position = position;
    }

    public String source() {
        return source;
    }

    public int position() {
        return position;
    }
}
