package dev.collab.template;

/**
 * Raised when a prompt template cannot be compiled. Only thrown at load time.
 */
public class TemplateSyntaxException extends RuntimeException {

    private final int position;

    public TemplateSyntaxException(String message, int position) {
        super("%s at offset %d".formatted(message, position));
        this.position = position;
    }

    public int position() {
        return position;
    }
}
