package dev.collab.condition;

/**
 * A condition string compiled into its syntax tree. A blank source always holds.
 */
public record Condition(String source, Expression expression) {

    public static final Condition ALWAYS = new Condition("", new Expression.Constant(true));

    /**
     * Compile a condition string.
     *
     * @throws ConditionSyntaxException on unbalanced parentheses, unknown operators or stray tokens
     */
    public static Condition compile(String source) {
        if (source == null || source.isBlank()) {
            return ALWAYS;
        }
        return new Condition(source, new ConditionParser(source).parse());
    }

    @Override
    public String toString() {
        return source.isEmpty() ? "<always>" : source;
    }
}
