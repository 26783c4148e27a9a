package dev.collab.condition;

import dev.collab.model.DecisionValue;

import java.util.List;

/**
 * Syntax tree of a compiled condition.
 */
public sealed interface Expression {

    record Or(List<Expression> operands) implements Expression {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    record And(List<Expression> operands) implements Expression {
        public And {
            operands = List.copyOf(operands);
        }
    }

    record Not(Expression operand) implements Expression {}

    /** {@code identifier op literal}; the identifier may be a dotted path into nested decisions. */
    record Comparison(String identifier, Operator operator, DecisionValue literal) implements Expression {}

    /** A bare identifier, evaluated for truthiness or dispatched to a named condition. */
    record Identifier(String name) implements Expression {}

    /** {@code true}, {@code false}, {@code always}, {@code never}. */
    record Constant(boolean value) implements Expression {}
}
