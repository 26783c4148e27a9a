package dev.collab.condition;

import dev.collab.model.DecisionValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Evaluates compiled conditions against a flat variable mapping.
 *
 * <p>Evaluation is total: a missing identifier resolves to null, ordering
 * comparisons between mismatched or missing operands are false, and a failing
 * named condition counts as false. Nothing here throws for well-formed input.
 */
public final class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final Map<String, NamedCondition> namedConditions;

    public ConditionEvaluator() {
        this(Map.of());
    }

    public ConditionEvaluator(Map<String, NamedCondition> namedConditions) {
        this.namedConditions = Map.copyOf(namedConditions);
    }

    public boolean evaluate(Condition condition, Map<String, DecisionValue> variables) {
        return eval(condition.expression(), variables);
    }

    private boolean eval(Expression expression, Map<String, DecisionValue> variables) {
        if (expression instanceof Expression.Or or) {
            for (Expression operand : or.operands()) {
                if (eval(operand, variables)) {
                    return true;
                }
            }
            return false;
        }
        if (expression instanceof Expression.And and) {
            for (Expression operand : and.operands()) {
                if (!eval(operand, variables)) {
                    return false;
                }
            }
            return true;
        }
        if (expression instanceof Expression.Not not) {
            return !eval(not.operand(), variables);
        }
        if (expression instanceof Expression.Comparison comparison) {
            return compare(resolve(comparison.identifier(), variables), comparison.operator(), comparison.literal());
        }
        if (expression instanceof Expression.Identifier identifier) {
            NamedCondition named = namedConditions.get(identifier.name());
            if (named != null) {
                return testNamed(identifier.name(), named, variables);
            }
            return resolve(identifier.name(), variables).truthy();
        }
        if (expression instanceof Expression.Constant constant) {
            return constant.value();
        }
        throw new IllegalStateException("Unknown expression node: " + expression);
    }

    /**
     * Look up an identifier. An exact key wins; otherwise a dotted name walks
     * nested mappings. Anything unresolved is null. Named conditions use this to
     * read decisions the same way conditions do.
     */
    public static DecisionValue resolve(String name, Map<String, DecisionValue> variables) {
        DecisionValue direct = variables.get(name);
        if (direct != null) {
            return direct;
        }
        if (!name.contains(".")) {
            return DecisionValue.NULL;
        }
        String[] path = name.split("\\.");
        DecisionValue current = variables.get(path[0]);
        for (int i = 1; i < path.length && current != null; i++) {
            current = current instanceof DecisionValue.Mapping mapping ? mapping.entries().get(path[i]) : null;
        }
        return current == null ? DecisionValue.NULL : current;
    }

    static boolean compare(DecisionValue left, Operator operator, DecisionValue right) {
        switch (operator) {
            case EQ:
                return left.equals(right);
            case NE:
                return !left.equals(right);
            default:
                break;
        }
        int order;
        if (left instanceof DecisionValue.Number l && right instanceof DecisionValue.Number r) {
            order = l.value().compareTo(r.value());
        } else if (left instanceof DecisionValue.Text l && right instanceof DecisionValue.Text r) {
            order = l.value().compareTo(r.value());
        } else {
            return false;
        }
        switch (operator) {
            case GT:
                return order > 0;
            case LT:
                return order < 0;
            case GE:
                return order >= 0;
            case LE:
                return order <= 0;
            default:
                return false;
        }
    }

    private boolean testNamed(String name, NamedCondition named, Map<String, DecisionValue> variables) {
        try {
            return named.test(variables);
        } catch (RuntimeException e) {
            log.warn("Named condition '{}' failed, treating as false: {}", name, e.getMessage());
            return false;
        }
    }
}
