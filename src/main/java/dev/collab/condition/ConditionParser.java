package dev.collab.condition;

import dev.collab.model.DecisionValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the condition language:
 *
 * <pre>
 * expr       := term (OR term)*
 * term       := factor (AND factor)*
 * factor     := NOT factor | '(' expr ')' | comparison | identifier | boolean
 * comparison := identifier op literal
 * literal    := string | number | true | false | null
 * </pre>
 */
final class ConditionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    ConditionParser(String source) {
        this.source = source;
        this.tokens = new ConditionLexer(source).tokenize();
    }

    Expression parse() {
        Expression expression = expr();
        Token trailing = peek();
        if (!trailing.is(Token.Type.EOF)) {
            if (trailing.is(Token.Type.RPAREN)) {
                throw error("Unbalanced ')'", trailing);
            }
            throw error("Unexpected token '%s'".formatted(trailing.text()), trailing);
        }
        return expression;
    }

    private Expression expr() {
        var operands = new ArrayList<Expression>();
        operands.add(term());
        while (peek().is(Token.Type.OR)) {
            advance();
            operands.add(term());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.Or(operands);
    }

    private Expression term() {
        var operands = new ArrayList<Expression>();
        operands.add(factor());
        while (peek().is(Token.Type.AND)) {
            advance();
            operands.add(factor());
        }
        return operands.size() == 1 ? operands.get(0) : new Expression.And(operands);
    }

    private Expression factor() {
        Token token = advance();
        switch (token.type()) {
            case NOT:
                return new Expression.Not(factor());
            case LPAREN: {
                Expression inner = expr();
                Token closing = advance();
                if (!closing.is(Token.Type.RPAREN)) {
                    throw error("Missing ')' for '(' opened at position " + token.position(), closing);
                }
                return inner;
            }
            case IDENTIFIER:
                if (peek().is(Token.Type.OPERATOR)) {
                    Operator operator = Operator.fromSymbol(advance().text()).orElseThrow();
                    return new Expression.Comparison(token.text(), operator, literal());
                }
                return new Expression.Identifier(token.text());
            case BOOLEAN:
                rejectComparisonAfterLiteral();
                return new Expression.Constant(isTrue(token));
            case STRING:
            case NUMBER:
            case NULL:
                throw error("Comparison must start with an identifier, found literal '%s'".formatted(token.text()), token);
            case EOF:
                throw error("Unexpected end of condition", token);
            default:
                throw error("Unexpected token '%s'".formatted(token.text()), token);
        }
    }

    private DecisionValue literal() {
        Token token = advance();
        switch (token.type()) {
            case STRING:
                return DecisionValue.of(token.text());
            case NUMBER:
                return new DecisionValue.Number(new BigDecimal(token.text()));
            case BOOLEAN:
                if ("always".equals(token.text()) || "never".equals(token.text())) {
                    throw error("Expected a literal after operator, found '%s'".formatted(token.text()), token);
                }
                return DecisionValue.of(isTrue(token));
            case NULL:
                return DecisionValue.NULL;
            case EOF:
                throw error("Expected a literal after operator", token);
            default:
                throw error("Expected a literal after operator, found '%s'".formatted(token.text()), token);
        }
    }

    private void rejectComparisonAfterLiteral() {
        if (peek().is(Token.Type.OPERATOR)) {
            throw error("Comparison must start with an identifier", peek());
        }
    }

    private static boolean isTrue(Token token) {
        return "true".equals(token.text()) || "always".equals(token.text());
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (!token.is(Token.Type.EOF)) {
            index++;
        }
        return token;
    }

    private ConditionSyntaxException error(String message, Token at) {
        return new ConditionSyntaxException(message, source, at.position());
    }
}
