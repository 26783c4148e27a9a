package dev.collab.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits a condition string into tokens. Keywords are case-insensitive.
 */
final class ConditionLexer {

    private static final Set<String> BOOLEAN_WORDS = Set.of("true", "false", "always", "never");
    private static final Set<String> NULL_WORDS = Set.of("null", "none");

    private final String source;
    private int pos;

    ConditionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        if (c == '(') {
            pos++;
            return new Token(Token.Type.LPAREN, "(", start);
        }
        if (c == ')') {
            pos++;
            return new Token(Token.Type.RPAREN, ")", start);
        }
        if (c == '"' || c == '\'') {
            return string(c);
        }
        if (isDigit(c) || (c == '-' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
            return number();
        }
        if (c == '=' || c == '!' || c == '<' || c == '>') {
            return operator();
        }
        if (Character.isLetter(c) || c == '_') {
            return word();
        }
        throw new ConditionSyntaxException("Unexpected character '%c'".formatted(c), source, start);
    }

    private Token string(char quote) {
        int start = pos;
        pos++;
        var sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                sb.append(source.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == quote) {
                pos++;
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new ConditionSyntaxException("Unterminated string literal", source, start);
    }

    private Token number() {
        int start = pos;
        if (source.charAt(pos) == '-') {
            pos++;
        }
        while (pos < source.length() && isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            if (pos >= source.length() || !isDigit(source.charAt(pos))) {
                throw new ConditionSyntaxException("Malformed number", source, start);
            }
            while (pos < source.length() && isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        if (pos < source.length() && isWordChar(source.charAt(pos))) {
            throw new ConditionSyntaxException("Malformed number", source, start);
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start);
    }

    private Token operator() {
        int start = pos;
        String two = pos + 1 < source.length() ? source.substring(pos, pos + 2) : "";
        if (Operator.fromSymbol(two).isPresent()) {
            pos += 2;
            return new Token(Token.Type.OPERATOR, two, start);
        }
        String one = source.substring(pos, pos + 1);
        if (Operator.fromSymbol(one).isPresent()) {
            pos++;
            return new Token(Token.Type.OPERATOR, one, start);
        }
        throw new ConditionSyntaxException("Unknown operator '%s'".formatted(one), source, start);
    }

    private Token word() {
        int start = pos;
        while (pos < source.length() && isWordChar(source.charAt(pos))) {
            pos++;
        }
        String text = source.substring(start, pos);
        if (text.endsWith(".") || text.contains("..")) {
            throw new ConditionSyntaxException("Malformed identifier '%s'".formatted(text), source, start);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "and":
                return new Token(Token.Type.AND, text, start);
            case "or":
                return new Token(Token.Type.OR, text, start);
            case "not":
                return new Token(Token.Type.NOT, text, start);
            default:
                break;
        }
        if (BOOLEAN_WORDS.contains(lower)) {
            return new Token(Token.Type.BOOLEAN, lower, start);
        }
        if (NULL_WORDS.contains(lower)) {
            return new Token(Token.Type.NULL, lower, start);
        }
        return new Token(Token.Type.IDENTIFIER, text, start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
