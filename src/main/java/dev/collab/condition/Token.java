package dev.collab.condition;

record Token(Type type, String text, int position) {

    enum Type {
        LPAREN,
        RPAREN,
        AND,
        OR,
        NOT,
        OPERATOR,
        IDENTIFIER,
        STRING,
        NUMBER,
        BOOLEAN,
        NULL,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }
}
