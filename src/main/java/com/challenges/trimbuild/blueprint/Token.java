package com.challenges.trimbuild.blueprint;

public record Token(Type type, String text, int line, int column) {
    public enum Type {
        BOOL,
        INTEGER,
        IDENT,
        STRING,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        COLON,
        COMMA,
        EQUALS,
        PLUS
    }

    public boolean is(Type expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + " '" + text + "' at " + line + ":" + column;
    }
}
