package com.challenges.trimbuild.blueprint;

public class ParseException extends BlueprintSyntaxException {
    private final transient Token token;

    public ParseException(String message, Token token) {
        super(message + " " + token.type() + " '" + token.text() + "'", token.line(), token.column());
        this.token = token;
    }

    public ParseException(String message, int line, int column) {
        super(message, line, column);
        this.token = null;
    }

    /**
     * The offending token, or {@code null} if the input ended early.
     */
    public Token getToken() {
        return token;
    }
}
