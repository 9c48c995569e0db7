package com.challenges.trimbuild.blueprint;

public class LexException extends BlueprintSyntaxException {
    public LexException(String message, int line, int column) {
        super(message, line, column);
    }
}
