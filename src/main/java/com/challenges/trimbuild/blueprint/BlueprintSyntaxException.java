package com.challenges.trimbuild.blueprint;

/**
 * Base class for errors that abort parsing of a blueprint document.
 */
public abstract class BlueprintSyntaxException extends IllegalArgumentException {
    private final int line;
    private final int column;

    protected BlueprintSyntaxException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
