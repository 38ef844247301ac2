package org.learningjava.snippetfmt.domain.exception;

/**
 * Thrown by the parser port when a block is not valid code. Callers treat the
 * block as prose; this is an expected outcome, hence a checked exception.
 */
public class SyntaxRejectedException extends Exception {

    private final int line;
    private final int column;

    public SyntaxRejectedException(int line, int column, String message) {
        super("line " + line + ":" + column + " " + message);
        this.line = line;
        this.column = column;
    }

    public SyntaxRejectedException(int line, int column, String message, Throwable cause) {
        super("line " + line + ":" + column + " " + message, cause);
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
