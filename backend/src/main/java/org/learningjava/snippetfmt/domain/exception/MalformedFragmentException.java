package org.learningjava.snippetfmt.domain.exception;

public class MalformedFragmentException extends FormattingException {

    private final int lineIndex;

    public MalformedFragmentException(int lineIndex, String message) {
        super("Line " + (lineIndex + 1) + ": " + message);
        this.lineIndex = lineIndex;
    }

    public int getLineIndex() {
        return lineIndex;
    }
}
