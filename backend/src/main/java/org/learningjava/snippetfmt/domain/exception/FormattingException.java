package org.learningjava.snippetfmt.domain.exception;

/**
 * Base type for faults raised by the layout components. Only the top-level
 * formatting use case catches these; everything below it lets them propagate.
 */
public class FormattingException extends RuntimeException {

    public FormattingException(String message) {
        super(message);
    }

    public FormattingException(String message, Throwable cause) {
        super(message, cause);
    }
}
