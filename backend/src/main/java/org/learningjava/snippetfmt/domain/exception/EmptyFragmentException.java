package org.learningjava.snippetfmt.domain.exception;

public class EmptyFragmentException extends FormattingException {

    public EmptyFragmentException() {
        super("Fragment has no lines");
    }
}
