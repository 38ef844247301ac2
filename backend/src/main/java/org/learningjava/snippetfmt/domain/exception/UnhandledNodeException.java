package org.learningjava.snippetfmt.domain.exception;

import org.learningjava.snippetfmt.domain.model.syntax.SyntaxNode;

public class UnhandledNodeException extends FormattingException {

    private final transient SyntaxNode node;

    public UnhandledNodeException(SyntaxNode node) {
        this(node, "Unhandled node " + describe(node));
    }

    public UnhandledNodeException(SyntaxNode node, String message) {
        super(message);
        this.node = node;
    }

    public SyntaxNode getNode() {
        return node;
    }

    private static String describe(SyntaxNode node) {
        return node == null ? "null" : node.kind();
    }
}
