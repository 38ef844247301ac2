package org.learningjava.snippetfmt.domain.model.syntax;

/**
 * Valid code outside the constructs the renderer lays out. Carries the kind of
 * construct and its source text so a failure can say what was found.
 */
public record UnsupportedNode(String kind, String sourceText) implements SyntaxNode {
}
