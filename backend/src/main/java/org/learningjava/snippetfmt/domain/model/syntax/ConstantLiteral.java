package org.learningjava.snippetfmt.domain.model.syntax;

// True, False, None
public record ConstantLiteral(String text) implements SyntaxNode {
}
