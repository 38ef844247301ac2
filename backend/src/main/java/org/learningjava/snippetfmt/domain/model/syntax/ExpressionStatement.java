package org.learningjava.snippetfmt.domain.model.syntax;

public record ExpressionStatement(SyntaxNode value) implements SyntaxNode {
}
