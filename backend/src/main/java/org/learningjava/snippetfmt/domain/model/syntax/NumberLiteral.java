package org.learningjava.snippetfmt.domain.model.syntax;

public record NumberLiteral(String text) implements SyntaxNode {
}
