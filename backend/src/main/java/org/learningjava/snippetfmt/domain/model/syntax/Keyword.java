package org.learningjava.snippetfmt.domain.model.syntax;

public record Keyword(String name, SyntaxNode value) implements SyntaxNode {
}
