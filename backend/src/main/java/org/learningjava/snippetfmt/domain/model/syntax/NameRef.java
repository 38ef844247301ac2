package org.learningjava.snippetfmt.domain.model.syntax;

public record NameRef(String id) implements SyntaxNode {
}
