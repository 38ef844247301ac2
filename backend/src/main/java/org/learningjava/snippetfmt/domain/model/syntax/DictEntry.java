package org.learningjava.snippetfmt.domain.model.syntax;

public record DictEntry(SyntaxNode key, SyntaxNode value) {
}
