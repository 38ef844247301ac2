package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

public record ListLiteral(List<SyntaxNode> elements) implements SyntaxNode {

    public ListLiteral {
        elements = List.copyOf(elements);
    }
}
