package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

public record TupleLiteral(List<SyntaxNode> elements) implements SyntaxNode {

    public TupleLiteral {
        elements = List.copyOf(elements);
    }
}
