package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

public record SetLiteral(List<SyntaxNode> elements) implements SyntaxNode {

    public SetLiteral {
        elements = List.copyOf(elements);
    }
}
