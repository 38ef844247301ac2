package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

public record DictLiteral(List<DictEntry> entries) implements SyntaxNode {

    public DictLiteral {
        entries = List.copyOf(entries);
    }
}
