package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

public record Import(List<ImportAlias> names) implements SyntaxNode {

    public Import {
        names = List.copyOf(names);
    }
}
