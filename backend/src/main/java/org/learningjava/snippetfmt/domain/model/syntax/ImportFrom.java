package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

/**
 * {@code from module import a, b as c}. The module keeps any leading dots of a
 * relative import; it may consist of dots only.
 */
public record ImportFrom(String module, List<ImportAlias> names) implements SyntaxNode {

    public ImportFrom {
        names = List.copyOf(names);
    }
}
