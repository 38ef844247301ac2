package org.learningjava.snippetfmt.domain.model.syntax;

/**
 * One parsed statement or expression. Implementations are immutable records
 * produced by the parser adapter; the layout code only reads their fields.
 */
public interface SyntaxNode {

    default String kind() {
        return getClass().getSimpleName();
    }
}
