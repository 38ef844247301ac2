package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

/**
 * {@code a = value}, {@code a, b = value} or the chained {@code a = b = value}.
 */
public record Assignment(List<AssignmentTarget> targets, SyntaxNode value) implements SyntaxNode {

    public Assignment {
        targets = List.copyOf(targets);
    }
}
