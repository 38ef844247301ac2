package org.learningjava.snippetfmt.domain.model.syntax;

/**
 * A string literal split into its prefix ({@code r}, {@code u} or empty), its
 * quote ({@code '}, {@code "}, {@code '''} or {@code """}) and the body as
 * written in the source, escapes untouched.
 */
public record StringLiteral(String prefix, String quote, String body) implements SyntaxNode {

    public boolean isTripleQuoted() {
        return quote.length() == 3;
    }

    public static StringLiteral of(String body) {
        return new StringLiteral("", "\"", body);
    }
}
