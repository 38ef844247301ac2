package org.learningjava.snippetfmt.domain.model.syntax;

import java.util.List;

/**
 * A call on a plain name. {@code starArgs} and {@code kwArgs} are the single
 * {@code *expr} and {@code **expr} spreads, null when absent.
 */
public record Call(
        String function,
        List<SyntaxNode> args,
        List<Keyword> keywords,
        SyntaxNode starArgs,
        SyntaxNode kwArgs
) implements SyntaxNode {

    public Call {
        args = List.copyOf(args);
        keywords = List.copyOf(keywords);
    }

    public Call(String function, List<SyntaxNode> args) {
        this(function, args, List.of(), null, null);
    }
}
