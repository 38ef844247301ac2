package org.learningjava.snippetfmt.application.port;

import org.learningjava.snippetfmt.domain.exception.SyntaxRejectedException;
import org.learningjava.snippetfmt.domain.model.syntax.SyntaxNode;

import java.util.List;

public interface SyntaxParserPort {

    /**
     * Parses a block of column-0 code into its top-level statements.
     *
     * @throws SyntaxRejectedException when the text is not valid code
     */
    List<SyntaxNode> parse(String code) throws SyntaxRejectedException;
}
