package org.learningjava.snippetfmt.infrastructure.adapter.out.pythonParser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.learningjava.snippetfmt.application.port.SyntaxParserPort;
import org.learningjava.snippetfmt.domain.exception.SyntaxRejectedException;
import org.learningjava.snippetfmt.domain.model.syntax.SyntaxNode;
import org.learningjava.snippetfmt.domain.model.syntax.UnsupportedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pysnippet.PySnippetLexer;
import pysnippet.PySnippetParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Python code with the generated {@code PySnippet} ANTLR parser.
 * A new lexer and parser are created per call, so one instance can serve
 * concurrent callers.
 */
public class PythonSyntaxParserAdapter implements SyntaxParserPort {

    private static final Logger log = LoggerFactory.getLogger(PythonSyntaxParserAdapter.class);

    @Override
    public List<SyntaxNode> parse(String code) throws SyntaxRejectedException {
        // the last logical line needs its NEWLINE
        PySnippetLexer lexer = new PySnippetLexer(CharStreams.fromString(code + "\n"));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PySnippetParser parser = new PySnippetParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);

        List<SyntaxNode> nodes;
        try {
            PySnippetParser.SnippetContext tree = parser.snippet();
            nodes = new ArrayList<>(new SyntaxTreeBuilder().build(tree));
        } catch (ParseCancellationException e) {
            if (e.getCause() instanceof SyntaxRejectedException rejected) {
                log.trace("Rejected as code: {}", rejected.getMessage());
                throw rejected;
            }
            throw new SyntaxRejectedException(0, 0, String.valueOf(e.getMessage()), e);
        }

        // comments are not part of the tree, rendering the nodes would lose them
        for (Token token : tokens.getTokens()) {
            if (token.getType() == PySnippetLexer.COMMENT) {
                nodes.add(new UnsupportedNode("Comment", token.getText()));
            }
        }

        log.trace("Parsed {} top-level nodes", nodes.size());
        return nodes;
    }
}
