package org.learningjava.snippetfmt.infrastructure.adapter.out.pythonParser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.learningjava.snippetfmt.domain.exception.SyntaxRejectedException;

/**
 * Stops lexing/parsing at the first error. The position travels as a
 * {@link SyntaxRejectedException} cause so the adapter can rethrow it.
 */
class SyntaxErrorListener extends BaseErrorListener {

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer,
                            Object offendingSymbol,
                            int line,
                            int charPositionInLine,
                            String msg,
                            RecognitionException e) {
        throw new ParseCancellationException(new SyntaxRejectedException(line, charPositionInLine, msg));
    }
}
