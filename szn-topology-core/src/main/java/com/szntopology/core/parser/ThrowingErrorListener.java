package com.szntopology.core.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * ANTLR error listener that turns the first lexer or parser error into a
 * {@link SznSyntaxException} carrying the offending source line.
 */
class ThrowingErrorListener extends BaseErrorListener {

    private final SourceLines lines;

    ThrowingErrorListener(SourceLines lines) {
        this.lines = lines;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        throw new SznSyntaxException(line, lines.line(line), msg + " at column " + (charPositionInLine + 1), e);
    }
}
