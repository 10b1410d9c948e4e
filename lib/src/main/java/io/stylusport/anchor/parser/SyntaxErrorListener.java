package io.stylusport.anchor.parser;

import io.stylusport.anchor.syntax.SourceLocation;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Stops lexing or parsing at the first error; {@link SyntaxTreeBuilder} turns it into an {@link AnchorParseException}. */
final class SyntaxErrorListener extends BaseErrorListener {
    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    private SyntaxErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        throw new SyntaxError(line, charPositionInLine + 1, msg, e);
    }

    /** Carries the 1-based position of the error out of the ANTLR call stack. */
    static final class SyntaxError extends ParseCancellationException {
        private static final long serialVersionUID = 1L;

        private final int line;
        private final int column;

        SyntaxError(int line, int column, String detail, RecognitionException cause) {
            super("line " + line + ":" + column + " " + detail, cause);
            this.line = line;
            this.column = column;
        }

        SourceLocation locationIn(String sourceName) {
            return new SourceLocation(sourceName, line, column);
        }
    }
}
