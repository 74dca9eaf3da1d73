package com.ryuqq.catalog.adapter.manifest.parser;

import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.DiagnosticException;
import com.ryuqq.catalog.core.result.ErrorKind;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Turns the first lexer or parser error into a {@code PARSE_ERROR} diagnostic.
 *
 * <p>Throws instead of collecting, so parsing stops at the first error and ANTLR's
 * recovery never produces a partial tree.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private final String file;

    SyntaxErrorListener(String file) {
        this.file = file;
    }

    @Override
    public void syntaxError(
        Recognizer<?, ?> recognizer,
        Object offendingSymbol,
        int line,
        int charPositionInLine,
        String msg,
        RecognitionException e
    ) {
        SourceLocation at = new SourceLocation(file, Math.max(line, 1), Math.max(charPositionInLine, 0) + 1);
        throw new DiagnosticException(new Diagnostic(ErrorKind.PARSE_ERROR, "Syntax error: " + msg, at));
    }
}
