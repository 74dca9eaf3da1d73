package com.ryuqq.catalog.adapter.manifest.parser;

import com.ryuqq.catalog.adapter.manifest.ast.ManifestStatement;
import com.ryuqq.catalog.core.model.SourceLocation;
import com.ryuqq.catalog.core.model.Statement;
import com.ryuqq.catalog.core.result.Diagnostic;
import com.ryuqq.catalog.core.result.DiagnosticException;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.ManifestParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ManifestParser} for the manifest DSL.
 *
 * <p><strong>Failure Mapping:</strong></p>
 * <ul>
 *   <li>File missing: {@code MISSING_DEFINITION}</li>
 *   <li>File unreadable: {@code PARSE_ERROR}</li>
 *   <li>Lexical or syntax error: {@code PARSE_ERROR} with file, line and column</li>
 *   <li>Nesting too deep for the parser stack: {@code PARSE_ERROR} at the start of the file</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public class DslManifestParser implements ManifestParser {

    private static final Logger log = LoggerFactory.getLogger(DslManifestParser.class);

    @Override
    public Result<List<Statement>> parse(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (!Files.isRegularFile(file)) {
            return Result.fail(ErrorKind.MISSING_DEFINITION, "Manifest file not found: " + file);
        }

        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read manifest {}: {}", file, e.toString());
            return Result.fail(ErrorKind.PARSE_ERROR, "Cannot read " + file + ": " + e.getMessage());
        }

        return parseSource(file.toString(), source);
    }

    /**
     * Parses manifest text.
     *
     * @param fileName name used in source locations
     * @param source manifest text
     * @return statements or {@code PARSE_ERROR}
     */
    public Result<List<Statement>> parseSource(String fileName, String source) {
        SyntaxErrorListener errors = new SyntaxErrorListener(fileName);
        try {
            ManifestDslLexer lexer = new ManifestDslLexer(CharStreams.fromString(source, fileName));
            lexer.removeErrorListeners();
            lexer.addErrorListener(errors);
            ManifestDslParser parser = new ManifestDslParser(new CommonTokenStream(lexer));
            parser.removeErrorListeners();
            parser.addErrorListener(errors);

            List<ManifestStatement> statements = new ManifestAstBuilder(fileName).program(parser.program());
            log.debug("Parsed {} top-level statements from {}", statements.size(), fileName);
            List<Statement> parsed = List.copyOf(statements);
            return Result.ok(parsed);
        } catch (DiagnosticException e) {
            return Result.fail(e.getDiagnostic());
        } catch (StackOverflowError e) {
            log.warn("Manifest {} is nested too deeply to parse", fileName);
            return Result.fail(new Diagnostic(ErrorKind.PARSE_ERROR,
                "Manifest is nested too deeply to parse", new SourceLocation(fileName, 1, 1)));
        }
    }
}
