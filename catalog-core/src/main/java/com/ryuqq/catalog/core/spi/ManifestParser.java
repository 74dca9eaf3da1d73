package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.Statement;
import com.ryuqq.catalog.core.result.Result;

import java.nio.file.Path;
import java.util.List;

/**
 * Manifest Parser SPI.
 *
 * <p>Turns one manifest file into its list of statements. The compiler caches
 * the result per absolute path, so a parser is invoked at most once per file
 * for the lifetime of a compiler.</p>
 *
 * <p><strong>Failure Mapping:</strong></p>
 * <ul>
 *   <li>File does not exist: {@code MISSING_DEFINITION}</li>
 *   <li>Syntax error: {@code PARSE_ERROR} with line and column</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface ManifestParser {

    /**
     * Parses a manifest file.
     *
     * @param file the manifest path
     * @return the parsed statements, or a diagnostic
     */
    Result<List<Statement>> parse(Path file);
}
