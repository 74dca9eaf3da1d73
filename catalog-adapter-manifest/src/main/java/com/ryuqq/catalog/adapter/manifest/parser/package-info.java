/**
 * Manifest parser.
 *
 * <p>The lexer and parser are generated by ANTLR from {@code ManifestDsl.g4};
 * {@link com.ryuqq.catalog.adapter.manifest.parser.ManifestAstBuilder} turns the parse tree into
 * {@link com.ryuqq.catalog.adapter.manifest.ast.ManifestStatement} records.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.adapter.manifest.parser;
