/**
 * Manifest language front end.
 *
 * <p>Implements a documented subset of the manifest language:</p>
 * <ul>
 *   <li>{@code ast}: statements, expressions and string interpolation parts</li>
 *   <li>{@code parser}: ANTLR grammar plus {@link com.ryuqq.catalog.adapter.manifest.parser.DslManifestParser},
 *       the {@link com.ryuqq.catalog.core.spi.ManifestParser} implementation</li>
 *   <li>{@code interpreter}: {@link com.ryuqq.catalog.adapter.manifest.interpreter.ManifestInterpreter},
 *       the {@link com.ryuqq.catalog.core.spi.Interpreter} implementation</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.adapter.manifest;
