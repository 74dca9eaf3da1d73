/**
 * Service Provider Interfaces for the catalog compiler's collaborators.
 *
 * <p>The compiler core depends only on these interfaces. Adapters provide the
 * implementations:</p>
 * <ul>
 *   <li>{@link com.ryuqq.catalog.core.spi.ManifestParser} and
 *       {@link com.ryuqq.catalog.core.spi.Interpreter}: the manifest language front end</li>
 *   <li>{@link com.ryuqq.catalog.core.spi.ComputeCache}: single-flight memoization of parses</li>
 *   <li>{@link com.ryuqq.catalog.core.spi.MeasurementStore}: timing samples</li>
 *   <li>{@link com.ryuqq.catalog.core.spi.FactProvider},
 *       {@link com.ryuqq.catalog.core.spi.TemplateEvaluator},
 *       {@link com.ryuqq.catalog.core.spi.HierarchicalLookup},
 *       {@link com.ryuqq.catalog.core.spi.ExportedResourceStore}: external data sources</li>
 * </ul>
 *
 * <p>Every fallible operation returns a {@link com.ryuqq.catalog.core.result.Result}.
 * Implementations may still throw; the compiler converts such exceptions into
 * diagnostics at its boundary.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
package com.ryuqq.catalog.core.spi;
