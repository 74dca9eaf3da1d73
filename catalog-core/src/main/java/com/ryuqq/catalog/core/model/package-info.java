/**
 * Value and resource model of the catalog compiler.
 *
 * <h2>Values</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalog.core.model.Value} - Sealed interface for manifest values</li>
 *   <li>{@link com.ryuqq.catalog.core.model.StringValue}, {@link com.ryuqq.catalog.core.model.BooleanValue},
 *       {@link com.ryuqq.catalog.core.model.NumberValue}, {@link com.ryuqq.catalog.core.model.ArrayValue},
 *       {@link com.ryuqq.catalog.core.model.UndefinedValue} - The value cases</li>
 * </ul>
 *
 * <h2>Resources and Catalogs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.catalog.core.model.ResourceId} - Resource identity (type, title)</li>
 *   <li>{@link com.ryuqq.catalog.core.model.Resource} - Immutable resource with attributes</li>
 *   <li>{@link com.ryuqq.catalog.core.model.Catalog} - Compiled resources, dependency edges and exports</li>
 *   <li>{@link com.ryuqq.catalog.core.model.RelationType} - Relationship metaparameters and edge direction</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Every type is immutable; copy methods return new instances</li>
 *   <li><strong>Validation:</strong> Constructors reject null and malformed input</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Catalog Team
 */
package com.ryuqq.catalog.core.model;
