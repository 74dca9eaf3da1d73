package com.ryuqq.catalog.adapter.manifest.ast;

import com.ryuqq.catalog.core.model.SourceLocation;

/**
 * {@code name => value} inside a resource body.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record AttributeOperation(String name, Expression value, SourceLocation location) {
}
