package com.ryuqq.catalog.adapter.manifest.ast;

import com.ryuqq.catalog.core.model.SourceLocation;

import java.util.Optional;

/**
 * Class or define parameter.
 *
 * @param name parameter name without {@code $}
 * @param defaultValue default expression, null when the parameter is required
 * @param location declaration position
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Parameter(String name, Expression defaultValue, SourceLocation location) {

    public Optional<Expression> defaultExpression() {
        return Optional.ofNullable(defaultValue);
    }
}
