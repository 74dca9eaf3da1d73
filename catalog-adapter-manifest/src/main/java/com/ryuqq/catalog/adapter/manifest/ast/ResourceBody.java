package com.ryuqq.catalog.adapter.manifest.ast;

import com.ryuqq.catalog.core.model.SourceLocation;

import java.util.List;

/**
 * {@code title: attributes} inside a resource declaration. The title may evaluate to an array.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record ResourceBody(Expression title, List<AttributeOperation> attributes, SourceLocation location) {

    public ResourceBody {
        attributes = List.copyOf(attributes);
    }
}
