package com.ryuqq.catalog.adapter.manifest.ast;

import java.util.List;

/**
 * {@code if}/{@code elsif} arm.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Branch(Expression condition, List<ManifestStatement> body) {

    public Branch {
        body = List.copyOf(body);
    }
}
