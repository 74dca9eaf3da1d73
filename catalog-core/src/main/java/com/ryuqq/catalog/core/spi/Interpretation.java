package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.Warning;

import java.util.List;

/**
 * Output of an {@link Interpreter}.
 *
 * @param resources resources declared by the manifests, unvalidated
 * @param collected resources collected from the exported-resource store
 * @param warnings non-fatal problems found during evaluation
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Interpretation(
    List<Resource> resources,
    List<Resource> collected,
    List<Warning> warnings
) {

    public Interpretation {
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null");
        }
        if (collected == null) {
            throw new IllegalArgumentException("collected cannot be null");
        }
        if (warnings == null) {
            throw new IllegalArgumentException("warnings cannot be null");
        }
        resources = List.copyOf(resources);
        collected = List.copyOf(collected);
        warnings = List.copyOf(warnings);
    }

    public static Interpretation of(List<Resource> resources) {
        return new Interpretation(resources, List.of(), List.of());
    }
}
