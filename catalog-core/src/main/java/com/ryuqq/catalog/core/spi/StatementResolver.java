package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.TopLevelStatement;
import com.ryuqq.catalog.core.model.TopLevelType;
import com.ryuqq.catalog.core.result.Result;

/**
 * Resolves a named top-level statement (node, class or define).
 *
 * <p>Provided by the compiler to the interpreter. It maps the name to a
 * manifest file, obtains that file's statements through the parse cache and
 * selects the requested declaration.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StatementResolver {

    /**
     * Resolves a top-level statement.
     *
     * @param type the declaration kind
     * @param name the declaration name (node name for {@code NODE})
     * @return the statement, or {@code MISSING_DEFINITION} when absent
     */
    Result<TopLevelStatement> resolve(TopLevelType type, String name);
}
