package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Result;

import java.util.Map;

/**
 * Hierarchical data lookup SPI.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HierarchicalLookup {

    /**
     * Looks up a key.
     *
     * @param key the key
     * @param scope variables used to select the hierarchy level
     * @return the value, {@code undef} when the key is absent, or {@code LOOKUP_ERROR}
     */
    Result<Value> lookup(String key, Map<String, Value> scope);
}
