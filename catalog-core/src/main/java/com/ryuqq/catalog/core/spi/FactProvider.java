package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.Result;

import java.util.Map;

/**
 * Source of node facts.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FactProvider {

    /**
     * Returns the facts of a node.
     *
     * @param node the node
     * @return fact name to value, possibly empty, or a diagnostic
     */
    Result<Map<String, String>> facts(NodeName node);
}
