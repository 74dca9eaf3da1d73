package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.result.Result;

import java.util.List;
import java.util.Map;

/**
 * Exported-resource database SPI.
 *
 * <p>Stores per-node facts and the resources each node exports, so that other
 * nodes can collect them.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called from concurrent compilations</li>
 *   <li>{@link #replaceExports} replaces everything previously exported by the node</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface ExportedResourceStore {

    /**
     * Returns the stored facts of a node.
     *
     * @param node the node
     * @return facts, empty when none are stored, or {@code STORE_ERROR}
     */
    Result<Map<String, String>> facts(NodeName node);

    /**
     * Returns every exported resource of a type, from all nodes.
     *
     * @param type the resource type (lower case)
     * @return the resources, marked as exported, or {@code STORE_ERROR}
     */
    Result<List<Resource>> exportedResources(String type);

    /**
     * Replaces the resources exported by a node.
     *
     * @param node the exporting node
     * @param resources the node's exported resources
     * @return number of resources stored, or {@code STORE_ERROR}
     */
    Result<Integer> replaceExports(NodeName node, List<Resource> resources);
}
