package com.ryuqq.catalog.core.spi.noop;

import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.ExportedResourceStore;

import java.util.List;
import java.util.Map;

/**
 * Exported Resource Store NoOp 구현.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>facts(): 항상 빈 Map 반환</li>
 *   <li>exportedResources(): 항상 빈 List 반환</li>
 *   <li>replaceExports(): 저장하지 않고 전달된 개수만 반환</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class NoOpExportedResourceStore implements ExportedResourceStore {

    @Override
    public Result<Map<String, String>> facts(NodeName node) {
        return Result.ok(Map.of());
    }

    @Override
    public Result<List<Resource>> exportedResources(String type) {
        return Result.ok(List.of());
    }

    @Override
    public Result<Integer> replaceExports(NodeName node, List<Resource> resources) {
        return Result.ok(resources.size());
    }
}
