package com.ryuqq.catalog.core.spi.noop;

import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.HierarchicalLookup;

import java.util.Map;

/**
 * Hierarchical Lookup NoOp 구현.
 *
 * <p>데이터 백엔드 없이 실행할 때 사용합니다. 모든 키가 존재하지 않는 것으로 취급되어
 * {@code hiera('k', 'default')}는 기본값을, 기본값이 없으면 undef를 돌려받습니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class NoOpHierarchicalLookup implements HierarchicalLookup {

    @Override
    public Result<Value> lookup(String key, Map<String, Value> scope) {
        return Result.ok(Value.undef());
    }
}
