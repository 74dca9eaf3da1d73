package com.ryuqq.catalog.adapter.runner;

import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.ExportedResourceStore;
import com.ryuqq.catalog.core.spi.FactProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 저장소 facts 우선, 없으면 로컬 facts와 파생 facts를 사용하는 FactProvider.
 *
 * <p><strong>파생 facts (로컬 값보다 우선):</strong></p>
 * <ul>
 *   <li>fqdn: 노드 이름</li>
 *   <li>hostname: 첫 번째 점 앞부분</li>
 *   <li>domain: 첫 번째 점 뒷부분 (없으면 빈 문자열)</li>
 *   <li>clientcert: 노드 이름</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class FallbackFactProvider implements FactProvider {

    private static final Logger log = LoggerFactory.getLogger(FallbackFactProvider.class);

    private final ExportedResourceStore store;
    private final FactProvider local;

    /**
     * 생성자.
     *
     * @param store facts를 보관하는 저장소
     * @param local 로컬 fact 제공자
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public FallbackFactProvider(ExportedResourceStore store, FactProvider local) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (local == null) {
            throw new IllegalArgumentException("local cannot be null");
        }
        this.store = store;
        this.local = local;
    }

    @Override
    public Result<Map<String, String>> facts(NodeName node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }

        Result<Map<String, String>> stored = storedFacts(node);
        if (stored.isOk() && !stored.valueOrNull().isEmpty()) {
            return stored;
        }
        if (stored.isFail()) {
            log.warn("Fact store unavailable for {}, using local facts: {}", node, stored.diagnosticOrNull());
        } else {
            log.debug("No stored facts for {}, using local facts", node);
        }

        return local.facts(node).map(facts -> withDerivedFacts(node, facts));
    }

    private Result<Map<String, String>> storedFacts(NodeName node) {
        try {
            return store.facts(node);
        } catch (RuntimeException e) {
            return Result.fail(ErrorKind.STORE_ERROR, "Fact lookup failed for " + node + ": " + e.getMessage());
        }
    }

    private static Map<String, String> withDerivedFacts(NodeName node, Map<String, String> facts) {
        Map<String, String> merged = new LinkedHashMap<>(facts);
        merged.put("fqdn", node.getValue());
        merged.put("hostname", node.hostname());
        merged.put("domain", node.domain());
        merged.put("clientcert", node.getValue());
        return Collections.unmodifiableMap(merged);
    }
}
