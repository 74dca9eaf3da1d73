package com.ryuqq.catalog.core.contract;

import com.ryuqq.catalog.core.model.NodeName;

import java.util.Map;

/**
 * 노드 하나에 대한 컴파일 요청.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CompileRequest request = CompileRequest.of(
 *     NodeName.of("web1.example.com"),
 *     Map.of("osfamily", "Debian")
 * );
 * </pre>
 *
 * @param node 대상 노드
 * @param facts 노드 facts
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record CompileRequest(
    NodeName node,
    Map<String, String> facts
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException node 또는 facts가 null인 경우
     */
    public CompileRequest {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (facts == null) {
            throw new IllegalArgumentException("facts cannot be null");
        }
        facts = Map.copyOf(facts);
    }

    public static CompileRequest of(NodeName node, Map<String, String> facts) {
        return new CompileRequest(node, facts);
    }
}
