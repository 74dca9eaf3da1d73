package com.ryuqq.catalog.application.compiler;

import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.Result;

import java.util.Map;

/**
 * 노드 카탈로그 컴파일러.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Catalog&gt; result = compiler.compile(NodeName.of("web1.example.com"), facts);
 *
 * if (result instanceof Ok&lt;Catalog&gt; ok) {
 *     apply(ok.value());
 * } else {
 *     log.warn("compilation failed: {}", result.diagnosticOrNull());
 * }
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>여러 스레드에서 동시에 호출할 수 있습니다</li>
 *   <li>실패 시 부분 카탈로그 없이 진단 하나만 반환합니다</li>
 *   <li>협력 객체의 예외는 진단으로 변환되며 호출자에게 전파되지 않습니다</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface CatalogCompiler {

    /**
     * 노드 카탈로그 컴파일.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>site 매니페스트를 (캐시를 거쳐) 파싱하고 노드 선언 선택</li>
     *   <li>facts와 함께 해석하여 리소스 수집</li>
     *   <li>리소스별 타입 검증 및 정규화</li>
     *   <li>중복 검사, export 분리, 의존 관계 해석</li>
     *   <li>(설정 시) 추가 검사 실행 및 export 발행</li>
     * </ol>
     *
     * @param node 대상 노드
     * @param facts 노드 facts
     * @return 카탈로그 또는 진단
     * @throws IllegalArgumentException node 또는 facts가 null인 경우
     */
    Result<Catalog> compile(NodeName node, Map<String, String> facts);

    /**
     * 파싱/컴파일/템플릿 측정 통계.
     *
     * @return CompilerStatistics
     */
    CompilerStatistics statistics();
}
