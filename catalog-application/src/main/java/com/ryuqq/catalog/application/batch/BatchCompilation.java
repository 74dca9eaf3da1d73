package com.ryuqq.catalog.application.batch;

import com.ryuqq.catalog.core.contract.CompileRequest;
import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.result.Result;

import java.util.List;

/**
 * 여러 노드의 동시 컴파일.
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>결과는 요청 순서와 같은 순서로 반환됩니다</li>
 *   <li>한 노드의 실패(작업자 예외 포함)는 그 노드의 결과에만 영향을 줍니다</li>
 *   <li>같은 매니페스트를 공유하는 노드들도 파일당 한 번만 파싱합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;Result&lt;Catalog&gt;&gt; results = batch.compileNodes(List.of(
 *     NodeName.of("web1"), NodeName.of("web2"), NodeName.of("db1")));
 * batch.shutdown();
 * </pre>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface BatchCompilation {

    /**
     * facts가 주어진 요청들을 컴파일.
     *
     * @param requests 컴파일 요청
     * @return 요청 순서의 결과
     */
    List<Result<Catalog>> compileAll(List<CompileRequest> requests);

    /**
     * 노드 facts를 조회한 뒤 컴파일.
     *
     * <p>facts 조회 실패는 해당 노드의 결과로 반환됩니다.</p>
     *
     * @param nodes 노드 이름
     * @return 노드 순서의 결과
     */
    List<Result<Catalog>> compileNodes(List<NodeName> nodes);

    /**
     * 작업자 풀 종료.
     *
     * <p>진행 중인 컴파일은 완료까지 기다립니다.</p>
     */
    void shutdown();
}
