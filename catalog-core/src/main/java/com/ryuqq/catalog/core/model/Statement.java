package com.ryuqq.catalog.core.model;

/**
 * 파싱된 매니페스트 문장.
 *
 * <p>구체적인 문장 종류는 파서 구현이 정의합니다. 코어는 위치와 최상위 선언 여부만 사용합니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface Statement {

    /**
     * 문장 위치.
     *
     * @return 소스 위치
     */
    SourceLocation location();
}
