package com.ryuqq.catalog.core.model;

/**
 * 최상위 선언 문장 (node, class, define).
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface TopLevelStatement extends Statement {

    /**
     * 선언 종류.
     *
     * @return TopLevelType
     */
    TopLevelType type();

    /**
     * 선언 이름 (node의 경우 노드 이름 또는 "default").
     *
     * @return 이름
     */
    String name();
}
