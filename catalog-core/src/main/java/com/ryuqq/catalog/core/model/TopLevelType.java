package com.ryuqq.catalog.core.model;

/**
 * 최상위 선언 종류.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public enum TopLevelType {

    /**
     * 노드 선언 ({@code node 'web1' { }}), site 매니페스트에 위치.
     */
    NODE,

    /**
     * 클래스 선언.
     */
    CLASS,

    /**
     * 정의 타입 선언 ({@code define}).
     */
    DEFINE
}
