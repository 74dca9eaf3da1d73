package com.ryuqq.catalog.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 관계 메타파라미터와 의존 방향.
 *
 * <ul>
 *   <li>BEFORE, NOTIFY: 대상이 선언 리소스에 의존</li>
 *   <li>REQUIRE, AFTER, SUBSCRIBE: 선언 리소스가 대상에 의존</li>
 * </ul>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public enum RelationType {

    BEFORE("before", false),
    NOTIFY("notify", false),
    REQUIRE("require", true),
    AFTER("after", true),
    SUBSCRIBE("subscribe", true);

    private final String parameter;
    private final boolean sourceDepends;

    RelationType(String parameter, boolean sourceDepends) {
        this.parameter = parameter;
        this.sourceDepends = sourceDepends;
    }

    public String parameter() {
        return parameter;
    }

    /**
     * 선언 리소스가 대상에 의존하는지 여부.
     *
     * @return true면 source → target 의존, false면 target → source 의존
     */
    public boolean sourceDependsOnTarget() {
        return sourceDepends;
    }

    /**
     * 파라미터 이름으로 조회.
     *
     * @param parameter 메타파라미터 이름
     * @return RelationType, 관계 파라미터가 아니면 empty
     */
    public static Optional<RelationType> fromParameter(String parameter) {
        return Arrays.stream(values()).filter(r -> r.parameter.equals(parameter)).findFirst();
    }
}
