package com.ryuqq.catalog.core.model;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 모든 리소스 타입에서 허용되는 메타파라미터.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class Metaparameters {

    /**
     * 관계 메타파라미터와 태그 등 공통 메타파라미터 전체.
     */
    public static final Set<String> NAMES = Stream.concat(
        Arrays.stream(RelationType.values()).map(RelationType::parameter),
        Stream.of("tag", "alias", "audit", "loglevel", "noop", "schedule", "stage")
    ).collect(Collectors.toUnmodifiableSet());

    private Metaparameters() {
    }

    public static boolean isMetaparameter(String name) {
        return NAMES.contains(name);
    }
}
