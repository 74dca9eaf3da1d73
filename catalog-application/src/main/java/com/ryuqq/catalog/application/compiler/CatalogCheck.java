package com.ryuqq.catalog.application.compiler;

import com.ryuqq.catalog.core.model.Catalog;
import com.ryuqq.catalog.core.result.Diagnostic;

import java.util.Optional;

/**
 * 컴파일된 카탈로그에 대한 추가 일관성 검사.
 *
 * <p>컴파일러 설정에서 추가 검사가 켜진 경우에만 실행됩니다. 첫 번째로 반환된 진단이
 * CHECK_FAILED로 컴파일 결과를 대체합니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CatalogCheck {

    /**
     * 카탈로그 검사.
     *
     * @param catalog 검사 대상
     * @return 문제가 있으면 진단, 없으면 empty
     */
    Optional<Diagnostic> check(Catalog catalog);
}
