package com.ryuqq.catalog.core.validation;

/**
 * 파라미터 이름을 받아 Validator를 만드는 규칙.
 *
 * <p>{@code Validators::string}처럼 메서드 참조로 선언하고
 * {@link ValidatorPipeline.Builder#parameter(String, ParameterRule...)}에 넘깁니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ParameterRule {

    /**
     * 파라미터에 규칙 적용.
     *
     * @param parameter 파라미터 이름
     * @return 해당 파라미터용 Validator
     */
    Validator forParameter(String parameter);
}
