package com.ryuqq.catalog.core.validation;

import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.Result;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 한 리소스 타입의 검증 파이프라인.
 *
 * <p>허용 파라미터 집합과, 다음 순서로 합성된 Validator로 구성됩니다:</p>
 * <ol>
 *   <li>{@link DefaultValidation#defaultValidate(Set, Map)}</li>
 *   <li>파라미터별 규칙 (선언 순서, 파라미터 안에서도 선언 순서)</li>
 *   <li>리소스 단위 추가 Validator</li>
 * </ol>
 *
 * <p>첫 실패에서 단락하며 오류를 누적하지 않습니다. 이미 유효한 리소스에 다시 적용해도
 * 결과가 같습니다 (멱등).</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class ValidatorPipeline {

    private static final ValidatorPipeline ACCEPT_ALL =
        new ValidatorPipeline(Set.of(), DefaultValidation.defaultValidate(Set.of()));

    private static final ValidatorPipeline PASSTHROUGH =
        new ValidatorPipeline(Set.of(), Validator.identity());

    private final Set<String> legalParameters;
    private final Validator validator;

    private ValidatorPipeline(Set<String> legalParameters, Validator validator) {
        this.legalParameters = Set.copyOf(legalParameters);
        this.validator = validator;
    }

    /**
     * 모든 파라미터를 허용하는 파이프라인 (기본 검증만 수행).
     *
     * <p>등록되지 않은 타입에 사용됩니다.</p>
     *
     * @return ValidatorPipeline
     */
    public static ValidatorPipeline acceptAll() {
        return ACCEPT_ALL;
    }

    /**
     * 아무 검증도 하지 않는 파이프라인.
     *
     * @return ValidatorPipeline
     */
    public static ValidatorPipeline passthrough() {
        return PASSTHROUGH;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> legalParameters() {
        return legalParameters;
    }

    /**
     * 파이프라인 실행.
     *
     * @param resource 대상 리소스
     * @return 정규화된 리소스 또는 첫 번째 실패
     */
    public Result<Resource> validate(Resource resource) {
        return validator.validate(resource);
    }

    /**
     * ValidatorPipeline 빌더.
     */
    public static final class Builder {

        private final Map<String, List<ParameterRule>> parameters = new LinkedHashMap<>();
        private final Map<String, Value> defaults = new LinkedHashMap<>();
        private final List<Validator> extras = new ArrayList<>();

        private Builder() {
        }

        /**
         * 파라미터와 규칙 선언.
         *
         * @param name 파라미터 이름
         * @param rules 규칙 (선언 순서대로 적용)
         * @return this
         * @throws IllegalArgumentException 이미 선언된 파라미터인 경우
         */
        public Builder parameter(String name, ParameterRule... rules) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("parameter name cannot be null or blank");
            }
            if (parameters.containsKey(name)) {
                throw new IllegalArgumentException("parameter already declared: " + name);
            }
            parameters.put(name, List.of(rules));
            return this;
        }

        /**
         * 타입 기본 속성 선언.
         *
         * @param name 속성 이름
         * @param value 기본값 (undef는 무시됨)
         * @return this
         */
        public Builder defaultAttribute(String name, Value value) {
            defaults.put(name, value);
            return this;
        }

        /**
         * 리소스 단위 Validator 추가 (파라미터 규칙 이후 실행).
         *
         * @param extra Validator
         * @return this
         */
        public Builder validate(Validator extra) {
            extras.add(extra);
            return this;
        }

        /**
         * 파이프라인 생성.
         *
         * @return ValidatorPipeline
         * @throws IllegalArgumentException 선언되지 않은 파라미터에 기본값을 지정한 경우
         */
        public ValidatorPipeline build() {
            if (!parameters.isEmpty()) {
                for (String name : defaults.keySet()) {
                    if (!parameters.containsKey(name)) {
                        throw new IllegalArgumentException("default attribute is not a declared parameter: " + name);
                    }
                }
            }
            List<Validator> steps = new ArrayList<>();
            steps.add(DefaultValidation.defaultValidate(parameters.keySet(), defaults));
            parameters.forEach((name, rules) -> rules.forEach(rule -> steps.add(rule.forParameter(name))));
            steps.addAll(extras);
            return new ValidatorPipeline(parameters.keySet(), Validator.chain(steps));
        }
    }
}
