package com.ryuqq.catalog.core.validation;

import com.ryuqq.catalog.core.model.Metaparameters;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.model.UndefinedValue;
import com.ryuqq.catalog.core.model.Value;
import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 모든 타입 전용 Validator 앞에서 실행되는 기본 검증.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>허용 파라미터 검사: 속성 키 - (허용 파라미터 ∪ 메타파라미터)가 비어 있지 않으면 UNKNOWN_PARAMETER.
 *       허용 파라미터가 비어 있으면 모든 키를 허용하고 이 단계를 건너뜁니다.</li>
 *   <li>타입 기본 속성 병합: undef 항목은 제외하고, 이미 설정된 속성은 덮어쓰지 않습니다.</li>
 * </ol>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class DefaultValidation {

    private DefaultValidation() {
    }

    /**
     * 기본 검증 (기본 속성 없음).
     *
     * @param legalParameters 허용 파라미터 (비어 있으면 모두 허용)
     * @return Validator
     */
    public static Validator defaultValidate(Set<String> legalParameters) {
        return defaultValidate(legalParameters, Map.of());
    }

    /**
     * 기본 검증.
     *
     * @param legalParameters 허용 파라미터 (비어 있으면 모두 허용)
     * @param defaults 타입 기본 속성
     * @return Validator
     */
    public static Validator defaultValidate(Set<String> legalParameters, Map<String, Value> defaults) {
        return checkParameterList(legalParameters).andThen(addDefaults(defaults));
    }

    /**
     * 허용되지 않은 파라미터 검사.
     *
     * @param legalParameters 허용 파라미터
     * @return Validator
     */
    public static Validator checkParameterList(Set<String> legalParameters) {
        Set<String> legal = Set.copyOf(legalParameters);
        if (legal.isEmpty()) {
            return Validator.identity();
        }
        return res -> {
            Set<String> unknown = new TreeSet<>(res.attributes().keySet());
            unknown.removeIf(key -> legal.contains(key) || Metaparameters.isMetaparameter(key));
            if (unknown.isEmpty()) {
                return Result.ok(res);
            }
            return Result.fail(ErrorKind.UNKNOWN_PARAMETER, "Unknown parameters: " + String.join(", ", unknown));
        };
    }

    /**
     * 타입 기본 속성 병합.
     *
     * @param defaults 기본 속성
     * @return Validator
     */
    public static Validator addDefaults(Map<String, Value> defaults) {
        Map<String, Value> effective = new LinkedHashMap<>();
        defaults.forEach((name, value) -> {
            if (!(value instanceof UndefinedValue)) {
                effective.put(name, value);
            }
        });
        if (effective.isEmpty()) {
            return Validator.identity();
        }
        return res -> {
            Resource current = res;
            for (Map.Entry<String, Value> entry : effective.entrySet()) {
                if (!current.hasAttribute(entry.getKey())) {
                    current = current.withAttribute(entry.getKey(), entry.getValue());
                }
            }
            return Result.ok(current);
        };
    }
}
