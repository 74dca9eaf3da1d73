package com.ryuqq.catalog.core.validation;

import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.result.Result;

import java.util.List;

/**
 * 리소스 검증/정규화 함수.
 *
 * <p>순수 함수이며 I/O가 없습니다. 유일한 효과는 리소스 속성 맵(또는 nameval의 경우 타이틀)을
 * 다시 쓰는 것입니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Validator {

    /**
     * 리소스 검증.
     *
     * @param resource 대상 리소스
     * @return 정규화된 리소스 또는 실패
     */
    Result<Resource> validate(Resource resource);

    /**
     * 다음 Validator 연결 (첫 실패에서 단락).
     *
     * @param next 다음 Validator
     * @return 합성된 Validator
     */
    default Validator andThen(Validator next) {
        return resource -> validate(resource).flatMap(next::validate);
    }

    /**
     * 항상 성공하는 Validator.
     *
     * @return 입력을 그대로 반환하는 Validator
     */
    static Validator identity() {
        return Result::ok;
    }

    /**
     * 순서대로 합성.
     *
     * @param validators Validator 목록
     * @return 합성된 Validator (빈 목록이면 identity)
     */
    static Validator chain(List<Validator> validators) {
        List<Validator> steps = List.copyOf(validators);
        return resource -> {
            Result<Resource> current = Result.ok(resource);
            for (Validator step : steps) {
                if (current.isFail()) {
                    return current;
                }
                current = step.validate(current.valueOrNull());
            }
            return current;
        };
    }
}
