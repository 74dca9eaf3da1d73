package com.ryuqq.catalog.core.model;

import java.math.BigDecimal;

/**
 * 임의 정밀도 십진수 값.
 *
 * <p>생성 시 후행 0을 제거한 정규형으로 저장하므로 {@code 12}와 {@code 12.0}은 동일합니다.</p>
 *
 * @param value 정규화된 십진수
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record NumberValue(BigDecimal value) implements Value {

    public NumberValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    /**
     * 정수로부터 생성.
     *
     * @param value 정수
     * @return NumberValue
     */
    public static NumberValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    /**
     * 정규 십진 표기 (지수 표기 없음).
     *
     * @return 예: "12", "12.5", "100"
     */
    public String canonicalText() {
        return value.toPlainString();
    }

    /**
     * 정수로 정확히 표현 가능한지 확인.
     *
     * @return 소수부가 없으면 true
     */
    public boolean isIntegral() {
        return value.scale() <= 0;
    }

    @Override
    public String render() {
        return canonicalText();
    }
}
