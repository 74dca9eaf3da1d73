package com.ryuqq.catalog.core.model;

/**
 * 매니페스트 속성 값.
 *
 * <p>닫힌 태그드 유니온으로, 다섯 가지 경우만 존재합니다:</p>
 * <ul>
 *   <li>{@link StringValue}: 문자열</li>
 *   <li>{@link BooleanValue}: 불리언</li>
 *   <li>{@link NumberValue}: 임의 정밀도 십진수</li>
 *   <li>{@link ArrayValue}: 값의 배열</li>
 *   <li>{@link UndefinedValue}: undef</li>
 * </ul>
 *
 * <p>모든 구현체는 불변입니다. Validator는 {@code instanceof}로 경우를 구분합니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public sealed interface Value permits StringValue, BooleanValue, NumberValue, ArrayValue, UndefinedValue {

    /**
     * 진단 메시지용 표현.
     *
     * @return 사람이 읽을 수 있는 값 표현 (문자열은 따옴표 포함)
     */
    String render();

    /**
     * 문자열 값 생성.
     *
     * @param value 문자열
     * @return StringValue
     */
    static Value string(String value) {
        return new StringValue(value);
    }

    /**
     * 숫자 값 생성.
     *
     * @param value 정수
     * @return NumberValue
     */
    static Value number(long value) {
        return NumberValue.of(value);
    }

    /**
     * 불리언 값 생성.
     *
     * @param value 불리언
     * @return BooleanValue
     */
    static Value bool(boolean value) {
        return BooleanValue.of(value);
    }

    /**
     * 배열 값 생성.
     *
     * @param elements 원소
     * @return ArrayValue
     */
    static Value array(Value... elements) {
        return new ArrayValue(java.util.List.of(elements));
    }

    /**
     * undef 값.
     *
     * @return UndefinedValue 싱글턴
     */
    static Value undef() {
        return UndefinedValue.INSTANCE;
    }
}
