package com.ryuqq.catalog.core.model;

/**
 * 불리언 값.
 *
 * @param value 불리언
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record BooleanValue(boolean value) implements Value {

    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    /**
     * 캐시된 인스턴스 반환.
     *
     * @param value 불리언
     * @return TRUE 또는 FALSE
     */
    public static BooleanValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String render() {
        return Boolean.toString(value);
    }
}
