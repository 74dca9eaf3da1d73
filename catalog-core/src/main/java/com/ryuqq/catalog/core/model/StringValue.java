package com.ryuqq.catalog.core.model;

/**
 * 문자열 값.
 *
 * @param value 문자열 (null 불가, 빈 문자열 허용)
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record StringValue(String value) implements Value {

    public StringValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public String render() {
        return "'" + value + "'";
    }
}
