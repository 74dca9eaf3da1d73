package com.ryuqq.catalog.core.model;

/**
 * 컴파일 경고.
 *
 * @param message 경고 메시지
 * @param location 발생 위치 (null 허용)
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Warning(
    String message,
    SourceLocation location
) {

    public Warning {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static Warning of(String message) {
        return new Warning(message, null);
    }

    @Override
    public String toString() {
        return location == null ? message : message + " at " + location;
    }
}
