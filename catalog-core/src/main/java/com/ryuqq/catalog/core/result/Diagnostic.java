package com.ryuqq.catalog.core.result;

import com.ryuqq.catalog.core.model.SourceLocation;

/**
 * 구조화된 진단 (종류 + 메시지 + 선택적 위치).
 *
 * @param kind 오류 종류
 * @param message 메시지
 * @param location 소스 위치 (선택, null 가능)
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Diagnostic(
    ErrorKind kind,
    String message,
    SourceLocation location
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public Diagnostic {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // location은 null 허용
    }

    /**
     * 위치 없이 Diagnostic 생성.
     *
     * @param kind 오류 종류
     * @param message 메시지
     * @return Diagnostic
     */
    public static Diagnostic of(ErrorKind kind, String message) {
        return new Diagnostic(kind, message, null);
    }

    /**
     * 위치가 없는 경우에만 위치를 채운 Diagnostic.
     *
     * @param fallback 기본 위치
     * @return Diagnostic
     */
    public Diagnostic orAt(SourceLocation fallback) {
        return location != null || fallback == null ? this : new Diagnostic(kind, message, fallback);
    }

    /**
     * 메시지 앞에 문맥을 덧붙인 Diagnostic.
     *
     * @param context 문맥 (예: 리소스 식별자)
     * @return Diagnostic
     */
    public Diagnostic prefixed(String context) {
        return new Diagnostic(kind, context + ": " + message, location);
    }

    @Override
    public String toString() {
        String base = kind + ": " + message;
        return location == null ? base : base + " (" + location + ")";
    }
}
