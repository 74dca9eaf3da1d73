package com.ryuqq.catalog.core.result;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 불가)
 * @param <T> 값 타입
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return new Ok<>(mapper.apply(value));
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> next) {
        return next.apply(value);
    }

    @Override
    public Result<T> mapDiagnostic(Function<Diagnostic, Diagnostic> mapper) {
        return this;
    }

    @Override
    public T orElseThrow() {
        return value;
    }

    @Override
    public T valueOrNull() {
        return value;
    }

    @Override
    public Diagnostic diagnosticOrNull() {
        return null;
    }
}
