package com.ryuqq.catalog.core.result;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>재시도 정책은 호출자의 책임이며, Fail은 단일 진단만 보유합니다.</p>
 *
 * @param diagnostic 진단 (null 불가)
 * @param <T> 성공했을 경우의 값 타입
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Fail<T>(Diagnostic diagnostic) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException diagnostic이 null인 경우
     */
    public Fail {
        if (diagnostic == null) {
            throw new IllegalArgumentException("diagnostic cannot be null");
        }
    }

    /**
     * 값 타입만 바꾼 같은 실패.
     *
     * @param <U> 새 값 타입
     * @return 같은 진단을 보유한 Fail
     */
    public <U> Fail<U> cast() {
        return new Fail<>(diagnostic);
    }

    /**
     * 오류 종류.
     *
     * @return ErrorKind
     */
    public ErrorKind kind() {
        return diagnostic.kind();
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return cast();
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> next) {
        return cast();
    }

    @Override
    public Result<T> mapDiagnostic(Function<Diagnostic, Diagnostic> mapper) {
        return new Fail<>(mapper.apply(diagnostic));
    }

    @Override
    public T orElseThrow() {
        throw new DiagnosticException(diagnostic);
    }

    @Override
    public T valueOrNull() {
        return null;
    }

    @Override
    public Diagnostic diagnosticOrNull() {
        return diagnostic;
    }
}
