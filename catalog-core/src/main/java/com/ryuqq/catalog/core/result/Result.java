package com.ryuqq.catalog.core.result;

import com.ryuqq.catalog.core.model.SourceLocation;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 실패 가능한 연산의 결과.
 *
 * <p>Result는 두 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 값을 보유</li>
 *   <li>{@link Fail}: 실패, 구조화된 {@link Diagnostic}을 보유</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 경우 외의 구현은 존재하지 않습니다.
 * {@link #flatMap(Function)}은 첫 실패에서 단락(short-circuit)합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Resource&gt; result = Validators.string("mode").validate(resource)
 *     .flatMap(Validators.mandatory("path")::validate);
 *
 * if (result instanceof Fail&lt;Resource&gt; fail) {
 *     log.warn("validation failed: {}", fail.diagnostic());
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Ok, Fail {

    /**
     * 성공 결과 생성.
     *
     * @param value 값
     * @param <T> 값 타입
     * @return Ok
     */
    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param diagnostic 진단
     * @param <T> 값 타입
     * @return Fail
     */
    static <T> Result<T> fail(Diagnostic diagnostic) {
        return new Fail<>(diagnostic);
    }

    /**
     * 실패 결과 생성 (위치 없음).
     *
     * @param kind 오류 종류
     * @param message 메시지
     * @param <T> 값 타입
     * @return Fail
     */
    static <T> Result<T> fail(ErrorKind kind, String message) {
        return new Fail<>(Diagnostic.of(kind, message));
    }

    /**
     * 실패 결과 생성 (위치 포함).
     *
     * @param kind 오류 종류
     * @param message 메시지
     * @param location 위치 (null 허용)
     * @param <T> 값 타입
     * @return Fail
     */
    static <T> Result<T> fail(ErrorKind kind, String message, SourceLocation location) {
        return new Fail<>(new Diagnostic(kind, message, location));
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 성공 값 변환.
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 결과 (실패는 그대로 전달)
     */
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    /**
     * 실패 가능한 다음 단계 연결.
     *
     * @param next 다음 단계
     * @param <U> 다음 단계 값 타입
     * @return 다음 단계 결과 (실패 시 next는 호출되지 않음)
     */
    <U> Result<U> flatMap(Function<? super T, Result<U>> next);

    /**
     * 진단 변환 (실패인 경우만).
     *
     * @param mapper 진단 변환 함수
     * @return 변환된 결과 (성공은 그대로)
     */
    Result<T> mapDiagnostic(Function<Diagnostic, Diagnostic> mapper);

    /**
     * 성공 시 동작 실행.
     *
     * @param action 동작
     * @return this
     */
    default Result<T> ifOk(Consumer<? super T> action) {
        if (this instanceof Ok<T> ok) {
            action.accept(ok.value());
        }
        return this;
    }

    /**
     * 성공 값 반환, 실패 시 예외.
     *
     * @return 성공 값
     * @throws DiagnosticException 실패인 경우
     */
    T orElseThrow();

    /**
     * 성공 값 반환.
     *
     * @return 성공 값, 실패면 null
     */
    T valueOrNull();

    /**
     * 실패 진단 반환.
     *
     * @return 진단, 성공이면 null
     */
    Diagnostic diagnosticOrNull();
}
