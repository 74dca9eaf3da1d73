package com.ryuqq.catalog.core.result;

/**
 * {@link Diagnostic}을 운반하는 비검사 예외.
 *
 * <p>재귀 하강 파서와 인터프리터 내부에서 되감기 용도로만 사용되며,
 * SPI 경계에서 {@link Fail}로 변환됩니다.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public class DiagnosticException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    public DiagnosticException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    public DiagnosticException(ErrorKind kind, String message) {
        this(Diagnostic.of(kind, message));
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
