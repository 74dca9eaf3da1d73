package com.ryuqq.catalog.adapter.runner;

/**
 * WorkerPoolCompilationRunner 설정 (불변 record).
 *
 * @author Catalog Team
 * @since 1.0.0
 * @param concurrency 동시 컴파일 스레드 수 (1 이상이어야 함)
 */
public record WorkerPoolConfig(int concurrency) {

    /**
     * 기본 설정 생성자 (concurrency=4).
     */
    public WorkerPoolConfig() {
        this(4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException concurrency가 1 미만인 경우
     */
    public WorkerPoolConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withConcurrency(int concurrency) {
        return new WorkerPoolConfig(concurrency);
    }
}
