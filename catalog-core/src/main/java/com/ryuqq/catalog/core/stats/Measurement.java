package com.ryuqq.catalog.core.stats;

/**
 * 하나의 시간 측정 샘플.
 *
 * @param key 측정 키 (파일 경로, 노드 이름, 템플릿 이름 등)
 * @param startNanos 시작 시각 ({@link System#nanoTime()})
 * @param endNanos 종료 시각 ({@link System#nanoTime()})
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record Measurement(
    String key,
    long startNanos,
    long endNanos
) {

    public Measurement {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (endNanos < startNanos) {
            throw new IllegalArgumentException("endNanos cannot be before startNanos");
        }
    }

    /**
     * 소요 시간.
     *
     * @return 나노초
     */
    public long durationNanos() {
        return endNanos - startNanos;
    }
}
