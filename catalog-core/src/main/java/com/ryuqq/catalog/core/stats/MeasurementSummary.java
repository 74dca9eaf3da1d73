package com.ryuqq.catalog.core.stats;

/**
 * 키별 측정 요약.
 *
 * @param count 샘플 수
 * @param totalNanos 합계
 * @param minNanos 최소
 * @param maxNanos 최대
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public record MeasurementSummary(
    long count,
    long totalNanos,
    long minNanos,
    long maxNanos
) {

    public MeasurementSummary {
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        if (minNanos > maxNanos) {
            throw new IllegalArgumentException("minNanos cannot exceed maxNanos");
        }
    }

    public static MeasurementSummary of(Measurement measurement) {
        long d = measurement.durationNanos();
        return new MeasurementSummary(1, d, d, d);
    }

    /**
     * 샘플 하나를 더한 요약.
     *
     * @param measurement 샘플
     * @return 새 요약
     */
    public MeasurementSummary add(Measurement measurement) {
        long d = measurement.durationNanos();
        return new MeasurementSummary(count + 1, totalNanos + d, Math.min(minNanos, d), Math.max(maxNanos, d));
    }

    /**
     * 두 요약의 합.
     *
     * @param other 다른 요약
     * @return 합친 요약
     */
    public MeasurementSummary merge(MeasurementSummary other) {
        return new MeasurementSummary(
            count + other.count,
            totalNanos + other.totalNanos,
            Math.min(minNanos, other.minNanos),
            Math.max(maxNanos, other.maxNanos)
        );
    }

    public double meanNanos() {
        return (double) totalNanos / count;
    }
}
