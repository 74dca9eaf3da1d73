package com.ryuqq.catalog.core.stats;

import com.ryuqq.catalog.core.spi.MeasurementStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 측정 유틸리티.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;List&lt;Statement&gt;&gt; parsed =
 *     Measurements.measure(parsingStore, path.toString(), () -&gt; parser.parse(path));
 * </pre>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public final class Measurements {

    private Measurements() {
    }

    /**
     * 동작을 실행하고 소요 시간을 기록.
     *
     * <p>동작이 예외로 끝나도 샘플은 기록되며, 예외는 그대로 전파됩니다.</p>
     *
     * @param store 측정 저장소
     * @param key 측정 키
     * @param action 동작
     * @param <T> 결과 타입
     * @return 동작의 결과 (변경 없음)
     */
    public static <T> T measure(MeasurementStore store, String key, Supplier<T> action) {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            store.record(new Measurement(key, start, Math.max(start, System.nanoTime())));
        }
    }

    /**
     * 샘플 목록을 키별로 집계.
     *
     * @param measurements 샘플
     * @return 키별 요약 (첫 등장 순서)
     */
    public static Map<String, MeasurementSummary> summarize(List<Measurement> measurements) {
        Map<String, MeasurementSummary> summaries = new LinkedHashMap<>();
        for (Measurement m : measurements) {
            summaries.merge(m.key(), MeasurementSummary.of(m), MeasurementSummary::merge);
        }
        return summaries;
    }
}
