package com.ryuqq.catalog.adapter.inmemory.stats;

import com.ryuqq.catalog.core.stats.Measurement;
import com.ryuqq.catalog.core.stats.MeasurementSummary;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryMeasurementStore 테스트.
 *
 * @author Catalog Team
 * @since 1.0.0
 */
class InMemoryMeasurementStoreTest {

    private final InMemoryMeasurementStore store = new InMemoryMeasurementStore();

    @Test
    void 기록한_샘플을_키별로_집계() {
        // given
        store.record(new Measurement("web1", 0, 100));
        store.record(new Measurement("web1", 200, 250));
        store.record(new Measurement("db1", 0, 10));

        // when
        Map<String, MeasurementSummary> summaries = store.summaries();

        // then
        assertThat(summaries).containsOnlyKeys("web1", "db1");
        assertThat(summaries.get("web1")).isEqualTo(new MeasurementSummary(2, 150, 50, 100));
    }

    @Test
    void 동시_기록_시_샘플이_유실되지_않음() throws Exception {
        // given
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int t = 0; t < 8; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    store.record(new Measurement("key-" + thread, i, i + 1));
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        assertThat(store.size()).isEqualTo(4000);
        assertThat(store.summaries().get("key-3").count()).isEqualTo(500);
    }

    @Test
    void measurements는_스냅샷을_반환() {
        // given
        store.record(new Measurement("a", 0, 1));

        // when
        List<Measurement> snapshot = store.measurements();
        store.record(new Measurement("b", 0, 1));

        // then
        assertThat(snapshot).hasSize(1);
        store.clear();
        assertThat(store.size()).isZero();
    }
}
