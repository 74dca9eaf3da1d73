package com.ryuqq.catalog.adapter.inmemory.stats;

import com.ryuqq.catalog.core.spi.MeasurementStore;
import com.ryuqq.catalog.core.stats.Measurement;
import com.ryuqq.catalog.core.stats.MeasurementSummary;
import com.ryuqq.catalog.core.stats.Measurements;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link MeasurementStore}.
 *
 * <p>Samples are appended to a {@link ConcurrentLinkedQueue}, so concurrent
 * recorders never block each other and no sample is lost. Reads take a
 * weakly consistent snapshot.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public class InMemoryMeasurementStore implements MeasurementStore {

    private final ConcurrentLinkedQueue<Measurement> samples = new ConcurrentLinkedQueue<>();

    @Override
    public void record(Measurement measurement) {
        if (measurement == null) {
            throw new IllegalArgumentException("measurement cannot be null");
        }
        samples.add(measurement);
    }

    @Override
    public List<Measurement> measurements() {
        return List.copyOf(samples);
    }

    @Override
    public Map<String, MeasurementSummary> summaries() {
        return Measurements.summarize(measurements());
    }

    public int size() {
        return samples.size();
    }

    public void clear() {
        samples.clear();
    }
}
