package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.stats.Measurement;
import com.ryuqq.catalog.core.stats.MeasurementSummary;

import java.util.List;
import java.util.Map;

/**
 * Append-only store of timing samples.
 *
 * <p>Implementations must accept concurrent {@link #record} calls without
 * losing samples.</p>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface MeasurementStore {

    /**
     * Appends a sample.
     *
     * @param measurement the sample
     */
    void record(Measurement measurement);

    /**
     * Snapshot of all samples, in insertion order.
     *
     * @return samples
     */
    List<Measurement> measurements();

    /**
     * Aggregates the samples per key.
     *
     * @return key to summary
     */
    Map<String, MeasurementSummary> summaries();
}
