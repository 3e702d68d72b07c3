/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.metrics;

import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.telemetry.metrics.MetricsRegistry;

/**
 * Counters for tag index builds. Recording is a no-op until {@link #initialize(MetricsRegistry)} is called.
 */
public class TagIndexMetrics {
    public Counter recordsIndexed;
    public Counter recordsDuplicate;
    public Counter recordsSkipped;

    public void initialize(MetricsRegistry registry) {
        recordsIndexed = registry.createCounter(
            IndexDBMetricsConstants.TAG_INDEX_RECORDS_INDEXED,
            IndexDBMetricsConstants.TAG_INDEX_RECORDS_INDEXED_DESC,
            IndexDBMetricsConstants.UNIT_RECORDS
        );

        recordsDuplicate = registry.createCounter(
            IndexDBMetricsConstants.TAG_INDEX_RECORDS_DUPLICATE,
            IndexDBMetricsConstants.TAG_INDEX_RECORDS_DUPLICATE_DESC,
            IndexDBMetricsConstants.UNIT_RECORDS
        );

        recordsSkipped = registry.createCounter(
            IndexDBMetricsConstants.TAG_INDEX_RECORDS_SKIPPED,
            IndexDBMetricsConstants.TAG_INDEX_RECORDS_SKIPPED_DESC,
            IndexDBMetricsConstants.UNIT_RECORDS
        );
    }

    public void recordIndexed() {
        increment(recordsIndexed);
    }

    public void recordDuplicate() {
        increment(recordsDuplicate);
    }

    public void recordSkipped() {
        increment(recordsSkipped);
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.add(1);
        }
    }

    public void cleanup() {
        recordsIndexed = null;
        recordsDuplicate = null;
        recordsSkipped = null;
    }
}
