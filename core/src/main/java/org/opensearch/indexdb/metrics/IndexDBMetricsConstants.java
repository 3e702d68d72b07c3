/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.metrics;

/**
 * Names, descriptions and units of the tag index metrics.
 */
public final class IndexDBMetricsConstants {

    private IndexDBMetricsConstants() {}

    public static final String UNIT_RECORDS = "1";

    public static final String TAG_INDEX_RECORDS_INDEXED = "tsdb.tag_index.records.indexed";
    public static final String TAG_INDEX_RECORDS_INDEXED_DESC = "Tag value records added to a tag index";

    public static final String TAG_INDEX_RECORDS_DUPLICATE = "tsdb.tag_index.records.duplicate";
    public static final String TAG_INDEX_RECORDS_DUPLICATE_DESC = "Tag value records discarded because the value id was already indexed";

    public static final String TAG_INDEX_RECORDS_SKIPPED = "tsdb.tag_index.records.skipped";
    public static final String TAG_INDEX_RECORDS_SKIPPED_DESC = "Malformed tag value records skipped while building a tag index";
}
