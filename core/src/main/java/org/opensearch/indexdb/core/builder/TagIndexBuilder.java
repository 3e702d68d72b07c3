/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.builder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.indexdb.core.tag.TagStore;
import org.opensearch.indexdb.metrics.TagIndexMetrics;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds the {@link TagIndex} of a segment from the tag value records read while scanning it.
 *
 * <p>One {@link TagStore} is created per distinct tag name. The first record of a (tag, value id) pair wins;
 * later records for the same pair are counted as duplicates and dropped.</p>
 *
 * <p>A record that cannot be indexed (missing tag name, undecodable posting list, tag limit reached) is logged
 * and skipped so that one bad record does not abort the build. With
 * {@link TagIndexConfig#ignoreMalformed()} disabled a {@link TagIndexException} is thrown instead and the
 * builder keeps the records added so far.</p>
 *
 * <p>Not thread-safe: a builder is driven by the single thread that scans the segment.</p>
 */
public class TagIndexBuilder {
    private static final Logger logger = LogManager.getLogger(TagIndexBuilder.class);

    private final TagIndexConfig config;
    private final TagIndexMetrics metrics;
    private final Map<String, TagStore> stores = new HashMap<>();

    private long recordsIndexed;
    private long recordsDuplicate;
    private long recordsSkipped;
    private boolean built;

    public TagIndexBuilder(TagIndexConfig config) {
        this(config, new TagIndexMetrics());
    }

    public TagIndexBuilder(TagIndexConfig config, TagIndexMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Adds a serialized record.
     *
     * @return {@code true} if the record was indexed, {@code false} if it was a duplicate or was skipped
     * @throws TagIndexException if the record is malformed and malformed records are not ignored
     */
    public boolean add(TagRecord record) {
        ensureOpen();
        if (record.tagName() == null || record.tagName().isEmpty()) {
            return skip(record.tagName(), record.valueId(), "missing tag name", null);
        }
        if (record.postings() == null) {
            return skip(record.tagName(), record.valueId(), "missing posting list", null);
        }

        RoaringBitmap postings;
        try {
            postings = record.decodePostings();
        } catch (IOException e) {
            return skip(record.tagName(), record.valueId(), e.getMessage(), e);
        }
        return put(record.tagName(), record.valueId(), postings);
    }

    /**
     * Adds an already decoded posting list.
     *
     * @return {@code true} if the value was indexed, {@code false} if it was a duplicate or was skipped
     * @throws TagIndexException if the record cannot be indexed and malformed records are not ignored
     */
    public boolean add(String tagName, int valueId, RoaringBitmap postings) {
        ensureOpen();
        if (tagName == null || tagName.isEmpty()) {
            return skip(tagName, valueId, "missing tag name", null);
        }
        if (postings == null) {
            return skip(tagName, valueId, "missing posting list", null);
        }
        return put(tagName, valueId, postings);
    }

    private boolean put(String tagName, int valueId, RoaringBitmap postings) {
        TagStore store = stores.get(tagName);
        if (store == null) {
            if (stores.size() >= config.maxTags()) {
                return skip(tagName, valueId, "tag limit [" + config.maxTags() + "] reached", null);
            }
            store = new TagStore();
            stores.put(tagName, store);
        }

        if (store.put(valueId, postings)) {
            recordsIndexed++;
            metrics.recordIndexed();
            return true;
        }
        recordsDuplicate++;
        metrics.recordDuplicate();
        logger.trace("Value [{}] of tag [{}] is already indexed, keeping the first posting list", Integer.toUnsignedString(valueId), tagName);
        return false;
    }

    private boolean skip(String tagName, int valueId, String reason, Exception cause) {
        String value = Integer.toUnsignedString(valueId);
        if (!config.ignoreMalformed()) {
            throw new TagIndexException("failed to index value [{}] of tag [{}]: {}", cause, value, tagName, reason);
        }
        recordsSkipped++;
        metrics.recordSkipped();
        if (cause == null) {
            logger.warn("Skipping value [{}] of tag [{}]: {}", value, tagName, reason);
        } else {
            logger.warn("Skipping value [" + value + "] of tag [" + tagName + "]", cause);
        }
        return false;
    }

    /**
     * Finishes the build. The builder cannot be used afterwards.
     *
     * @return the finished index
     */
    public TagIndex build() {
        ensureOpen();
        built = true;
        TagIndex index = new TagIndex(stores, recordsIndexed, recordsDuplicate, recordsSkipped);
        if (recordsSkipped > 0) {
            logger.info("Built tag index with {} tags, {} values indexed, {} records skipped", stores.size(), recordsIndexed, recordsSkipped);
        } else {
            logger.debug("Built tag index with {} tags, {} values indexed", stores.size(), recordsIndexed);
        }
        return index;
    }

    /**
     * @return number of distinct tag names added so far
     */
    public int tagCount() {
        return stores.size();
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("tag index already built");
        }
    }
}
