/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.builder;

import org.opensearch.indexdb.core.tag.TagStore;
import org.opensearch.indexdb.core.utils.MemoryEstimationConstants;
import org.roaringbitmap.RoaringBitmap;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finished inverted index of one segment: one {@link TagStore} per tag name.
 * <p>
 * Produced by {@link TagIndexBuilder#build()}. The stores are no longer written to, so the index can be shared
 * by concurrent readers without locking.
 */
public final class TagIndex {
    private final NavigableMap<String, TagStore> stores;
    private final long recordsIndexed;
    private final long recordsDuplicate;
    private final long recordsSkipped;

    TagIndex(Map<String, TagStore> stores, long recordsIndexed, long recordsDuplicate, long recordsSkipped) {
        this.stores = Collections.unmodifiableNavigableMap(new TreeMap<>(stores));
        this.recordsIndexed = recordsIndexed;
        this.recordsDuplicate = recordsDuplicate;
        this.recordsSkipped = recordsSkipped;
    }

    /**
     * @return the store of a tag, or {@code null} if no value of the tag was indexed
     */
    public TagStore tagStore(String tagName) {
        return stores.get(tagName);
    }

    /**
     * Looks up the posting list of a tag value.
     *
     * @return the posting list, or {@code null} if the tag or the value is unknown
     */
    public RoaringBitmap postings(String tagName, int valueId) {
        TagStore store = stores.get(tagName);
        return store == null ? null : store.get(valueId);
    }

    /**
     * @return tag names in natural order
     */
    public Set<String> tagNames() {
        return stores.keySet();
    }

    public int tagCount() {
        return stores.size();
    }

    public long recordsIndexed() {
        return recordsIndexed;
    }

    public long recordsDuplicate() {
        return recordsDuplicate;
    }

    public long recordsSkipped() {
        return recordsSkipped;
    }

    /**
     * @return estimated heap usage of all stores in bytes
     */
    public long estimateBytes() {
        long bytes = 0;
        for (Map.Entry<String, TagStore> entry : stores.entrySet()) {
            bytes += MemoryEstimationConstants.HASHMAP_ENTRY_OVERHEAD + entry.getValue().estimateBytes();
        }
        return bytes;
    }

    @Override
    public String toString() {
        return "TagIndex{tags=" + stores.size() + ", indexed=" + recordsIndexed + ", skipped=" + recordsSkipped + "}";
    }
}
