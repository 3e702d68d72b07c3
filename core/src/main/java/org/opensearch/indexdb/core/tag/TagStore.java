/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.tag;

import org.opensearch.indexdb.core.presence.ContainerRank;
import org.opensearch.indexdb.core.presence.KeySet;
import org.opensearch.indexdb.core.presence.PresenceIndex;
import org.opensearch.indexdb.core.presence.RoaringPresenceIndex;
import org.opensearch.indexdb.core.utils.MemoryEstimationConstants;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.Objects;

/**
 * Ordered map from a 32-bit tag value id to the posting list (bitmap of series ids) of that value.
 *
 * <h2>Layout</h2>
 * Keys live only in a {@link PresenceIndex}. Values live in a {@link ValueTable} whose containers and slots
 * mirror the index: the value of key {@code k} sits at {@code values[containerIndex(k)][rank(k) - 1]}, where
 * both coordinates come from {@link PresenceIndex#containsAndRank(int)}. Every {@link #put} keeps the two in
 * lockstep for any insertion order, including keys that open a container below existing ones.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Insert only: there is no removal, and re-inserting a key keeps the value from the first insertion.</li>
 *   <li>Keys are unsigned 32-bit integers and are enumerated in ascending unsigned order.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * No internal synchronization. A single writer builds the store, after which it may be published and read by
 * any number of threads. Callers that must interleave writes and reads guard the store with a read/write lock,
 * see {@link ReadWriteLockedTagStore}.
 */
public final class TagStore {
    private final PresenceIndex keys;
    private final ValueTable<RoaringBitmap> values;

    public TagStore() {
        this(new RoaringPresenceIndex());
    }

    /**
     * @param keys an empty presence index
     */
    TagStore(PresenceIndex keys) {
        if (!keys.isEmpty()) {
            throw new IllegalArgumentException("presence index must be empty, found " + keys.cardinality() + " keys");
        }
        this.keys = keys;
        this.values = new ValueTable<>();
    }

    /**
     * Returns the posting list of a value id.
     *
     * @param key the value id
     * @return the posting list, or {@code null} if the key was never inserted
     */
    public RoaringBitmap get(int key) {
        if (values.isEmpty()) {
            return null;
        }
        ContainerRank position = keys.containsAndRank(key);
        if (!position.found()) {
            return null;
        }
        return values.get(position.containerIndex(), position.slot());
    }

    public boolean containsKey(int key) {
        return !values.isEmpty() && keys.contains(key);
    }

    /**
     * Associates a posting list with a value id unless the id is already present.
     *
     * @param key the value id
     * @param value the posting list, retained by reference
     * @return {@code true} if the key was added, {@code false} if it was present and {@code value} was discarded
     */
    public boolean put(int key, RoaringBitmap value) {
        Objects.requireNonNull(value, "posting list must not be null");
        if (values.isEmpty()) {
            keys.add(key);
            values.insertContainer(0, value);
            return true;
        }

        ContainerRank position = keys.containsAndRank(key);
        if (position.found()) {
            return false;
        }
        keys.add(key);
        if (position.hasContainer()) {
            values.insert(position.containerIndex(), position.slot(), value);
        } else {
            values.insertContainer(position.insertionPoint(), value);
        }
        return true;
    }

    /**
     * @return read-only view of the keys, ascending
     */
    public KeySet keys() {
        return keys.asKeySet();
    }

    /**
     * Returns the value table for bulk export, aligned with {@link #keys()}: container {@code i} holds the values
     * of the keys in the {@code i}-th high-16-bit group, in ascending key order.
     */
    public List<List<RoaringBitmap>> values() {
        return values.view();
    }

    /**
     * @return number of distinct keys
     */
    public int size() {
        return keys.cardinality();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Visits every entry in ascending key order.
     */
    public void forEach(TagValueConsumer consumer) {
        IntIterator it = keys.iterator();
        int containerCount = values.containerCount();
        for (int c = 0; c < containerCount; c++) {
            int containerSize = values.containerSize(c);
            for (int slot = 0; slot < containerSize; slot++) {
                consumer.accept(it.next(), values.get(c, slot));
            }
        }
    }

    /**
     * Estimates the heap used by this store, posting lists included.
     *
     * @return estimated memory usage in bytes
     */
    public long estimateBytes() {
        long bytes = MemoryEstimationConstants.TAG_STORE_OVERHEAD + keys.sizeInBytes();
        int containerCount = values.containerCount();
        bytes += MemoryEstimationConstants.estimateListBytes(containerCount);
        for (int c = 0; c < containerCount; c++) {
            int containerSize = values.containerSize(c);
            bytes += MemoryEstimationConstants.estimateListBytes(containerSize);
            for (int slot = 0; slot < containerSize; slot++) {
                bytes += values.get(c, slot).getLongSizeInBytes();
            }
        }
        return bytes;
    }

    @Override
    public String toString() {
        return "TagStore{size=" + size() + ", containers=" + values.containerCount() + "}";
    }
}
