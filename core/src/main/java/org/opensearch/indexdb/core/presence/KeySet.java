/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.presence;

import org.roaringbitmap.IntIterator;

/**
 * Read-only view of a set of 32-bit keys. Keys are unsigned: iteration and {@link #toArray()} order them
 * by {@link Integer#compareUnsigned(int, int)}.
 */
public interface KeySet {

    boolean contains(int key);

    /**
     * @return number of distinct keys
     */
    int cardinality();

    default boolean isEmpty() {
        return cardinality() == 0;
    }

    /**
     * @return iterator over the keys in ascending unsigned order
     */
    IntIterator iterator();

    /**
     * @return a copy of the keys in ascending unsigned order
     */
    int[] toArray();
}
