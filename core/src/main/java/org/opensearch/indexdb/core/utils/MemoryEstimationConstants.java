/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.utils;

/**
 * Memory overhead constants used to estimate the heap footprint of tag indexes while they are built.
 *
 * <h2>Memory Estimation Philosophy:</h2>
 * <ul>
 *   <li>Estimates are conservative (slightly over-estimate rather than under-estimate)</li>
 *   <li>Assumes compressed OOPs enabled (typical production JVM configuration)</li>
 * </ul>
 */
public final class MemoryEstimationConstants {

    private MemoryEstimationConstants() {
        // Utility class, no instantiation
    }

    /**
     * Size of an object reference with compressed OOPs enabled.
     */
    public static final long REFERENCE_SIZE = 4;

    /**
     * Estimated overhead per ArrayList in bytes.
     * Includes: object header (12) + elementData array ref (4) + size (4) + modCount (4) = 24 bytes
     */
    public static final long ARRAYLIST_OVERHEAD = 24;

    /**
     * Estimated overhead for an array header in bytes: object header (12) + length (4).
     */
    public static final long ARRAY_HEADER_OVERHEAD = 16;

    /**
     * Estimated shallow size of a TagStore: object header (12) + presence index ref (4) + value table ref (4),
     * plus the value table object itself: header (12) + containers ref (4) + size (4) + padding.
     */
    public static final long TAG_STORE_OVERHEAD = 48;

    /**
     * Estimated overhead per HashMap entry in bytes.
     * Includes: HashMap.Node object header (12) + hash (4) + key ref (4) + value ref (4) + next ref (4) + padding (4) = 32 bytes
     */
    public static final long HASHMAP_ENTRY_OVERHEAD = 32;

    /**
     * Estimated size of a list of {@code elementCount} references, including the backing array.
     */
    public static long estimateListBytes(int elementCount) {
        return ARRAYLIST_OVERHEAD + ARRAY_HEADER_OVERHEAD + elementCount * REFERENCE_SIZE;
    }
}
