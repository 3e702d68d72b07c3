/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.presence;

/**
 * Compressed set of 32-bit keys grouped into containers by their high 16 bits.
 * <p>
 * Containers are ordered by their high bits and the keys of a container are ordered by their low bits, so
 * {@link #containsAndRank(int)} describes a key's position as (container ordinal, rank in container). This
 * two-level address is what {@link org.opensearch.indexdb.core.tag.TagStore} uses to find values without
 * storing keys a second time.
 */
public interface PresenceIndex extends KeySet {

    /**
     * Adds a key. Adding a key that is already present has no effect.
     */
    void add(int key);

    /**
     * Looks up a key and reports where it is, or where it would be once added.
     *
     * @param key the key
     * @return membership, container ordinal and 1-based rank of the key
     */
    ContainerRank containsAndRank(int key);

    /**
     * @return number of non-empty containers
     */
    int containerCount();

    /**
     * @return serialized size of the index in bytes
     */
    long sizeInBytes();

    /**
     * @return a view of this index without the mutating operations
     */
    KeySet asKeySet();
}
