/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Two-level positional table: an ordered list of containers, each an ordered list of values.
 * <p>
 * The table holds no keys. Its shape is expected to mirror a {@link org.opensearch.indexdb.core.presence.PresenceIndex},
 * container for container and rank for rank, and it is the owner's job to keep it that way.
 *
 * @param <V> value type
 */
public final class ValueTable<V> {
    private final List<List<V>> containers = new ArrayList<>();
    private int size;

    /**
     * @param containerIndex container ordinal
     * @param slot 0-based position inside the container
     * @return the value at that position
     * @throws IndexOutOfBoundsException if the position does not exist
     */
    public V get(int containerIndex, int slot) {
        return containers.get(containerIndex).get(slot);
    }

    /**
     * Inserts a value into an existing container, shifting the values at and after {@code slot} one position right.
     */
    public void insert(int containerIndex, int slot, V value) {
        containers.get(containerIndex).add(slot, value);
        size++;
    }

    /**
     * Creates a container holding exactly {@code value} at ordinal {@code containerIndex}, shifting later
     * containers one position right.
     */
    public void insertContainer(int containerIndex, V value) {
        List<V> container = new ArrayList<>(1);
        container.add(value);
        containers.add(containerIndex, container);
        size++;
    }

    public int containerCount() {
        return containers.size();
    }

    public int containerSize(int containerIndex) {
        return containers.get(containerIndex).size();
    }

    /**
     * @return total number of values across all containers
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Unmodifiable view of the containers. Containers created after this call are not part of the view,
     * so take it once building is done.
     */
    public List<List<V>> view() {
        List<List<V>> view = new ArrayList<>(containers.size());
        for (List<V> container : containers) {
            view.add(Collections.unmodifiableList(container));
        }
        return Collections.unmodifiableList(view);
    }
}
