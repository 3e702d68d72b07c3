/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.presence;

/**
 * Result of a combined membership and rank query against a {@link PresenceIndex}.
 *
 * @param found whether the key is present
 * @param containerIndex ordinal of the container holding (or that would hold) the key among the existing
 *                       containers; when that container does not exist yet this is
 *                       {@code -(insertionPoint) - 1}, following {@link java.util.Arrays#binarySearch(int[], int)}
 * @param rank 1-based ascending position of the key within its container. For an absent key this is the
 *             position the key takes once inserted.
 */
public record ContainerRank(boolean found, int containerIndex, int rank) {

    /**
     * @return whether the container for the key already exists
     */
    public boolean hasContainer() {
        return containerIndex >= 0;
    }

    /**
     * @return the 0-based slot of the key inside its container
     */
    public int slot() {
        return rank - 1;
    }

    /**
     * Ordinal at which a new container has to be created for the key.
     * Only meaningful when {@link #hasContainer()} is false.
     */
    public int insertionPoint() {
        return -containerIndex - 1;
    }
}
