/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.presence;

import org.roaringbitmap.Container;
import org.roaringbitmap.ContainerPointer;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

/**
 * {@link PresenceIndex} backed by a {@link RoaringBitmap}.
 *
 * <p>The containers are RoaringBitmap's own high-16-bit containers, enumerated through its public
 * {@link ContainerPointer}. Resolving a container ordinal walks the containers in order, so
 * {@link #containsAndRank(int)} costs O(number of containers) plus the rank inside a single container.
 * Tag value ids are allocated densely, which keeps the container count small in practice.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class RoaringPresenceIndex implements PresenceIndex {
    private static final int LOW_BITS = 16;

    private final RoaringBitmap bitmap;
    private final KeySet readOnlyView = new ReadOnlyKeySet();

    public RoaringPresenceIndex() {
        this.bitmap = new RoaringBitmap();
    }

    @Override
    public void add(int key) {
        bitmap.add(key);
    }

    @Override
    public boolean contains(int key) {
        return bitmap.contains(key);
    }

    @Override
    public ContainerRank containsAndRank(int key) {
        final int high = key >>> LOW_BITS;
        final char low = (char) key;

        ContainerPointer pointer = bitmap.getContainerPointer();
        int index = 0;
        Container container;
        while ((container = pointer.getContainer()) != null) {
            int containerKey = pointer.key();
            if (containerKey == high) {
                // Container#rank counts the values <= low
                if (container.contains(low)) {
                    return new ContainerRank(true, index, container.rank(low));
                }
                return new ContainerRank(false, index, container.rank(low) + 1);
            }
            if (containerKey > high) {
                break;
            }
            pointer.advance();
            index++;
        }
        return new ContainerRank(false, -index - 1, 1);
    }

    @Override
    public int containerCount() {
        ContainerPointer pointer = bitmap.getContainerPointer();
        int count = 0;
        while (pointer.getContainer() != null) {
            pointer.advance();
            count++;
        }
        return count;
    }

    @Override
    public int cardinality() {
        return bitmap.getCardinality();
    }

    @Override
    public IntIterator iterator() {
        return bitmap.getIntIterator();
    }

    @Override
    public int[] toArray() {
        return bitmap.toArray();
    }

    @Override
    public long sizeInBytes() {
        return bitmap.getLongSizeInBytes();
    }

    @Override
    public KeySet asKeySet() {
        return readOnlyView;
    }

    @Override
    public String toString() {
        return bitmap.toString();
    }

    private final class ReadOnlyKeySet implements KeySet {

        @Override
        public boolean contains(int key) {
            return bitmap.contains(key);
        }

        @Override
        public int cardinality() {
            return bitmap.getCardinality();
        }

        @Override
        public IntIterator iterator() {
            return bitmap.getIntIterator();
        }

        @Override
        public int[] toArray() {
            return bitmap.toArray();
        }

        @Override
        public String toString() {
            return bitmap.toString();
        }
    }
}
