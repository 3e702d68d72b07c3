/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.tag;

import org.roaringbitmap.RoaringBitmap;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Guards a {@link TagStore} with one exclusive-writer / shared-reader lock, for shards that keep adding values
 * while serving lookups. Critical sections only touch the in-memory store.
 */
public final class ReadWriteLockedTagStore {
    private final TagStore store;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    public ReadWriteLockedTagStore() {
        this(new TagStore());
    }

    public ReadWriteLockedTagStore(TagStore store) {
        this.store = store;
    }

    /**
     * @see TagStore#put(int, RoaringBitmap)
     */
    public boolean put(int key, RoaringBitmap value) {
        writeLock.lock();
        try {
            return store.put(key, value);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @see TagStore#get(int)
     */
    public RoaringBitmap get(int key) {
        readLock.lock();
        try {
            return store.get(key);
        } finally {
            readLock.unlock();
        }
    }

    public int size() {
        readLock.lock();
        try {
            return store.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Runs {@code reader} against the store while holding the read lock, e.g. to export keys and values together.
     * The reader must not retain the store or perform I/O.
     */
    public <T> T read(Function<TagStore, T> reader) {
        readLock.lock();
        try {
            return reader.apply(store);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Visits every entry in ascending key order under the read lock.
     */
    public void forEach(TagValueConsumer consumer) {
        readLock.lock();
        try {
            store.forEach(consumer);
        } finally {
            readLock.unlock();
        }
    }
}
