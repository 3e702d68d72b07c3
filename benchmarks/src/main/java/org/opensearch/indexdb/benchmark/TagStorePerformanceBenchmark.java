/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.benchmark;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import org.opensearch.indexdb.core.tag.TagStore;
import org.roaringbitmap.RoaringBitmap;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmark for building and querying a {@link TagStore}.
 *
 * <p>Building in ascending value id order only ever appends to the last container, while random order shifts
 * values inside containers and inserts containers in the middle of the table. Lookups are measured on a store
 * built once per trial.</p>
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class TagStorePerformanceBenchmark {

    @Param({ "1000", "10000", "100000" })
    private int valueCount;

    /** Average number of value ids per high-16-bit container. */
    @Param({ "64", "65536" })
    private int density;

    private int[] ascendingKeys;
    private int[] shuffledKeys;
    private RoaringBitmap[] postings;
    private TagStore store;
    private int[] probes;

    @Setup(Level.Trial)
    public void setup() {
        Random random = new Random(42);
        ascendingKeys = new int[valueCount];
        postings = new RoaringBitmap[valueCount];
        for (int i = 0; i < valueCount; i++) {
            int container = i / density;
            int offset = i % density;
            ascendingKeys[i] = (container << 16) | (offset * (65536 / density));
            postings[i] = RoaringBitmap.bitmapOf(i);
        }

        shuffledKeys = ascendingKeys.clone();
        for (int i = shuffledKeys.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = shuffledKeys[i];
            shuffledKeys[i] = shuffledKeys[j];
            shuffledKeys[j] = tmp;
        }

        store = new TagStore();
        for (int i = 0; i < valueCount; i++) {
            store.put(ascendingKeys[i], postings[i]);
        }

        probes = new int[1024];
        for (int i = 0; i < probes.length; i++) {
            // three quarters hits, one quarter misses
            probes[i] = i % 4 == 0 ? random.nextInt() : ascendingKeys[random.nextInt(valueCount)];
        }
    }

    @Benchmark
    public TagStore putAscending() {
        TagStore tagStore = new TagStore();
        for (int i = 0; i < ascendingKeys.length; i++) {
            tagStore.put(ascendingKeys[i], postings[i]);
        }
        return tagStore;
    }

    @Benchmark
    public TagStore putShuffled() {
        TagStore tagStore = new TagStore();
        for (int i = 0; i < shuffledKeys.length; i++) {
            tagStore.put(shuffledKeys[i], postings[i]);
        }
        return tagStore;
    }

    @Benchmark
    public void get(Blackhole bh) {
        for (int probe : probes) {
            bh.consume(store.get(probe));
        }
    }

    @Benchmark
    public void forEach(Blackhole bh) {
        store.forEach((valueId, value) -> bh.consume(value));
    }
}
