/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.builder;

import org.opensearch.core.rest.RestStatus;
import org.opensearch.indexdb.core.tag.TagStore;
import org.opensearch.indexdb.metrics.TagIndexMetrics;
import org.opensearch.telemetry.metrics.Counter;
import org.opensearch.test.OpenSearchTestCase;
import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class TagIndexBuilderTests extends OpenSearchTestCase {

    public void testBuildsOneStorePerTag() {
        TagIndexBuilder builder = new TagIndexBuilder(TagIndexConfig.defaultConfig());
        RoaringBitmap hostA = RoaringBitmap.bitmapOf(1, 2);
        RoaringBitmap hostB = RoaringBitmap.bitmapOf(3);
        RoaringBitmap regionEast = RoaringBitmap.bitmapOf(1, 2, 3);

        assertTrue(builder.add("host", 2, hostB));
        assertTrue(builder.add("host", 1, hostA));
        assertTrue(builder.add("region", 0x00010000, regionEast));
        assertEquals(2, builder.tagCount());

        TagIndex index = builder.build();

        assertEquals(List.of("host", "region"), List.copyOf(index.tagNames()));
        assertEquals(2, index.tagCount());
        assertSame(hostA, index.postings("host", 1));
        assertSame(hostB, index.postings("host", 2));
        assertSame(regionEast, index.postings("region", 0x00010000));
        assertNull(index.postings("host", 3));
        assertNull(index.postings("missing", 1));
        assertNull(index.tagStore("missing"));

        TagStore hosts = index.tagStore("host");
        assertArrayEquals(new int[] { 1, 2 }, hosts.keys().toArray());
        assertEquals(3, index.recordsIndexed());
        assertEquals(0, index.recordsDuplicate());
        assertEquals(0, index.recordsSkipped());
        assertTrue(index.estimateBytes() > 0);
    }

    public void testDuplicateValueKeepsFirstPostings() {
        TagIndexBuilder builder = new TagIndexBuilder(TagIndexConfig.defaultConfig());
        RoaringBitmap first = RoaringBitmap.bitmapOf(1);

        assertTrue(builder.add(TagRecord.of("host", 7, first)));
        assertFalse(builder.add(TagRecord.of("host", 7, RoaringBitmap.bitmapOf(2))));

        TagIndex index = builder.build();
        assertEquals(first, index.postings("host", 7));
        assertEquals(1, index.recordsIndexed());
        assertEquals(1, index.recordsDuplicate());
    }

    public void testSerializedRecordRoundTrip() throws IOException {
        RoaringBitmap postings = RoaringBitmap.bitmapOf(1, 5, 100000, 1 << 20);
        postings.add(200L, 5000L);
        postings.runOptimize();

        TagRecord record = TagRecord.of("service", 42, postings);

        assertEquals(postings, record.decodePostings());
    }

    public void testMalformedRecordsAreSkipped() {
        TagIndexMetrics metrics = new TagIndexMetrics();
        metrics.recordsIndexed = mock(Counter.class);
        metrics.recordsDuplicate = mock(Counter.class);
        metrics.recordsSkipped = mock(Counter.class);
        TagIndexBuilder builder = new TagIndexBuilder(TagIndexConfig.defaultConfig(), metrics);

        assertTrue(builder.add(TagRecord.of("host", 1, RoaringBitmap.bitmapOf(1))));
        assertFalse(builder.add(new TagRecord("host", 2, new byte[] { 1, 2, 3 })));
        assertFalse(builder.add(new TagRecord("host", 3, new byte[0])));
        assertFalse(builder.add(new TagRecord("host", 4, new byte[8])));
        assertFalse(builder.add(new TagRecord("host", 5, null)));
        assertFalse(builder.add(new TagRecord(null, 6, new byte[0])));
        assertFalse(builder.add("", 7, RoaringBitmap.bitmapOf(1)));
        assertFalse(builder.add("host", 8, null));
        assertTrue(builder.add(TagRecord.of("host", 9, RoaringBitmap.bitmapOf(9))));

        TagIndex index = builder.build();
        assertEquals(2, index.recordsIndexed());
        assertEquals(7, index.recordsSkipped());
        assertArrayEquals(new int[] { 1, 9 }, index.tagStore("host").keys().toArray());
        assertEquals(1, index.tagCount());

        verify(metrics.recordsIndexed, times(2)).add(1.0);
        verify(metrics.recordsSkipped, times(7)).add(1.0);
        verifyNoInteractions(metrics.recordsDuplicate);
    }

    public void testTrailingBytesAreMalformed() {
        TagRecord valid = TagRecord.of("host", 1, RoaringBitmap.bitmapOf(1, 2, 3));
        byte[] padded = Arrays.copyOf(valid.postings(), valid.postings().length + 1);
        TagRecord record = new TagRecord("host", 1, padded);

        IOException e = expectThrows(IOException.class, record::decodePostings);
        assertEquals("posting list has 1 trailing bytes", e.getMessage());

        TagIndexBuilder builder = new TagIndexBuilder(TagIndexConfig.defaultConfig());
        assertFalse(builder.add(record));
        assertEquals(1, builder.build().recordsSkipped());
    }

    public void testStrictModeRejectsMalformedRecord() {
        TagIndexBuilder builder = new TagIndexBuilder(TagIndexConfig.strict());
        assertTrue(builder.add(TagRecord.of("host", 1, RoaringBitmap.bitmapOf(1))));

        TagIndexException e = expectThrows(TagIndexException.class, () -> builder.add(new TagRecord("host", -1, new byte[] { 9 })));

        assertEquals("failed to index value [4294967295] of tag [host]: corrupt posting list of 1 bytes", e.getMessage());
        assertTrue(e.getCause() instanceof IOException);
        assertEquals(RestStatus.BAD_REQUEST, e.status());

        // records added before the failure are kept
        TagIndex index = builder.build();
        assertNotNull(index.postings("host", 1));
        assertEquals(0, index.recordsSkipped());
    }

    public void testTagLimit() {
        TagIndexBuilder builder = new TagIndexBuilder(new TagIndexConfig(true, 2));

        assertTrue(builder.add("a", 1, RoaringBitmap.bitmapOf(1)));
        assertTrue(builder.add("b", 1, RoaringBitmap.bitmapOf(1)));
        assertFalse(builder.add("c", 1, RoaringBitmap.bitmapOf(1)));
        // existing tags still accept values
        assertTrue(builder.add("a", 2, RoaringBitmap.bitmapOf(2)));

        TagIndex index = builder.build();
        assertEquals(2, index.tagCount());
        assertNull(index.tagStore("c"));
        assertEquals(1, index.recordsSkipped());

        TagIndexBuilder strict = new TagIndexBuilder(new TagIndexConfig(false, 1));
        strict.add("a", 1, RoaringBitmap.bitmapOf(1));
        TagIndexException e = expectThrows(TagIndexException.class, () -> strict.add("b", 1, RoaringBitmap.bitmapOf(1)));
        assertEquals("failed to index value [1] of tag [b]: tag limit [1] reached", e.getMessage());
    }

    public void testBuilderCannotBeReused() {
        TagIndexBuilder builder = new TagIndexBuilder(TagIndexConfig.defaultConfig());
        builder.add("host", 1, RoaringBitmap.bitmapOf(1));
        builder.build();

        expectThrows(IllegalStateException.class, () -> builder.add("host", 2, RoaringBitmap.bitmapOf(2)));
        expectThrows(IllegalStateException.class, () -> builder.add(TagRecord.of("host", 2, RoaringBitmap.bitmapOf(2))));
        expectThrows(IllegalStateException.class, builder::build);
    }

    public void testUninitializedMetricsAreNoop() {
        TagIndexMetrics metrics = new TagIndexMetrics();
        TagIndexBuilder builder = new TagIndexBuilder(TagIndexConfig.defaultConfig(), metrics);

        assertTrue(builder.add("host", 1, RoaringBitmap.bitmapOf(1)));
        assertFalse(builder.add("host", 1, RoaringBitmap.bitmapOf(1)));
        assertFalse(builder.add(new TagRecord("host", 2, new byte[] { 0 })));

        TagIndex index = builder.build();
        assertEquals(1, index.recordsIndexed());
        assertEquals(1, index.recordsDuplicate());
        assertEquals(1, index.recordsSkipped());
    }

    public void testEmptyBuild() {
        TagIndex index = new TagIndexBuilder(TagIndexConfig.defaultConfig()).build();

        assertEquals(0, index.tagCount());
        assertTrue(index.tagNames().isEmpty());
        assertEquals(0, index.estimateBytes());
        expectThrows(UnsupportedOperationException.class, () -> index.tagNames().remove("host"));
    }
}
