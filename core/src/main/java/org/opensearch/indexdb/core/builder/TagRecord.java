/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.builder;

import org.roaringbitmap.RoaringBitmap;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * One tag value read while scanning a segment: the tag name, the value id and the posting list of the value in
 * RoaringBitmap portable format.
 *
 * @param tagName name of the tag (or field) the value belongs to
 * @param valueId unsigned 32-bit id of the value
 * @param postings serialized posting list; not copied, so callers must not reuse the array
 */
public record TagRecord(String tagName, int valueId, byte[] postings) {

    /**
     * Creates a record by serializing {@code postings}.
     */
    public static TagRecord of(String tagName, int valueId, RoaringBitmap postings) {
        ByteBuffer buffer = ByteBuffer.allocate(postings.serializedSizeInBytes());
        postings.serialize(buffer);
        return new TagRecord(tagName, valueId, buffer.array());
    }

    /**
     * Decodes the posting list.
     *
     * @return the posting list
     * @throws IOException if the bytes are not exactly one portable RoaringBitmap
     */
    public RoaringBitmap decodePostings() throws IOException {
        RoaringBitmap bitmap = new RoaringBitmap();
        try {
            bitmap.deserialize(ByteBuffer.wrap(postings));
        } catch (IOException | RuntimeException e) {
            // InvalidRoaringFormat, BufferUnderflowException and friends
            throw new IOException("corrupt posting list of " + postings.length + " bytes", e);
        }
        int expected = bitmap.serializedSizeInBytes();
        if (expected != postings.length) {
            throw new IOException("posting list has " + (postings.length - expected) + " trailing bytes");
        }
        return bitmap;
    }
}
