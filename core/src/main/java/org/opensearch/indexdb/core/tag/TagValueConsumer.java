/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.tag;

import org.roaringbitmap.RoaringBitmap;

/**
 * Receives the (value id, posting list) entries of a {@link TagStore}.
 */
@FunctionalInterface
public interface TagValueConsumer {
    void accept(int valueId, RoaringBitmap postings);
}
