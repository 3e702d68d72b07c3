/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.indexdb.core.tag;

import org.opensearch.test.OpenSearchTestCase;

import java.util.List;

public class ValueTableTests extends OpenSearchTestCase {

    public void testEmptyTable() {
        ValueTable<String> table = new ValueTable<>();

        assertTrue(table.isEmpty());
        assertEquals(0, table.size());
        assertEquals(0, table.containerCount());
        assertTrue(table.view().isEmpty());
    }

    public void testInsertShiftsLaterValues() {
        ValueTable<String> table = new ValueTable<>();
        table.insertContainer(0, "c");
        table.insert(0, 0, "a");
        table.insert(0, 1, "b");
        table.insert(0, 3, "d");

        assertEquals(List.of(List.of("a", "b", "c", "d")), table.view());
        assertEquals(4, table.size());
        assertEquals(4, table.containerSize(0));
        assertEquals("b", table.get(0, 1));
    }

    public void testInsertContainerShiftsLaterContainers() {
        ValueTable<String> table = new ValueTable<>();
        table.insertContainer(0, "third");
        table.insertContainer(0, "first");
        table.insertContainer(1, "second");
        table.insert(2, 1, "third-b");

        assertEquals(List.of(List.of("first"), List.of("second"), List.of("third", "third-b")), table.view());
        assertEquals(3, table.containerCount());
        assertEquals(4, table.size());
    }

    public void testOutOfRangeAccessFails() {
        ValueTable<String> table = new ValueTable<>();
        table.insertContainer(0, "a");

        expectThrows(IndexOutOfBoundsException.class, () -> table.get(0, 1));
        expectThrows(IndexOutOfBoundsException.class, () -> table.get(1, 0));
        expectThrows(IndexOutOfBoundsException.class, () -> table.insert(1, 0, "b"));
    }

    public void testViewIsUnmodifiable() {
        ValueTable<String> table = new ValueTable<>();
        table.insertContainer(0, "a");
        List<List<String>> view = table.view();

        expectThrows(UnsupportedOperationException.class, () -> view.add(List.of("b")));
        expectThrows(UnsupportedOperationException.class, () -> view.get(0).add("b"));
        expectThrows(UnsupportedOperationException.class, () -> view.get(0).set(0, "b"));
        assertEquals(1, table.size());
    }
}
