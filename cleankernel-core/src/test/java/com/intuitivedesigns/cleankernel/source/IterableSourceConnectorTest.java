/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.cleankernel.source;

import com.intuitivedesigns.cleankernel.core.PipelinePayload;
import com.intuitivedesigns.cleankernel.model.RawRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IterableSourceConnectorTest {

    @Test
    void testRowsNumberedInListOrder() {
        List<Map<String, String>> maps = new ArrayList<>();
        maps.add(Map.of("Name", "A"));
        maps.add(null);
        maps.add(Map.of("Name", "C"));
        IterableSourceConnector source = IterableSourceConnector.ofMaps(maps);

        source.connect();
        List<PipelinePayload<RawRow>> batch = source.fetchBatch(10);
        assertNull(source.fetch());
        source.disconnect();

        assertEquals(3, batch.size());
        assertEquals("row-1", batch.get(0).id());
        assertTrue(batch.get(1).data().isMalformed());
        assertEquals(3, batch.get(2).data().rowNumber());
    }

    @Test
    void testFetchBeforeConnect() {
        IterableSourceConnector source = new IterableSourceConnector(List.of());

        assertThrows(IllegalStateException.class, source::fetch);
    }

    @Test
    void testReconnectRestarts() {
        IterableSourceConnector source = IterableSourceConnector.ofMaps(List.of(Map.of("Name", "A")));

        source.connect();
        assertNotNull(source.fetch());
        source.connect();
        assertNotNull(source.fetch());
    }
}
