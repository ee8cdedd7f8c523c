/*
 * Copyright (c) 2024 - present - Yupiik SAS - https://www.yupiik.com
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.yupiik.kubernetes.agent.service.view;

import io.yupiik.kubernetes.agent.service.aggregation.Tree;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NodeStatsTest {
    @Test
    void keepsLatestSample() {
        final var stats = NodeStats.latest("node1", Map.of("stats", List.of(
                Map.of("timestamp", "2019-10-10T10:00:00Z", "cpu", Map.of("usage", new BigDecimal("1"))),
                Map.of("timestamp", "2019-10-10T10:00:10.5Z", "cpu", Map.of("usage", new BigDecimal("2")),
                        "memory", Map.of("pressure", new BigDecimal("0.5"))))));
        assertEquals(3, stats.children().size());
        assertEquals("timestamp", stats.children().keySet().iterator().next());
        assertEquals(1570701610., stats.get("timestamp"));
        assertEquals(2L, stats.get("cpu", "usage"));
        assertEquals(.5, stats.get("memory", "pressure"));
    }

    @Test
    void noSample() {
        assertThrows(IllegalStateException.class, () -> NodeStats.latest("node1", Map.of("stats", List.of())));
        assertThrows(IllegalStateException.class, () -> NodeStats.latest("node1", Map.of()));
        assertThrows(IllegalStateException.class, () -> NodeStats.latest("node1",
                Map.of("stats", List.of(Map.of("timestamp", "yesterday")))));
    }

    @Test
    void add() {
        assertEquals(3L, NodeStats.add(1L, 2L));
        assertEquals(1.5, NodeStats.add(1L, .5));
        assertEquals(List.of("a", "b"), NodeStats.add(List.of("a"), List.of("b")));
        assertEquals("eth0", NodeStats.add("eth0", "eth0"));
        assertEquals("left", NodeStats.add("left", "right"));
    }

    @Test
    void averageTimestamp() {
        final var summed = Tree.<Object>builder()
                .put("timestamp", 3141403221.)
                .put("cpu", 2L)
                .build();
        final var averaged = NodeStats.averageTimestamp(summed, 2);
        assertEquals(1570701610.5, averaged.get("timestamp"));
        assertEquals(2L, averaged.get("cpu"));
    }

    @Test
    void averageTimestampRounding() {
        final var summed = Tree.<Object>builder().put("timestamp", 4711140830.).build();
        assertEquals(1570380276.7, NodeStats.averageTimestamp(summed, 3).get("timestamp"));
    }
}
