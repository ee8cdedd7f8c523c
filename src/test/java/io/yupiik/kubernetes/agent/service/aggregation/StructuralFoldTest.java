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
package io.yupiik.kubernetes.agent.service.aggregation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StructuralFoldTest {
    @Test
    void mergeWithItselfDoubles() {
        final var tree = sample(1, 2, 3);
        assertEquals(sample(2, 4, 6), StructuralFold.merge(tree, tree, Integer::sum));
    }

    @Test
    void mergeWithEmptyIsIdentity() {
        final var tree = sample(1, 2, 3);
        assertEquals(tree, StructuralFold.merge(tree, Tree.empty(), (a, b) -> {
            throw new IllegalStateException("should not be called");
        }));
    }

    @Test
    void incomingOnlyKeysAreIgnored() {
        final var incoming = Tree.<Integer>builder()
                .put("a", Tree.<Integer>builder().put("x", 10).put("unknown", 100).build())
                .put("other", 5)
                .build();
        final var merged = StructuralFold.merge(sample(1, 2, 3), incoming, Integer::sum);
        assertEquals(sample(11, 2, 3), merged);
        assertEquals(List.of("a", "b"), List.copyOf(merged.children().keySet()));
    }

    @Test
    void leftBiased() {
        final var merged = StructuralFold.merge(sample(1, 2, 3), sample(10, 20, 30), (a, b) -> a);
        assertEquals(sample(1, 2, 3), merged);
    }

    @Test
    void shapeMismatch() {
        final var incoming = Tree.<Integer>builder()
                .put("a", Tree.<Integer>builder().put("x", Tree.<Integer>builder().put("deep", 1).build()).build())
                .build();
        assertThrows(IllegalArgumentException.class, () -> StructuralFold.merge(sample(1, 2, 3), incoming, Integer::sum));
        assertThrows(IllegalArgumentException.class, () -> StructuralFold.merge(Tree.leaf(1), Tree.leaf(2), Integer::sum));
    }

    @Test
    void foldCommutativeOperation() {
        final var r1 = sample(1, 2, 3);
        final var r2 = sample(10, 20, 30);
        final var r3 = sample(100, 200, 300);
        assertEquals(sample(111, 222, 333), StructuralFold.fold(List.of(r1, r2, r3), Integer::sum));
        assertEquals(StructuralFold.fold(List.of(r1, r2, r3), Integer::sum), StructuralFold.fold(List.of(r2, r1, r3), Integer::sum));
    }

    @Test
    void foldNonCommutativeOperation() {
        final var r1 = sample(1, 2, 3);
        final var r2 = sample(10, 20, 30);
        final var r3 = sample(100, 200, 300);
        assertNotEquals(
                StructuralFold.fold(List.of(r1, r2, r3), (a, b) -> a - b),
                StructuralFold.fold(List.of(r2, r1, r3), (a, b) -> a - b));
    }

    @Test
    void emptyFoldFails() {
        assertThrows(EmptyAggregationException.class, () -> StructuralFold.fold(List.<Tree<Integer>>of(), Integer::sum));
    }

    @Test
    void emptyFoldWithSeed() {
        assertEquals(sample(0, 0, 0), StructuralFold.fold(sample(0, 0, 0), List.of(), Integer::sum));
        assertEquals(sample(1, 2, 3), StructuralFold.fold(sample(0, 0, 0), List.of(sample(1, 2, 3)), Integer::sum));
    }

    @Test
    void plainConversion() {
        assertEquals(Map.of("a", Map.of("x", 1, "y", 2), "b", Map.of("z", 3)), sample(1, 2, 3).toPlain());
        assertEquals(sample(1, 2, 3).map(Object.class::cast), Tree.of(sample(1, 2, 3).toPlain()));
        assertEquals(2, sample(1, 2, 3).get("a", "y"));
    }

    private Tree<Integer> sample(final int x, final int y, final int z) {
        return Tree.<Integer>builder()
                .put("a", Tree.<Integer>builder().put("x", x).put("y", y).build())
                .put("b", Tree.<Integer>builder().put("z", z).build())
                .build();
    }
}
