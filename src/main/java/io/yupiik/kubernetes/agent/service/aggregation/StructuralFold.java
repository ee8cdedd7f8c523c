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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.function.BinaryOperator;

/**
 * Left biased recursive zip of two trees sharing the same schema.
 * The result always has the shape of the initial tree, keys only known by the incoming one are ignored.
 */
public final class StructuralFold {
    private StructuralFold() {
        // no-op
    }

    public static <V> Tree<V> merge(final Tree<V> initial, final Tree<V> incoming, final BinaryOperator<V> operation) {
        if (initial.isLeaf()) {
            throw new IllegalArgumentException("Can only merge mappings, got leaf " + initial.value());
        }
        if (incoming.isLeaf()) {
            throw new IllegalArgumentException("Can't merge leaf " + incoming.value() + " into a mapping");
        }

        final var result = new LinkedHashMap<String, Tree<V>>();
        for (final var entry : initial.children().entrySet()) {
            final var key = entry.getKey();
            final var value = entry.getValue();
            final var other = incoming.child(key);
            if (!value.isLeaf()) {
                result.put(key, merge(value, other == null ? Tree.empty() : other, operation));
            } else if (other != null) {
                if (!other.isLeaf()) {
                    throw new IllegalArgumentException("Shape mismatch for key '" + key + "', can't combine a leaf with a mapping");
                }
                result.put(key, Tree.leaf(operation.apply(value.value(), other.value())));
            } else {
                result.put(key, value);
            }
        }
        return Tree.branch(result);
    }

    /**
     * Folds left to right using the first tree as seed.
     *
     * @throws EmptyAggregationException if there is no tree to fold.
     */
    public static <V> Tree<V> fold(final Collection<Tree<V>> trees, final BinaryOperator<V> operation) {
        final var iterator = trees.iterator();
        if (!iterator.hasNext()) {
            throw new EmptyAggregationException();
        }
        var result = iterator.next();
        while (iterator.hasNext()) {
            result = merge(result, iterator.next(), operation);
        }
        return result;
    }

    /**
     * Folds left to right starting from an explicit (zero) seed, an empty collection returns the seed.
     */
    public static <V> Tree<V> fold(final Tree<V> seed, final Collection<Tree<V>> trees, final BinaryOperator<V> operation) {
        var result = seed;
        for (final var tree : trees) {
            result = merge(result, tree, operation);
        }
        return result;
    }
}
