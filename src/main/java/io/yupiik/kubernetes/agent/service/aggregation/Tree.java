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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import static java.util.Collections.unmodifiableMap;

/**
 * Schema shaped container: either a leaf value or an ordered set of named subtrees.
 *
 * @param value    the leaf value, {@code null} for a branch (or a null leaf).
 * @param children the named subtrees, {@code null} for a leaf.
 * @param <V>      leaf type.
 */
public record Tree<V>(V value, Map<String, Tree<V>> children) {
    public Tree {
        if (children != null) {
            children = unmodifiableMap(new LinkedHashMap<>(children));
        }
    }

    public static <V> Tree<V> leaf(final V value) {
        return new Tree<>(value, null);
    }

    public static <V> Tree<V> branch(final Map<String, Tree<V>> children) {
        return new Tree<>(null, children);
    }

    public static <V> Tree<V> empty() {
        return new Tree<>(null, Map.of());
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    /**
     * Wraps a decoded JSON like structure, maps become branches, anything else is a leaf.
     */
    public static Tree<Object> of(final Object value) {
        if (value instanceof Map<?, ?> map) {
            final var builder = Tree.builder();
            map.forEach((k, v) -> builder.put(String.valueOf(k), of(v)));
            return builder.build();
        }
        return leaf(value);
    }

    public boolean isLeaf() {
        return children == null;
    }

    public Tree<V> child(final String name) {
        return children == null ? null : children.get(name);
    }

    /**
     * @param path keys to follow from this node.
     * @return the leaf value at this path.
     */
    public V get(final String... path) {
        var current = this;
        for (final var key : path) {
            current = current.child(key);
            if (current == null) {
                throw new IllegalArgumentException("No value at " + String.join("/", path));
            }
        }
        if (!current.isLeaf()) {
            throw new IllegalArgumentException("Not a leaf: " + String.join("/", path));
        }
        return current.value();
    }

    public <T> Tree<T> map(final Function<V, T> mapper) {
        if (isLeaf()) {
            return leaf(mapper.apply(value));
        }
        final var out = new LinkedHashMap<String, Tree<T>>();
        children.forEach((k, v) -> out.put(k, v.map(mapper)));
        return branch(out);
    }

    /**
     * @return the leaf value or an ordered (mutable) nested map mirroring this tree.
     */
    @JsonValue
    public Object toPlain() {
        return isLeaf() ? value : toMap();
    }

    public Map<String, Object> toMap() {
        if (isLeaf()) {
            throw new IllegalStateException("A leaf is not a mapping: " + value);
        }
        final var out = new LinkedHashMap<String, Object>();
        children.forEach((k, v) -> out.put(k, v.toPlain()));
        return out;
    }

    public static class Builder<V> {
        private final Map<String, Tree<V>> children = new LinkedHashMap<>();

        public Builder<V> put(final String key, final V leaf) {
            children.put(key, Tree.leaf(leaf));
            return this;
        }

        public Builder<V> put(final String key, final Tree<V> subtree) {
            children.put(key, subtree);
            return this;
        }

        public Tree<V> build() {
            return Tree.branch(children);
        }
    }
}
