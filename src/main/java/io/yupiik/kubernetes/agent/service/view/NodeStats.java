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
import io.yupiik.kubernetes.agent.service.quantity.Quantities;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kubelet statistics helpers. The kubelet replies the last minutes of samples, only the latest one is kept.
 */
public final class NodeStats {
    public static final String TIMESTAMP = "timestamp";

    private NodeStats() {
        // no-op
    }

    /**
     * @param node     node name (for error messages).
     * @param rawStats the decoded stats payload ({@code {"stats": [...]}}).
     * @return the latest sample with its timestamp in epoch seconds.
     */
    public static Tree<Object> latest(final String node, final Object rawStats) {
        if (!(rawStats instanceof Map<?, ?> payload) || !(payload.get("stats") instanceof List<?> samples) || samples.isEmpty()) {
            throw new IllegalStateException("No statistics sample for node " + node);
        }
        if (!(samples.get(samples.size() - 1) instanceof Map<?, ?> sample)) {
            throw new IllegalStateException("Invalid statistics sample for node " + node + ": " + samples.get(samples.size() - 1));
        }

        final var latest = new LinkedHashMap<String, Object>();
        latest.put(TIMESTAMP, toEpochSeconds(node, sample.get(TIMESTAMP)));
        sample.forEach((k, v) -> latest.putIfAbsent(String.valueOf(k), v));
        return Tree.of(latest).map(NodeStats::normalize);
    }

    /**
     * Stats leaf combination: numbers are added, lists concatenated and any other value keeps the left side.
     * Strings are not concatenated, a cluster level interface name stays {@code eth0} and not {@code eth0eth0}.
     */
    public static Object add(final Object left, final Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Quantities.add(a, b);
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            final var out = new ArrayList<Object>(a.size() + b.size());
            out.addAll(a);
            out.addAll(b);
            return out;
        }
        return left;
    }

    /**
     * Replaces the summed timestamp of {@code count} snapshots by their average rounded to one decimal.
     */
    public static Tree<Object> averageTimestamp(final Tree<Object> summed, final int count) {
        final var children = new LinkedHashMap<>(summed.children());
        final var sum = summed.child(TIMESTAMP);
        if (sum != null && sum.value() instanceof Number total) {
            children.put(TIMESTAMP, Tree.leaf(Math.round(total.doubleValue() / count * 10) / 10.));
        }
        return Tree.branch(children);
    }

    private static Object normalize(final Object value) {
        return value instanceof Number n ? Quantities.normalize(n) : value;
    }

    private static Object toEpochSeconds(final String node, final Object timestamp) {
        if (timestamp instanceof Number number) {
            return number.doubleValue();
        }
        if (timestamp == null) {
            return null;
        }
        try {
            return (double) OffsetDateTime.parse(timestamp.toString()).toEpochSecond();
        } catch (final DateTimeParseException e) {
            throw new IllegalStateException("Invalid statistics timestamp for node " + node + ": " + timestamp, e);
        }
    }
}
