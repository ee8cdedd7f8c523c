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

import io.yupiik.kubernetes.agent.client.model.k8s.Condition;
import io.yupiik.kubernetes.agent.client.model.k8s.Metadata;
import io.yupiik.kubernetes.agent.client.model.k8s.Node;
import io.yupiik.kubernetes.agent.service.aggregation.Tree;

import java.util.LinkedHashMap;
import java.util.Map;

import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseCount;
import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseFraction;
import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseMemory;
import static java.util.Optional.ofNullable;

/**
 * A node and its latest statistics sample.
 *
 * @param node  the node descriptor.
 * @param stats the node statistics snapshot, see {@link NodeStats#latest(String, Object)}.
 */
public record NodeView(Node node, Tree<Object> stats) {
    public String name() {
        return ofNullable(node.metadata()).map(Metadata::name).orElse(null);
    }

    /**
     * @return condition type to status or {@code null} if the node does not report any condition.
     */
    public Map<String, String> conditions() {
        if (node.status() == null || node.status().conditions() == null || node.status().conditions().isEmpty()) {
            return null;
        }
        final var conditions = new LinkedHashMap<String, String>();
        for (final Condition condition : node.status().conditions()) {
            conditions.put(condition.type(), condition.status());
        }
        return conditions;
    }

    public Tree<Number> resources() {
        final var status = node.status();
        if (status == null) {
            return zeroResources();
        }
        return Tree.<Number>builder()
                .put("capacity", bounds(status.capacity()))
                .put("allocatable", bounds(status.allocatable()))
                .build();
    }

    public static Tree<Number> zeroResources() {
        return Tree.<Number>builder()
                .put("capacity", zeroBounds())
                .put("allocatable", zeroBounds())
                .build();
    }

    private static Tree<Number> bounds(final Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return zeroBounds();
        }
        return Tree.<Number>builder()
                .put("cpu", parseFraction(values.getOrDefault("cpu", "0.0")))
                .put("memory", parseMemory(values.getOrDefault("memory", "0.0")))
                .put("pods", parseCount(values.getOrDefault("pods", "0")))
                .build();
    }

    private static Tree<Number> zeroBounds() {
        return Tree.<Number>builder()
                .put("cpu", 0.)
                .put("memory", 0.)
                .put("pods", 0L)
                .build();
    }
}
