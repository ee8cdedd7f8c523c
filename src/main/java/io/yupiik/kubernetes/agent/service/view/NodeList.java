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

import io.yupiik.kubernetes.agent.service.aggregation.StructuralFold;
import io.yupiik.kubernetes.agent.service.aggregation.Tree;
import io.yupiik.kubernetes.agent.service.quantity.Quantities;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.util.stream.Collectors.toList;

public class NodeList {
    private final List<NodeView> nodes;

    public NodeList(final List<NodeView> nodes) {
        this.nodes = nodes;
    }

    public Map<String, Object> listNodes() {
        return Map.of("nodes", nodes.stream()
                .map(NodeView::name)
                .filter(Objects::nonNull)
                .collect(toList()));
    }

    public Map<String, Map<String, String>> conditions() {
        final var out = new LinkedHashMap<String, Map<String, String>>();
        for (final var node : nodes) {
            final var conditions = node.conditions();
            if (node.name() != null && conditions != null) {
                out.put(node.name(), conditions);
            }
        }
        return out;
    }

    public Map<String, Tree<Number>> resources() {
        final var out = new LinkedHashMap<String, Tree<Number>>();
        for (final var node : nodes) {
            if (node.name() != null) {
                out.put(node.name(), node.resources());
            }
        }
        return out;
    }

    public Map<String, Tree<Object>> stats() {
        final var out = new LinkedHashMap<String, Tree<Object>>();
        for (final var node : nodes) {
            if (node.name() != null) {
                out.put(node.name(), node.stats());
            }
        }
        return out;
    }

    /**
     * @return the sum of all node resources.
     * @throws io.yupiik.kubernetes.agent.service.aggregation.EmptyAggregationException if there is no node.
     */
    public Tree<Number> clusterResources() {
        return StructuralFold.fold(resources().values(), Quantities::add);
    }

    /**
     * @return the sum of all node statistics, the timestamp being the average one.
     * @throws io.yupiik.kubernetes.agent.service.aggregation.EmptyAggregationException if there is no node.
     */
    public Tree<Object> clusterStats() {
        final var stats = stats();
        return NodeStats.averageTimestamp(StructuralFold.fold(stats.values(), NodeStats::add), stats.size());
    }
}
