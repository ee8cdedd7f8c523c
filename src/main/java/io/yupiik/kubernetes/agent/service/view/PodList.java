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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.stream.Collectors.toList;

/**
 * Pod aggregations, pods not scheduled on a node yet are only counted at cluster level.
 */
public class PodList {
    private final List<PodView> pods;

    public PodList(final List<PodView> pods) {
        this.pods = pods;
    }

    public Map<String, Map<String, Object>> podsPerNode() {
        final var out = new LinkedHashMap<String, Map<String, Object>>();
        byNode().forEach((node, nodePods) -> out.put(node, podCount(nodePods.size())));
        return out;
    }

    public Map<String, Object> podsInCluster() {
        return podCount(pods.size());
    }

    /**
     * @return limits and requests of all containers grouped by node.
     */
    public Map<String, Tree<Number>> resourcesPerNode() {
        final var out = new LinkedHashMap<String, Tree<Number>>();
        byNode().forEach((node, nodePods) -> out.put(node, StructuralFold.fold(
                PodView.zeroResources(),
                nodePods.stream().map(PodView::resources).collect(toList()),
                Quantities::add)));
        return out;
    }

    public Tree<Number> clusterResources() {
        return StructuralFold.fold(
                PodView.zeroResources(),
                pods.stream().map(PodView::resources).collect(toList()),
                Quantities::add);
    }

    private Map<String, List<PodView>> byNode() {
        final var byNode = new TreeMap<String, List<PodView>>();
        for (final var pod : pods) {
            if (pod.node() != null) {
                byNode.computeIfAbsent(pod.node(), k -> new ArrayList<>()).add(pod);
            }
        }
        return byNode;
    }

    private static Map<String, Object> podCount(final long count) {
        return Map.of("requests", Map.of("pods", count));
    }
}
