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
package io.yupiik.kubernetes.agent.report;

import io.yupiik.kubernetes.agent.section.Element;
import io.yupiik.kubernetes.agent.section.Group;
import io.yupiik.kubernetes.agent.section.SectionWriter;
import io.yupiik.kubernetes.agent.service.ApiData;
import io.yupiik.kubernetes.agent.service.aggregation.Tree;
import io.yupiik.kubernetes.agent.service.metric.IdentityMismatchException;
import io.yupiik.kubernetes.agent.service.metric.MetricSeries;
import io.yupiik.kubernetes.agent.service.view.ClusterListings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the three report blocks: cluster sections, node (piggyback) sections and pod custom metrics.
 */
public class AgentReport {
    private static final Logger log = LoggerFactory.getLogger(AgentReport.class);

    private final ApiData data;
    private final SectionWriter writer = new SectionWriter();

    public AgentReport(final ApiData data) {
        this.data = data;
    }

    public Element clusterSections() {
        final var element = new Element();
        element.get("k8s_nodes").insert(data.nodes().listNodes());
        element.get("k8s_namespaces").insert(ClusterListings.namespaces(data.namespaces()));
        element.get("k8s_persistent_volumes").insert(ClusterListings.persistentVolumes(data.persistentVolumes()));
        element.get("k8s_component_statuses").insert(ClusterListings.componentStatuses(data.componentStatuses()));
        element.get("k8s_persistent_volume_claims").insert(ClusterListings.persistentVolumeClaims(data.persistentVolumeClaims()));
        element.get("k8s_storage_classes").insert(ClusterListings.storageClasses(data.storageClasses()));
        element.get("k8s_roles").insert(Map.of("roles", ClusterListings.roles(data.roles())));
        element.get("k8s_roles").insert(Map.of("cluster_roles", ClusterListings.roles(data.clusterRoles())));
        element.get("k8s_resources").insert(data.nodes().clusterResources().toMap());
        element.get("k8s_resources").insert(data.pods().clusterResources().toMap());
        element.get("k8s_resources").insert(data.pods().podsInCluster());
        element.get("k8s_stats").insert(data.nodes().clusterStats().toMap());
        return element;
    }

    public Group nodeSections() {
        return new Group()
                .join("k8s_resources", toMaps(data.nodes().resources()))
                .join("k8s_resources", toMaps(data.pods().resourcesPerNode()))
                .join("k8s_resources", data.pods().podsPerNode())
                .join("k8s_stats", toMaps(data.nodes().stats()))
                .join("k8s_conditions", data.nodes().conditions());
    }

    /**
     * @throws IllegalStateException if metric queries returned misaligned objects.
     */
    public Element customMetricsSections() {
        final var element = new Element();
        data.podMetrics().forEach((group, perNamespace) -> {
            final var records = new LinkedHashMap<String, Object>();
            perNamespace.forEach((namespace, series) -> records.put(namespace, composite(namespace, series).toSectionValue()));
            element.get("k8s_pods_" + group).insert(records);
        });
        return element;
    }

    /**
     * Renders the whole report, nothing is returned if any block fails.
     *
     * @return the cluster, node and custom metrics blocks.
     */
    public List<String> render() {
        log.info("Output cluster sections");
        final var cluster = writer.write(clusterSections());
        log.info("Output node sections");
        final var nodes = writer.write(nodeSections());
        log.info("Output pods custom metrics");
        final var metrics = writer.write(customMetricsSections());
        return List.of(cluster, nodes, metrics);
    }

    private MetricSeries composite(final String namespace, final List<MetricSeries> series) {
        try {
            return MetricSeries.composite(series);
        } catch (final IdentityMismatchException e) {
            throw new IllegalStateException("Misaligned custom metrics in namespace " + namespace + ": " + e.getMessage(), e);
        }
    }

    private static <V> Map<String, Map<String, Object>> toMaps(final Map<String, Tree<V>> trees) {
        final var out = new LinkedHashMap<String, Map<String, Object>>();
        trees.forEach((k, v) -> out.put(k, v.toMap()));
        return out;
    }
}
