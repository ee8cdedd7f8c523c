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
package io.yupiik.kubernetes.agent.service;

import io.yupiik.fusion.framework.api.scope.ApplicationScoped;
import io.yupiik.fusion.kubernetes.client.KubernetesClient;
import io.yupiik.kubernetes.agent.client.model.k8s.ComponentStatuses;
import io.yupiik.kubernetes.agent.client.model.k8s.Metadata;
import io.yupiik.kubernetes.agent.client.model.k8s.Namespace;
import io.yupiik.kubernetes.agent.client.model.k8s.Namespaces;
import io.yupiik.kubernetes.agent.client.model.k8s.Node;
import io.yupiik.kubernetes.agent.client.model.k8s.Nodes;
import io.yupiik.kubernetes.agent.client.model.k8s.PersistentVolumeClaims;
import io.yupiik.kubernetes.agent.client.model.k8s.PersistentVolumes;
import io.yupiik.kubernetes.agent.client.model.k8s.Pods;
import io.yupiik.kubernetes.agent.client.model.k8s.Roles;
import io.yupiik.kubernetes.agent.client.model.k8s.StorageClasses;
import io.yupiik.kubernetes.agent.service.metric.CustomMetricsCollector;
import io.yupiik.kubernetes.agent.service.view.NodeList;
import io.yupiik.kubernetes.agent.service.view.NodeStats;
import io.yupiik.kubernetes.agent.service.view.NodeView;
import io.yupiik.kubernetes.agent.service.view.PodList;
import io.yupiik.kubernetes.agent.service.view.PodView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.concurrent.CompletableFuture.allOf;
import static java.util.stream.Collectors.toList;

/**
 * Fetches all the entities the report needs. Calls are concurrent but the returned stage only completes
 * once every call completed so the aggregation always works on complete data.
 */
@ApplicationScoped
public class ClusterCollector {
    private static final Logger log = LoggerFactory.getLogger(ClusterCollector.class);

    private final KubernetesFriend kubernetesFriend;
    private final CustomMetricsCollector customMetricsCollector;

    public ClusterCollector(final KubernetesFriend kubernetesFriend, final CustomMetricsCollector customMetricsCollector) {
        this.kubernetesFriend = kubernetesFriend;
        this.customMetricsCollector = customMetricsCollector;
    }

    public CompletionStage<ApiData> collect(final KubernetesClient k8s, final String metricsApi) {
        log.info("Collecting API data");

        final var storageClasses = kubernetesFriend.fetch(
                k8s, "/apis/storage.k8s.io/v1/storageclasses", "Invalid storage classes response: ", StorageClasses.class).toCompletableFuture();
        final var namespaces = kubernetesFriend.fetch(
                k8s, "/api/v1/namespaces", "Invalid namespaces response: ", Namespaces.class).toCompletableFuture();
        final var roles = kubernetesFriend.fetch(
                k8s, "/apis/rbac.authorization.k8s.io/v1/roles", "Invalid roles response: ", Roles.class).toCompletableFuture();
        final var clusterRoles = kubernetesFriend.fetch(
                k8s, "/apis/rbac.authorization.k8s.io/v1/clusterroles", "Invalid cluster roles response: ", Roles.class).toCompletableFuture();
        final var componentStatuses = kubernetesFriend.fetch(
                k8s, "/api/v1/componentstatuses", "Invalid component statuses response: ", ComponentStatuses.class).toCompletableFuture();
        final var persistentVolumes = kubernetesFriend.fetch(
                k8s, "/api/v1/persistentvolumes", "Invalid persistent volumes response: ", PersistentVolumes.class).toCompletableFuture();
        final var persistentVolumeClaims = kubernetesFriend.fetch(
                k8s, "/api/v1/persistentvolumeclaims", "Invalid persistent volume claims response: ", PersistentVolumeClaims.class).toCompletableFuture();
        final var pods = kubernetesFriend.fetch(
                k8s, "/api/v1/pods", "Invalid pods response: ", Pods.class).toCompletableFuture();
        final var nodes = kubernetesFriend.fetch(k8s, "/api/v1/nodes", "Invalid nodes response: ", Nodes.class)
                .thenCompose(n -> findNodeViews(k8s, orEmpty(n.items())))
                .toCompletableFuture();
        final var podMetrics = namespaces
                .thenCompose(n -> customMetricsCollector.collect(k8s, metricsApi, orEmpty(n.items()).stream()
                        .map(Namespace::metadata)
                        .filter(Objects::nonNull)
                        .map(Metadata::name)
                        .filter(Objects::nonNull)
                        .toList()))
                .toCompletableFuture();

        return allOf(storageClasses, namespaces, roles, clusterRoles, componentStatuses, persistentVolumes, persistentVolumeClaims, pods, nodes, podMetrics)
                .thenApply(ignored -> {
                    log.debug("Assigning collected data");
                    return new ApiData(
                            orEmpty(storageClasses.join().items()),
                            orEmpty(namespaces.join().items()),
                            orEmpty(roles.join().items()),
                            orEmpty(clusterRoles.join().items()),
                            orEmpty(componentStatuses.join().items()),
                            new NodeList(nodes.join()),
                            orEmpty(persistentVolumes.join().items()),
                            orEmpty(persistentVolumeClaims.join().items()),
                            new PodList(orEmpty(pods.join().items()).stream().map(PodView::new).collect(toList())),
                            podMetrics.join());
                });
    }

    // kubelet statistics, one call per node
    private CompletableFuture<List<NodeView>> findNodeViews(final KubernetesClient k8s, final List<Node> nodes) {
        final var views = nodes.stream()
                .filter(node -> node.metadata() != null && node.metadata().name() != null)
                .map(node -> kubernetesFriend.fetchObject(
                                k8s, "/api/v1/nodes/" + node.metadata().name() + "/proxy/stats",
                                "Invalid stats response for node " + node.metadata().name() + ": ")
                        .thenApply(stats -> new NodeView(node, NodeStats.latest(node.metadata().name(), stats)))
                        .toCompletableFuture())
                .toList();
        return allOf(views.toArray(CompletableFuture<?>[]::new))
                .thenApply(ignored -> views.stream().map(CompletableFuture::join).toList());
    }

    private static <T> List<T> orEmpty(final List<T> list) {
        return list == null ? List.of() : list;
    }
}
