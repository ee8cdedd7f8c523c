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

import io.yupiik.kubernetes.agent.client.model.k8s.ComponentStatus;
import io.yupiik.kubernetes.agent.client.model.k8s.Namespace;
import io.yupiik.kubernetes.agent.client.model.k8s.PersistentVolume;
import io.yupiik.kubernetes.agent.client.model.k8s.PersistentVolumeClaim;
import io.yupiik.kubernetes.agent.client.model.k8s.Role;
import io.yupiik.kubernetes.agent.client.model.k8s.StorageClass;
import io.yupiik.kubernetes.agent.service.metric.MetricSeries;
import io.yupiik.kubernetes.agent.service.view.NodeList;
import io.yupiik.kubernetes.agent.service.view.PodList;

import java.util.List;
import java.util.Map;

/**
 * Everything collected during a single run, fully resolved.
 *
 * @param podMetrics metric group to namespace to the metric query results, see
 *                   {@link io.yupiik.kubernetes.agent.service.metric.CustomMetricsCollector#collect}.
 */
public record ApiData(
        List<StorageClass> storageClasses,
        List<Namespace> namespaces,
        List<Role> roles,
        List<Role> clusterRoles,
        List<ComponentStatus> componentStatuses,
        NodeList nodes,
        List<PersistentVolume> persistentVolumes,
        List<PersistentVolumeClaim> persistentVolumeClaims,
        PodList pods,
        Map<String, Map<String, List<MetricSeries>>> podMetrics) {
}
