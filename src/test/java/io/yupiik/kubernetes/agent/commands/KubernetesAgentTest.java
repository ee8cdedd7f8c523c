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
package io.yupiik.kubernetes.agent.commands;

import io.yupiik.fusion.testing.launcher.FusionCLITest;
import io.yupiik.fusion.testing.launcher.Stdout;
import io.yupiik.kubernetes.agent.test.K8sMock;

import static org.junit.jupiter.api.Assertions.assertEquals;

class KubernetesAgentTest {
    @K8sMock
    @FusionCLITest(args = "kubernetes")
    void report(final Stdout stdout) {
        assertEquals("""
                <<<k8s_nodes:sep(0)>>>
                {"nodes": ["node1"]}
                <<<k8s_namespaces:sep(0)>>>
                {"test": {"status": {"phase": "Active"}}}
                <<<k8s_persistent_volumes:sep(0)>>>
                {}
                <<<k8s_component_statuses:sep(0)>>>
                {}
                <<<k8s_persistent_volume_claims:sep(0)>>>
                {}
                <<<k8s_storage_classes:sep(0)>>>
                {}
                <<<k8s_roles:sep(0)>>>
                {"roles": [], "cluster_roles": [{"name": "cluster-admin", "namespace": null, "creation_timestamp": 1.5707016E9}]}
                <<<k8s_resources:sep(0)>>>
                {"capacity": {"cpu": 2.0, "memory": 2.147483648E9, "pods": 110}, "allocatable": {"cpu": 1.5, "memory": 1.073741824E9, "pods": 100}, "limits": {"cpu": 0.5, "memory": 2.68435456E8}, "requests": {"cpu": 0.25, "memory": 1.34217728E8, "pods": 1}}
                <<<k8s_stats:sep(0)>>>
                {"timestamp": 1.57070161E9, "cpu": {"load_average": 0.75}, "memory": {"pressure": 0.5}}
                <<<<node1>>>>
                <<<k8s_resources:sep(0)>>>
                {"capacity": {"cpu": 2.0, "memory": 2.147483648E9, "pods": 110}, "allocatable": {"cpu": 1.5, "memory": 1.073741824E9, "pods": 100}, "limits": {"cpu": 0.5, "memory": 2.68435456E8}, "requests": {"cpu": 0.25, "memory": 1.34217728E8, "pods": 1}}
                <<<k8s_stats:sep(0)>>>
                {"timestamp": 1.57070161E9, "cpu": {"load_average": 0.75}, "memory": {"pressure": 0.5}}
                <<<k8s_conditions:sep(0)>>>
                {"Ready": "True"}
                <<<<>>>>
                <<<k8s_pods_memory:sep(0)>>>
                {"test": [{"from_object": {"kind": "Pod", "namespace": "test", "name": "web", "apiVersion": "/v1"}, "metrics": {"memory_rss": "1Mi", "memory_swap": "0"}}]}
                <<<k8s_pods_fs:sep(0)>>>
                {"test": []}
                <<<k8s_pods_cpu:sep(0)>>>
                {}
                """, stdout.content());
    }
}
