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

import io.yupiik.kubernetes.agent.client.model.k8s.ComponentStatus;
import io.yupiik.kubernetes.agent.client.model.k8s.Condition;
import io.yupiik.kubernetes.agent.client.model.k8s.Metadata;
import io.yupiik.kubernetes.agent.client.model.k8s.Namespace;
import io.yupiik.kubernetes.agent.client.model.k8s.PersistentVolume;
import io.yupiik.kubernetes.agent.client.model.k8s.PersistentVolumeClaim;
import io.yupiik.kubernetes.agent.client.model.k8s.Role;
import io.yupiik.kubernetes.agent.client.model.k8s.StorageClass;
import io.yupiik.kubernetes.agent.section.SectionWriter;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ClusterListingsTest {
    private final SectionWriter writer = new SectionWriter();

    @Test
    void namespaces() {
        assertEquals(
                "{\"default\": {\"status\": {\"phase\": \"Active\"}}, \"old\": {\"status\": {\"phase\": null}}}",
                writer.toJson(ClusterListings.namespaces(List.of(
                        new Namespace(new Metadata("default", null, null), new Namespace.Status("Active")),
                        new Namespace(new Metadata(null, null, null), new Namespace.Status("Active")),
                        new Namespace(new Metadata("old", null, null), null)))));
    }

    @Test
    void persistentVolumes() {
        assertEquals(
                "{\"pv1\": {\"access\": [\"ReadWriteOnce\"], \"capacity\": 1.073741824E10, \"status\": {\"phase\": \"Bound\"}}}",
                writer.toJson(ClusterListings.persistentVolumes(List.of(new PersistentVolume(
                        new Metadata("pv1", null, null),
                        new PersistentVolume.Spec(List.of("ReadWriteOnce"), Map.of("storage", "10Gi")),
                        new PersistentVolume.Status("Bound"))))));
    }

    @Test
    void persistentVolumeClaims() {
        assertEquals(
                "{\"data\": {\"namespace\": \"default\", \"condition\": [{\"type\": \"Resizing\", \"status\": \"True\"}], " +
                        "\"phase\": \"Bound\", \"volume\": \"pv1\"}}",
                writer.toJson(ClusterListings.persistentVolumeClaims(List.of(new PersistentVolumeClaim(
                        new Metadata("data", "default", null),
                        new PersistentVolumeClaim.Spec("pv1"),
                        new PersistentVolumeClaim.Status("Bound", List.of(new Condition("Resizing", "True"))))))));
    }

    @Test
    void storageClasses() {
        assertEquals(
                "{\"standard\": {\"provisioner\": \"kubernetes.io/gce-pd\", \"reclaim_policy\": \"Delete\"}}",
                writer.toJson(ClusterListings.storageClasses(List.of(
                        new StorageClass(new Metadata("standard", null, null), "kubernetes.io/gce-pd", "Delete")))));
    }

    @Test
    void componentStatuses() {
        assertEquals(
                "{\"etcd-0\": [{\"type\": \"Healthy\", \"status\": \"True\"}], \"scheduler\": []}",
                writer.toJson(ClusterListings.componentStatuses(List.of(
                        new ComponentStatus(new Metadata("etcd-0", null, null), List.of(new Condition("Healthy", "True"))),
                        new ComponentStatus(new Metadata("scheduler", null, null), null)))));
    }

    @Test
    void roles() {
        assertEquals(
                "[{\"name\": \"reader\", \"namespace\": \"default\", \"creation_timestamp\": 1.5707016E9}, " +
                        "{\"name\": \"admin\", \"namespace\": null, \"creation_timestamp\": null}]",
                writer.toJson(ClusterListings.roles(List.of(
                        new Role(new Metadata("reader", "default", OffsetDateTime.parse("2019-10-10T10:00:00Z"))),
                        new Role(null),
                        new Role(new Metadata("admin", null, null))))));
    }
}
