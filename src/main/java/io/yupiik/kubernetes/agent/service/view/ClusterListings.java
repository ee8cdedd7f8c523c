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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseMemory;
import static java.util.Optional.ofNullable;

/**
 * Per entity listings of the cluster section, entities without a name are ignored.
 */
public final class ClusterListings {
    private ClusterListings() {
        // no-op
    }

    public static Map<String, Object> namespaces(final List<Namespace> namespaces) {
        return byName(namespaces, Namespace::metadata, namespace -> entries(
                "status", entries("phase", namespace.status() == null ? null : namespace.status().phase())));
    }

    public static Map<String, Object> persistentVolumes(final List<PersistentVolume> volumes) {
        return byName(volumes, PersistentVolume::metadata, pv -> entries(
                "access", pv.spec() == null ? null : pv.spec().accessModes(),
                "capacity", capacity(pv),
                "status", entries("phase", pv.status() == null ? null : pv.status().phase())));
    }

    public static Map<String, Object> persistentVolumeClaims(final List<PersistentVolumeClaim> claims) {
        return byName(claims, PersistentVolumeClaim::metadata, pvc -> entries(
                "namespace", pvc.metadata().namespace(),
                "condition", pvc.status() == null ? null : conditions(pvc.status().conditions()),
                "phase", pvc.status() == null ? null : pvc.status().phase(),
                "volume", pvc.spec() == null ? null : pvc.spec().volumeName()));
    }

    public static Map<String, Object> storageClasses(final List<StorageClass> storageClasses) {
        return byName(storageClasses, StorageClass::metadata, sc -> entries(
                "provisioner", sc.provisioner(),
                "reclaim_policy", sc.reclaimPolicy()));
    }

    public static Map<String, Object> componentStatuses(final List<ComponentStatus> statuses) {
        return byName(statuses, ComponentStatus::metadata, status -> ofNullable(conditions(status.conditions())).orElseGet(List::of));
    }

    public static List<Map<String, Object>> roles(final List<Role> roles) {
        final var out = new ArrayList<Map<String, Object>>();
        for (final var role : roles) {
            final var metadata = ofNullable(role.metadata()).orElse(Metadata.EMPTY);
            if (metadata.name() != null) {
                out.add(entries(
                        "name", metadata.name(),
                        "namespace", metadata.namespace(),
                        "creation_timestamp", metadata.creationEpochSeconds()));
            }
        }
        return out;
    }

    private static Double capacity(final PersistentVolume pv) {
        if (pv.spec() == null || pv.spec().capacity() == null) {
            return null;
        }
        final var storage = pv.spec().capacity().get("storage");
        if (storage == null || storage.isBlank()) {
            return null;
        }
        return parseMemory(storage);
    }

    private static List<Map<String, Object>> conditions(final List<Condition> conditions) {
        if (conditions == null) {
            return null;
        }
        return conditions.stream()
                .map(c -> entries("type", c.type(), "status", c.status()))
                .toList();
    }

    private static <T> Map<String, Object> byName(final List<T> items, final Function<T, Metadata> metadata,
                                                  final Function<T, Object> mapper) {
        final var out = new LinkedHashMap<String, Object>();
        for (final var item : items) {
            final var name = ofNullable(metadata.apply(item)).map(Metadata::name).orElse(null);
            if (name != null) {
                out.put(name, mapper.apply(item));
            }
        }
        return out;
    }

    // LinkedHashMap since values can be null
    private static Map<String, Object> entries(final Object... keyValues) {
        final var out = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return out;
    }
}
