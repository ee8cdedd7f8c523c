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

import io.yupiik.kubernetes.agent.client.model.k8s.Metadata;
import io.yupiik.kubernetes.agent.client.model.k8s.Pod;
import io.yupiik.kubernetes.agent.service.aggregation.Tree;

import java.util.List;

import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseFraction;
import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseMemory;
import static java.util.Optional.ofNullable;

public record PodView(Pod pod) {
    public String name() {
        return ofNullable(pod.metadata()).map(Metadata::name).orElse(null);
    }

    public String node() {
        return pod.spec() == null ? null : pod.spec().nodeName();
    }

    /**
     * Sums the limits and requests of all the pod containers.
     * A container without limits can consume anything so it makes the pod limits infinite.
     *
     * @return the pod resources view.
     */
    public Tree<Number> resources() {
        double cpuLimit = 0;
        double memoryLimit = 0;
        double cpuRequest = 0;
        double memoryRequest = 0;

        final List<Pod.Container> containers = pod.spec() == null || pod.spec().containers() == null ? List.of() : pod.spec().containers();
        for (final var container : containers) {
            final var resources = container.resources();
            if (resources == null) {
                continue;
            }

            final var limits = resources.limits();
            if (isSet(limits)) {
                cpuLimit += parseFraction(ofNullable(limits.cpu()).orElse("inf"));
                memoryLimit += parseMemory(ofNullable(limits.memory()).orElse("inf"));
            } else {
                cpuLimit += Double.POSITIVE_INFINITY;
                memoryLimit += Double.POSITIVE_INFINITY;
            }

            final var requests = resources.requests();
            if (isSet(requests)) {
                cpuRequest += parseFraction(ofNullable(requests.cpu()).orElse("0.0"));
                memoryRequest += parseMemory(ofNullable(requests.memory()).orElse("0.0"));
            }
        }
        return view(cpuLimit, memoryLimit, cpuRequest, memoryRequest);
    }

    public static Tree<Number> zeroResources() {
        return view(0., 0., 0., 0.);
    }

    private static boolean isSet(final Pod.Bounds bounds) {
        return bounds != null && (bounds.cpu() != null || bounds.memory() != null);
    }

    private static Tree<Number> view(final double cpuLimit, final double memoryLimit,
                                     final double cpuRequest, final double memoryRequest) {
        return Tree.<Number>builder()
                .put("limits", Tree.<Number>builder()
                        .put("cpu", cpuLimit)
                        .put("memory", memoryLimit)
                        .build())
                .put("requests", Tree.<Number>builder()
                        .put("cpu", cpuRequest)
                        .put("memory", memoryRequest)
                        .build())
                .build();
    }
}
