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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PodViewTest {
    @Test
    void sumContainers() {
        final var resources = pod(
                container(new Pod.Bounds("500m", "256Mi"), new Pod.Bounds("250m", "128Mi")),
                container(new Pod.Bounds("1", "1Gi"), new Pod.Bounds("1", null))).resources();
        assertEquals(1.5, resources.get("limits", "cpu"));
        assertEquals(1342177280., resources.get("limits", "memory"));
        assertEquals(1.25, resources.get("requests", "cpu"));
        assertEquals(134217728., resources.get("requests", "memory"));
    }

    @Test
    void unboundedContainerTaintsLimits() {
        final var resources = pod(
                container(new Pod.Bounds("500m", "256Mi"), null),
                container(null, new Pod.Bounds("100m", "64Mi"))).resources();
        assertEquals(Double.POSITIVE_INFINITY, resources.get("limits", "cpu"));
        assertEquals(Double.POSITIVE_INFINITY, resources.get("limits", "memory"));
        assertEquals(.1, resources.get("requests", "cpu"));
    }

    @Test
    void containerWithoutResourcesIsIgnored() {
        final var resources = pod(
                container(new Pod.Bounds("1", "1Gi"), null),
                new Pod.Container("sidecar", null)).resources();
        assertEquals(1., resources.get("limits", "cpu"));
        assertEquals(1073741824., resources.get("limits", "memory"));
        assertEquals(0., resources.get("requests", "memory"));
    }

    @Test
    void partialLimits() {
        final var resources = pod(container(new Pod.Bounds("2", null), null)).resources();
        assertEquals(2., resources.get("limits", "cpu"));
        assertEquals(Double.POSITIVE_INFINITY, resources.get("limits", "memory"));
    }

    @Test
    void noContainer() {
        assertEquals(PodView.zeroResources(), new PodView(new Pod(new Metadata("p", null, null), null)).resources());
        assertNull(new PodView(new Pod(null, null)).node());
        assertNull(new PodView(new Pod(null, null)).name());
    }

    private static Pod.Container container(final Pod.Bounds limits, final Pod.Bounds requests) {
        return new Pod.Container("c", new Pod.Resources(limits, requests));
    }

    private static PodView pod(final Pod.Container... containers) {
        return new PodView(new Pod(new Metadata("p", "default", null), new Pod.Spec("node1", List.of(containers))));
    }
}
