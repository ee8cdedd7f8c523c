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
package io.yupiik.kubernetes.agent.service.metric;

import io.yupiik.fusion.framework.api.scope.ApplicationScoped;
import io.yupiik.fusion.kubernetes.client.KubernetesClient;
import io.yupiik.kubernetes.agent.client.model.metrics.MetricValueList;
import io.yupiik.kubernetes.agent.service.KubernetesFriend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.concurrent.CompletableFuture.allOf;

/**
 * Queries the custom metrics API for pod metrics, one query per metric and namespace.
 */
@ApplicationScoped
public class CustomMetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(CustomMetricsCollector.class);

    public static final Map<String, List<String>> POD_METRICS = podMetrics();

    private final KubernetesFriend kubernetesFriend;

    public CustomMetricsCollector(final KubernetesFriend kubernetesFriend) {
        this.kubernetesFriend = kubernetesFriend;
    }

    /**
     * @param k8s        client.
     * @param metricsApi custom metrics API base (without leading slash).
     * @param namespaces namespaces to query.
     * @return metric group to namespace to the successful query results of this namespace, in metric order.
     * A namespace without any successful query is absent.
     */
    public CompletionStage<Map<String, Map<String, List<MetricSeries>>>> collect(final KubernetesClient k8s, final String metricsApi,
                                                                                final List<String> namespaces) {
        final var probes = new LinkedHashMap<String, Map<String, List<CompletableFuture<Optional<MetricSeries>>>>>();
        POD_METRICS.forEach((group, metrics) -> {
            final var perNamespace = new LinkedHashMap<String, List<CompletableFuture<Optional<MetricSeries>>>>();
            for (final var namespace : namespaces) {
                perNamespace.put(namespace, new ArrayList<>());
            }
            for (final var metric : metrics) {
                log.debug("Query Custom Metrics Endpoint: {}", metric);
                for (final var namespace : namespaces) {
                    perNamespace.get(namespace).add(probe(k8s, metricsApi, namespace, metric).toCompletableFuture());
                }
            }
            probes.put(group, perNamespace);
        });

        return allOf(probes.values().stream()
                .flatMap(it -> it.values().stream())
                .flatMap(List::stream)
                .toArray(CompletableFuture<?>[]::new))
                .thenApply(ignored -> {
                    final var out = new LinkedHashMap<String, Map<String, List<MetricSeries>>>();
                    probes.forEach((group, perNamespace) -> {
                        final var series = new LinkedHashMap<String, List<MetricSeries>>();
                        perNamespace.forEach((namespace, results) -> {
                            final var available = results.stream()
                                    .map(CompletableFuture::join)
                                    .flatMap(Optional::stream)
                                    .toList();
                            if (!available.isEmpty()) {
                                series.put(namespace, available);
                            }
                        });
                        out.put(group, series);
                    });
                    return out;
                });
    }

    // empty series if there is no pod, no series at all if the backend failed
    private CompletionStage<Optional<MetricSeries>> probe(final KubernetesClient k8s, final String metricsApi,
                                                          final String namespace, final String metric) {
        return kubernetesFriend.send(k8s, "/" + metricsApi + "/namespaces/" + namespace + "/pods/*/" + metric)
                .handle((res, error) -> {
                    if (error != null) {
                        log.info("Data unavailable. {}", error.getMessage());
                        return Optional.empty();
                    }
                    return switch (res.statusCode()) {
                        case 200 -> {
                            try {
                                yield Optional.of(MetricSeries.of(kubernetesFriend.read(MetricValueList.class, res.body())));
                            } catch (final RuntimeException re) {
                                log.info("Data unavailable. Invalid {} payload: {}", metric, re.getMessage());
                                yield Optional.empty();
                            }
                        }
                        case 404 -> {
                            log.info("Data unavailable. No pods in namespace {}", namespace);
                            yield Optional.of(MetricSeries.EMPTY);
                        }
                        default -> {
                            log.info("Data unavailable. {} (HTTP {}): {}", metric, res.statusCode(), res.body());
                            yield Optional.empty();
                        }
                    };
                });
    }

    private static Map<String, List<String>> podMetrics() {
        final var metrics = new LinkedHashMap<String, List<String>>();
        metrics.put("memory", List.of("memory_rss", "memory_swap", "memory_usage_bytes", "memory_max_usage_bytes"));
        metrics.put("fs", List.of("fs_inodes", "fs_reads", "fs_writes", "fs_limit_bytes", "fs_usage_bytes"));
        metrics.put("cpu", List.of("cpu_system", "cpu_user", "cpu_usage"));
        return metrics;
    }
}
