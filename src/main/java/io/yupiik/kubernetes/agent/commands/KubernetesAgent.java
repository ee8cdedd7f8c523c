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

import io.yupiik.fusion.framework.build.api.cli.Command;
import io.yupiik.fusion.framework.build.api.configuration.Property;
import io.yupiik.fusion.framework.build.api.configuration.RootConfiguration;
import io.yupiik.kubernetes.agent.configuration.CliKubernetesConfiguration;
import io.yupiik.kubernetes.agent.configuration.Verbosity;
import io.yupiik.kubernetes.agent.report.AgentReport;
import io.yupiik.kubernetes.agent.service.ClusterCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;

@Command(name = "kubernetes", description = "Collects the cluster state and prints it as a piggyback monitoring report.")
public class KubernetesAgent implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(KubernetesAgent.class);

    private final Configuration configuration;
    private final ClusterCollector collector;

    public KubernetesAgent(final Configuration configuration, final ClusterCollector collector) {
        this.configuration = configuration;
        this.collector = collector;
    }

    @Override
    public void run() {
        Verbosity.apply(configuration.verbose());
        log.debug("Kubernetes API: {}", configuration.k8s().master());

        try (final var k8s = configuration.k8s().client()) {
            final var data = collector.collect(k8s, configuration.metricsApi())
                    .toCompletableFuture()
                    .get();

            // render everything before printing, a failure must not leave a partial report
            final var blocks = new AgentReport(data).render();
            blocks.forEach(System.out::println);
        } catch (final ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @RootConfiguration("-")
    public record Configuration(
            @Property(documentation = "Verbosity level: 0 shows warnings, 1 adds information messages and 2 debug ones.", defaultValue = "0") int verbose,
            @Property(value = "metrics-api", documentation = "Custom metrics API base endpoint.", defaultValue = "\"apis/custom.metrics.k8s.io/v1beta1\"") String metricsApi,
            @Property(documentation = "How to connect to Kubernetes cluster.", defaultValue = "new CliKubernetesConfiguration()") CliKubernetesConfiguration k8s) {
    }
}
