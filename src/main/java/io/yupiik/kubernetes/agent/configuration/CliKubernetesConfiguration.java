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
package io.yupiik.kubernetes.agent.configuration;

import io.yupiik.fusion.framework.build.api.configuration.Property;
import io.yupiik.fusion.kubernetes.client.KubernetesClient;
import io.yupiik.fusion.kubernetes.client.KubernetesClientConfiguration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static java.util.Optional.ofNullable;

public record CliKubernetesConfiguration(
        @Property(documentation = "Kubernetes API base, when set `host`, `port` and prefixes are ignored.") String api,
        @Property(documentation = "Kubernetes host to connect to.") String host,
        @Property(documentation = "Port to connect to.", defaultValue = "443") int port,
        @Property(value = "url-prefix", documentation = "Custom URL prefix (scheme and host) for Kubernetes API calls, the port is appended to it.") String urlPrefix,
        @Property(value = "path-prefix", documentation = "Optional URL path prefix to prepend to Kubernetes API calls.") String pathPrefix,
        @Property(documentation = "If authenticated by token and not using a `kubeconfig`, the token to use.") String token,
        @Property(documentation = "SSL certificates for communication (not authentication).") String certificates,
        @Property(documentation = "If authenticated by a X509 client certificate, the private key.") String privateKey,
        @Property(documentation = "If authenticated by a X509 client certificate, the certificate.") String privateKeyCertificate,
        @Property(documentation = "A `kubeconfig` path.") String kubeconfig) {
    public Path kubeconfigPath() {
        if ((token != null && !token.isBlank()) || (privateKey != null && !privateKey.isBlank())) {
            return null;
        }

        if (kubeconfig != null && !kubeconfig.isBlank()) {
            return Path.of(kubeconfig);
        }

        final var defaultValue = Path.of(System.getProperty("kubernetes-agent.home", System.getProperty("user.home", "."))).resolve(".kube/config");
        if (Files.exists(defaultValue)) {
            return defaultValue;
        }

        return null;
    }

    /**
     * @return the API base computed from `api` or `host`/`port`/prefixes, {@code null} to rely on the `kubeconfig`.
     */
    public String master() {
        if (api != null && !api.isBlank()) {
            return api;
        }
        if (urlPrefix != null && !urlPrefix.isBlank()) {
            return urlPrefix + ":" + port + normalizePathPrefix(pathPrefix);
        }
        if (host != null && !host.isBlank()) {
            return "https://" + host + ":" + port + normalizePathPrefix(pathPrefix);
        }
        return null;
    }

    public KubernetesClient client() {
        return new KubernetesClient(new KubernetesClientConfiguration()
                .setKubeconfig(kubeconfigPath())
                .setToken(ofNullable(token()).orElse("ignore_token_file_if_missing_" + Instant.now().toEpochMilli()))
                .setPrivateKey(privateKey())
                .setPrivateKeyCertificate(privateKeyCertificate())
                .setCertificates(ofNullable(certificates()).orElseGet(() -> System.getenv("REQUESTS_CA_BUNDLE")))
                .setMaster(master()));
    }

    // "/a/b/" and "a/b" both become "/a/b", blank means no prefix
    static String normalizePathPrefix(final String pathPrefix) {
        if (pathPrefix == null) {
            return "";
        }
        var value = pathPrefix.strip();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isEmpty() ? "" : "/" + value;
    }
}
