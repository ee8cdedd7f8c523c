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
import io.yupiik.fusion.json.JsonMapper;
import io.yupiik.fusion.kubernetes.client.KubernetesClient;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletionStage;

import static java.net.http.HttpResponse.BodyHandlers.ofString;

@ApplicationScoped
public class KubernetesFriend {
    private final JsonMapper jsonMapper;

    public KubernetesFriend(final JsonMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    public <T> CompletionStage<T> fetch(final KubernetesClient client, final String path, final String error, final Class<T> expected) {
        return send(client, path)
                .thenApplyAsync(res -> {
                    validateResponse(res, error);
                    return jsonMapper.fromString(expected, res.body());
                });
    }

    /**
     * Same as {@link #fetch(KubernetesClient, String, String, Class)} for free form payloads (maps, lists, numbers, strings).
     */
    public CompletionStage<Object> fetchObject(final KubernetesClient client, final String path, final String error) {
        return fetch(client, path, error, Object.class);
    }

    /**
     * Raw call, status is not validated.
     */
    public CompletionStage<HttpResponse<String>> send(final KubernetesClient client, final String path) {
        return client.sendAsync(
                HttpRequest.newBuilder()
                        .header("accept", "application/json")
                        .uri(URI.create("https://kubernetes.api" + path))
                        .timeout(Duration.ofMinutes(1))
                        .build(),
                ofString());
    }

    public <T> T read(final Class<T> expected, final String json) {
        return jsonMapper.fromString(expected, json);
    }

    private void validateResponse(final HttpResponse<String> res, final String x) {
        if (res.statusCode() != 200) {
            throw new IllegalStateException(x + res + "\n" + res.body());
        }
    }
}
