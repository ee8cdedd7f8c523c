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

import io.yupiik.kubernetes.agent.client.model.metrics.MetricValue;
import io.yupiik.kubernetes.agent.client.model.metrics.ObjectReference;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Collections.unmodifiableMap;

/**
 * Metric values of a single described object.
 *
 * @param describedObject identity of the object the metrics are about.
 * @param metrics         metric name to value, a value can be {@code null}.
 */
public record DescribedMetric(ObjectReference describedObject, Map<String, String> metrics) {
    public DescribedMetric {
        metrics = unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public static DescribedMetric of(final MetricValue value) {
        final var metrics = new LinkedHashMap<String, String>();
        metrics.put(value.metricName(), value.value());
        return new DescribedMetric(value.describedObject(), metrics);
    }

    /**
     * @param other metrics of the same object.
     * @return the union of both metrics, {@code other} values win.
     * @throws IdentityMismatchException if both records are not about the same object.
     */
    public DescribedMetric combine(final DescribedMetric other) throws IdentityMismatchException {
        if (!Objects.equals(describedObject, other.describedObject())) {
            throw new IdentityMismatchException(describedObject, other.describedObject());
        }
        final var merged = new LinkedHashMap<>(metrics);
        merged.putAll(other.metrics());
        return new DescribedMetric(describedObject, merged);
    }

    public Map<String, Object> toSectionValue() {
        final var out = new LinkedHashMap<String, Object>();
        out.put("from_object", describedObject == null ? null : describedObject(describedObject));
        out.put("metrics", metrics);
        return out;
    }

    private static Map<String, Object> describedObject(final ObjectReference reference) {
        final var out = new LinkedHashMap<String, Object>();
        out.put("kind", reference.kind());
        out.put("namespace", reference.namespace());
        out.put("name", reference.name());
        out.put("apiVersion", reference.apiVersion());
        return out;
    }
}
