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

import io.yupiik.kubernetes.agent.client.model.metrics.MetricValueList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.toList;

/**
 * Result of a single metric query in a namespace, one record per described object.
 */
public record MetricSeries(List<DescribedMetric> items) {
    public static final MetricSeries EMPTY = new MetricSeries(List.of());

    public MetricSeries {
        items = List.copyOf(items);
    }

    public static MetricSeries of(final MetricValueList values) {
        if (values == null || values.items() == null) {
            return EMPTY;
        }
        return new MetricSeries(values.items().stream().map(DescribedMetric::of).collect(toList()));
    }

    /**
     * Builds the per object records of a namespace from the series of independent metric queries.
     * Empty series (no pod matched) contribute nothing.
     *
     * @param series the query results of a namespace, in query order.
     * @return the combined series, empty if no query returned any record.
     * @throws IdentityMismatchException if the queries did not return the objects in the same order.
     */
    public static MetricSeries composite(final List<MetricSeries> series) throws IdentityMismatchException {
        MetricSeries result = null;
        for (final var current : series) {
            if (current.isEmpty()) {
                continue;
            }
            result = result == null ? current : result.combine(current);
        }
        return result == null ? EMPTY : result;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Combines both series position by position, extra items of the longest series are dropped.
     *
     * @throws IdentityMismatchException if two records at the same position are not about the same object.
     */
    public MetricSeries combine(final MetricSeries other) throws IdentityMismatchException {
        final int size = Math.min(items.size(), other.items().size());
        final var out = new ArrayList<DescribedMetric>(size);
        for (int i = 0; i < size; i++) {
            out.add(items.get(i).combine(other.items().get(i)));
        }
        return new MetricSeries(out);
    }

    public List<Map<String, Object>> toSectionValue() {
        return items.stream().map(DescribedMetric::toSectionValue).collect(toList());
    }
}
