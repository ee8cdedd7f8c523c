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
package io.yupiik.kubernetes.agent.section;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * An agent section, an ordered mapping rendered as a single JSON line.
 */
public class Section {
    private final Map<String, Object> content = new LinkedHashMap<>();

    /**
     * Adds all entries of {@code data}, see {@link #shallowMerge(Map, Map)}.
     *
     * @param data entries to add.
     * @return this section.
     * @throws DuplicateKeyException if a scalar key is already present.
     */
    public Section insert(final Map<String, ?> data) {
        shallowMerge(content, data);
        return this;
    }

    public Map<String, Object> content() {
        return unmodifiableMap(content);
    }

    /**
     * Absent keys are added, mappings present on both sides are updated one level deep
     * (incoming inner keys overwrite existing ones), any other collision fails.
     */
    static void shallowMerge(final Map<String, Object> target, final Map<String, ?> data) {
        for (final var entry : data.entrySet()) {
            final var key = entry.getKey();
            final var value = entry.getValue();
            if (!target.containsKey(key)) {
                target.put(key, value instanceof Map<?, ?> map ? new LinkedHashMap<Object, Object>(map) : value);
                continue;
            }

            final var existing = target.get(key);
            if (existing instanceof Map<?, ?> current && value instanceof Map<?, ?> map) {
                final var merged = new LinkedHashMap<Object, Object>(current);
                merged.putAll(map);
                target.put(key, merged);
            } else {
                throw new DuplicateKeyException(key);
            }
        }
    }
}
