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
 * Bundles the sections of a single host, in first seen order.
 */
public class Element {
    private final Map<String, Section> sections = new LinkedHashMap<>();

    public Section get(final String sectionName) {
        return sections.computeIfAbsent(sectionName, k -> new Section());
    }

    public Map<String, Section> sections() {
        return unmodifiableMap(sections);
    }

    @Override
    public String toString() {
        return new SectionWriter().write(this);
    }
}
