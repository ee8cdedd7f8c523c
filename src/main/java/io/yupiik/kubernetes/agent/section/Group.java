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
 * Elements indexed by piggyback host name.
 */
public class Group {
    private final Map<String, Element> elements = new LinkedHashMap<>();

    public Element get(final String target) {
        return elements.computeIfAbsent(target, k -> new Element());
    }

    /**
     * Inserts each target data into the section {@code sectionName} of the target element.
     *
     * @param sectionName section to feed for each target.
     * @param perTarget   data per target.
     * @return this group.
     */
    public Group join(final String sectionName, final Map<String, ? extends Map<String, ?>> perTarget) {
        perTarget.forEach((target, data) -> get(target).get(sectionName).insert(data));
        return this;
    }

    public Map<String, Element> elements() {
        return unmodifiableMap(elements);
    }

    @Override
    public String toString() {
        return new SectionWriter().write(this);
    }
}
