/*
 * Copyright (c) 2023 - Yupiik SAS - https://www.yupiik.com
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

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.util.stream.Stream;

import static java.util.stream.Collectors.joining;

/**
 * Renders the piggyback protocol:
 * <pre>
 * &lt;&lt;&lt;&lt;host&gt;&gt;&gt;&gt;
 * &lt;&lt;&lt;section:sep(0)&gt;&gt;&gt;
 * {"key": value}
 * &lt;&lt;&lt;&lt;&gt;&gt;&gt;&gt;
 * </pre>
 * Payloads use the {@code ", "}/{@code ": "} separators, ASCII only strings and bare non finite numbers
 * ({@code Infinity}, {@code NaN}) the monitoring backend expects.
 */
public class SectionWriter {
    private static final ObjectWriter WRITER = new ObjectMapper(new JsonFactoryBuilder()
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
            .build())
            .writer(new SinglelinePrettyPrinter());

    public String write(final Group group) {
        return group.elements().entrySet().stream()
                .flatMap(e -> Stream.concat(Stream.concat(
                                Stream.of("<<<<" + e.getKey() + ">>>>"),
                                lines(e.getValue())),
                        Stream.of("<<<<>>>>")))
                .collect(joining("\n"));
    }

    public String write(final Element element) {
        return lines(element).collect(joining("\n"));
    }

    public String write(final String sectionName, final Section section) {
        return "<<<" + sectionName + ":sep(0)>>>\n" + toJson(section.content());
    }

    private Stream<String> lines(final Element element) {
        return element.sections().entrySet().stream()
                .flatMap(e -> Stream.of("<<<" + e.getKey() + ":sep(0)>>>", toJson(e.getValue().content())));
    }

    public String toJson(final Object value) {
        try {
            return WRITER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Can't serialize section value: " + e.getMessage(), e);
        }
    }

    // single line, space after ',' and ':'
    private static class SinglelinePrettyPrinter extends MinimalPrettyPrinter {
        @Override
        public void writeObjectFieldValueSeparator(final JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(final JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(final JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }
}
