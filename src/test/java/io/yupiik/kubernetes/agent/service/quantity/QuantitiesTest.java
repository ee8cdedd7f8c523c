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
package io.yupiik.kubernetes.agent.service.quantity;

import org.junit.jupiter.api.Test;

import static io.yupiik.kubernetes.agent.service.quantity.Quantities.add;
import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseCount;
import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseFraction;
import static io.yupiik.kubernetes.agent.service.quantity.Quantities.parseMemory;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QuantitiesTest {
    @Test
    void fraction() {
        assertEquals(.5, parseFraction("500m"));
        assertEquals(2., parseFraction("2"));
        assertEquals(1.5, parseFraction("1.5"));
        assertEquals(Double.POSITIVE_INFINITY, parseFraction("inf"));
    }

    @Test
    void binaryMemory() {
        assertEquals(1024., parseMemory("1Ki"));
        assertEquals(2 * Math.pow(1024, 3), parseMemory("2Gi"));
        assertEquals(512 * Math.pow(1024, 2), parseMemory("512Mi"));
        assertEquals(Math.pow(1024, 6), parseMemory("1Ei"));
    }

    @Test
    void decimalMemory() {
        assertEquals(3000., parseMemory("3K"));
        assertEquals(3000., parseMemory("3k"));
        assertEquals(5e6, parseMemory("5M"));
        assertEquals(1e18, parseMemory("1E"));
    }

    @Test
    void plainMemory() {
        assertEquals(129e6, parseMemory("129e6"));
        assertEquals(512., parseMemory("512"));
        assertEquals(0., parseMemory("0.0"));
        assertEquals(Double.POSITIVE_INFINITY, parseMemory("inf"));
    }

    @Test
    void malformed() {
        assertEquals("1.2.3Gi", assertThrows(MalformedQuantityException.class, () -> parseMemory("1.2.3Gi")).quantity());
        assertThrows(MalformedQuantityException.class, () -> parseMemory("Gi"));
        assertThrows(MalformedQuantityException.class, () -> parseMemory("10Xi"));
        assertThrows(MalformedQuantityException.class, () -> parseMemory("1d"));
        assertThrows(MalformedQuantityException.class, () -> parseFraction("m"));
        assertThrows(MalformedQuantityException.class, () -> parseFraction("abc"));
        assertThrows(MalformedQuantityException.class, () -> parseCount("1.5"));
    }

    @Test
    void count() {
        assertEquals(110L, parseCount("110"));
    }

    @Test
    void addKeepsIntegers() {
        assertEquals(3L, add(1L, 2L));
        assertEquals(1.5, add(1L, .5));
        assertEquals(Double.POSITIVE_INFINITY, add(Double.POSITIVE_INFINITY, 2.));
    }
}
