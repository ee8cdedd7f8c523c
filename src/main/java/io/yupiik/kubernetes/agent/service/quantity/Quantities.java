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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

import static java.util.Locale.ROOT;

/**
 * Kubernetes quantity helpers, see https://pkg.go.dev/k8s.io/apimachinery/pkg/api/resource.
 * <p>
 * Parsers never default a missing value, callers pass the textual default they want ({@code "0.0"}, {@code "inf"}).
 */
public final class Quantities {
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private Quantities() {
        // no-op
    }

    /**
     * @param value a cpu quantity like {@code 500m} or {@code 2}.
     * @return the value in cores.
     */
    public static double parseFraction(final String value) {
        if (value.endsWith("m")) {
            return parseFloat(value.substring(0, value.length() - 1), value) * .001;
        }
        return parseFloat(value, value);
    }

    /**
     * @param value a memory quantity like {@code 1Gi}, {@code 3K} or {@code 129e6}.
     * @return the value in bytes.
     */
    public static double parseMemory(final String value) {
        if (value.length() > 2) { // binary units first, "Mi" must not be read as "i" nor "M"
            final var suffix = value.substring(value.length() - 2);
            for (final var unit : Unit.BINARY) {
                if (unit.name().equals(suffix)) {
                    return parseFloat(value.substring(0, value.length() - 2), value) * unit.factor;
                }
            }
        }
        if (value.length() > 1) {
            final var suffix = value.substring(value.length() - 1);
            for (final var unit : Unit.DECIMAL) {
                if (unit.name().equals(suffix) || ("K".equals(suffix) && unit == Unit.k)) {
                    return parseFloat(value.substring(0, value.length() - 1), value) * unit.factor;
                }
            }
        }
        return parseFloat(value, value);
    }

    /**
     * @param value an integer count (pods for ex).
     * @return the parsed count.
     */
    public static long parseCount(final String value) {
        final var trimmed = value.strip();
        if (!INTEGER.matcher(trimmed).matches()) {
            throw new MalformedQuantityException(value);
        }
        return Long.parseLong(trimmed);
    }

    /**
     * Adds two quantities keeping integral values integral, any other combination is computed as a double.
     */
    public static Number add(final Number a, final Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return a.longValue() + b.longValue();
        }
        return a.doubleValue() + b.doubleValue();
    }

    /**
     * Normalizes a decoded JSON number to {@link Long} when it is integral and {@link Double} otherwise.
     */
    public static Number normalize(final Number number) {
        if (number instanceof BigDecimal decimal) {
            if (decimal.scale() <= 0) {
                try {
                    return decimal.longValueExact();
                } catch (final ArithmeticException ae) { // too big, keep the magnitude
                    return decimal.doubleValue();
                }
            }
            return decimal.doubleValue();
        }
        if (number instanceof BigInteger integer) {
            return integer.bitLength() < 64 ? integer.longValue() : integer.doubleValue();
        }
        if (isIntegral(number)) {
            return number.longValue();
        }
        return number.doubleValue();
    }

    private static boolean isIntegral(final Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte;
    }

    private static double parseFloat(final String number, final String quantity) {
        final var trimmed = number.strip();
        return switch (trimmed.toLowerCase(ROOT)) {
            case "inf", "+inf", "infinity", "+infinity" -> Double.POSITIVE_INFINITY;
            case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
            case "nan", "+nan", "-nan" -> Double.NaN;
            default -> {
                if (!FLOAT.matcher(trimmed).matches()) {
                    throw new MalformedQuantityException(quantity);
                }
                yield Double.parseDouble(trimmed);
            }
        };
    }

    public enum Unit {
        Ki(1024), Mi(1_048_576), Gi(1_073_741_824), Ti(1_099_511_627_776L), Pi(1_125_899_906_842_624L), Ei(1_152_921_504_606_846_976L),
        k(1e3), M(1e6), G(1e9), T(1e12), P(1e15), E(1e18);

        private static final Unit[] BINARY = {Ki, Mi, Gi, Ti, Pi, Ei};
        private static final Unit[] DECIMAL = {k, M, G, T, P, E};

        private final double factor;

        Unit(final double factor) {
            this.factor = factor;
        }

        public double factor() {
            return factor;
        }
    }
}
