/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.conf.utils;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.padStart;
import static org.tarik.conf.utils.CommonUtils.isNotBlank;

/**
 * Parsing and canonical rendering of duration literals such as {@code 500ms}, {@code 1m30s} or {@code 1.5h}.
 * <p>
 * A literal is an optional sign followed by one or more {@code <decimal number><unit>} groups. Supported units are
 * {@code ns}, {@code us} (also {@code µs}), {@code ms}, {@code s}, {@code m} and {@code h}. A bare {@code 0} needs no
 * unit. Values are limited to what fits into a signed 64-bit nanosecond count.
 */
public final class DurationLiterals {
    private static final long NANOS_PER_MICRO = 1_000L;
    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long NANOS_PER_MINUTE = 60 * NANOS_PER_SECOND;
    private static final long NANOS_PER_HOUR = 60 * NANOS_PER_MINUTE;
    private static final String MICROS_SYMBOL = "µs";

    private static final Map<String, Long> NANOS_BY_UNIT = ImmutableMap.<String, Long>builder()
            .put("ns", 1L)
            .put("us", NANOS_PER_MICRO)
            .put(MICROS_SYMBOL, NANOS_PER_MICRO)
            .put("μs", NANOS_PER_MICRO)
            .put("ms", NANOS_PER_MILLI)
            .put("s", NANOS_PER_SECOND)
            .put("m", NANOS_PER_MINUTE)
            .put("h", NANOS_PER_HOUR)
            .build();

    private DurationLiterals() {
    }

    public static Duration parse(String literal) {
        checkArgument(isNotBlank(literal), "Duration literal must not be blank");
        int position = 0;
        boolean negative = false;
        char first = literal.charAt(0);
        if (first == '-' || first == '+') {
            negative = first == '-';
            position++;
        }
        if (literal.substring(position).equals("0")) {
            return Duration.ZERO;
        }
        if (position == literal.length()) {
            throw invalidLiteral(literal);
        }

        BigDecimal totalNanos = BigDecimal.ZERO;
        while (position < literal.length()) {
            int numberStart = position;
            while (position < literal.length() && isNumberChar(literal.charAt(position))) {
                position++;
            }
            String number = literal.substring(numberStart, position);

            int unitStart = position;
            while (position < literal.length() && !isNumberChar(literal.charAt(position))) {
                position++;
            }
            String unit = literal.substring(unitStart, position);

            if (number.isEmpty()) {
                throw invalidLiteral(literal);
            }
            if (unit.isEmpty()) {
                throw new IllegalArgumentException("Missing unit in duration literal '%s'".formatted(literal));
            }
            Long nanosPerUnit = NANOS_BY_UNIT.get(unit);
            if (nanosPerUnit == null) {
                throw new IllegalArgumentException("Unknown unit '%s' in duration literal '%s'. Supported units: %s"
                        .formatted(unit, literal, NANOS_BY_UNIT.keySet()));
            }
            totalNanos = totalNanos.add(toDecimal(number, literal).multiply(BigDecimal.valueOf(nanosPerUnit)));
        }

        BigDecimal nanos = totalNanos.setScale(0, RoundingMode.DOWN);
        if (negative) {
            nanos = nanos.negate();
        }
        try {
            return Duration.ofNanos(nanos.longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration literal '%s' is out of range".formatted(literal), e);
        }
    }

    /**
     * Renders the duration in its canonical form, e.g. {@code 0s}, {@code 1.5ms}, {@code 10s}, {@code 1m0s} or
     * {@code 1h0m0s}. The result is always accepted by {@link #parse(String)} and yields the same duration.
     */
    public static String format(@NotNull Duration duration) {
        long nanos;
        try {
            nanos = duration.toNanos();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration %s is out of range".formatted(duration), e);
        }
        if (nanos == 0) {
            return "0s";
        }

        String sign = nanos < 0 ? "-" : "";
        // Treated as unsigned so that Long.MIN_VALUE keeps its magnitude
        long magnitude = nanos < 0 ? -nanos : nanos;
        if (Long.compareUnsigned(magnitude, NANOS_PER_SECOND) < 0) {
            if (magnitude < NANOS_PER_MICRO) {
                return sign + magnitude + "ns";
            } else if (magnitude < NANOS_PER_MILLI) {
                return sign + withFraction(magnitude, 3) + MICROS_SYMBOL;
            } else {
                return sign + withFraction(magnitude, 6) + "ms";
            }
        }

        long secondsPart = Long.remainderUnsigned(magnitude, NANOS_PER_MINUTE);
        long totalMinutes = Long.divideUnsigned(magnitude, NANOS_PER_MINUTE);
        var result = new StringBuilder(sign);
        if (totalMinutes > 0) {
            long hours = totalMinutes / 60;
            if (hours > 0) {
                result.append(hours).append('h');
            }
            result.append(totalMinutes % 60).append('m');
        }
        return result.append(withFraction(secondsPart, 9)).append('s').toString();
    }

    private static String withFraction(long value, int fractionDigits) {
        long scale = (long) Math.pow(10, fractionDigits);
        long whole = value / scale;
        long fraction = value % scale;
        if (fraction == 0) {
            return Long.toString(whole);
        }
        String digits = padStart(Long.toString(fraction), fractionDigits, '0').replaceAll("0+$", "");
        return whole + "." + digits;
    }

    private static boolean isNumberChar(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }

    private static BigDecimal toDecimal(String number, String literal) {
        try {
            return new BigDecimal(number);
        } catch (NumberFormatException e) {
            throw invalidLiteral(literal);
        }
    }

    private static IllegalArgumentException invalidLiteral(String literal) {
        return new IllegalArgumentException("Invalid duration literal '%s'".formatted(literal));
    }
}
