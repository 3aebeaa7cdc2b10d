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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationLiteralsTest {

    @ParameterizedTest
    @CsvSource({
            "500ms, 500000000",
            "10s, 10000000000",
            "1m, 60000000000",
            "1h, 3600000000000",
            "1h30m, 5400000000000",
            "1.5s, 1500000000",
            "1m0s, 60000000000",
            "250us, 250000",
            "250µs, 250000",
            "42ns, 42",
            "0, 0",
            "0s, 0",
            "-2s, -2000000000",
            "+3ms, 3000000",
            ".5s, 500000000"
    })
    @DisplayName("Should parse valid duration literals")
    void shouldParseValidLiterals(String literal, long expectedNanos) {
        assertThat(DurationLiterals.parse(literal)).isEqualTo(Duration.ofNanos(expectedNanos));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "10", "ms", "1x", "1.2.3s", "-", "s10", "10 s"})
    @DisplayName("Should reject malformed duration literals")
    void shouldRejectMalformedLiterals(String literal) {
        assertThatThrownBy(() -> DurationLiterals.parse(literal))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_shouldRejectOverflowingLiteral() {
        assertThatThrownBy(() -> DurationLiterals.parse("3000000h"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void parse_shouldNameUnknownUnit() {
        assertThatThrownBy(() -> DurationLiterals.parse("5d"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown unit 'd'");
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0s",
            "42, 42ns",
            "1500, 1.5µs",
            "1500000, 1.5ms",
            "500000000, 500ms",
            "10000000000, 10s",
            "60000000000, 1m0s",
            "90500000000, 1m30.5s",
            "3600000000000, 1h0m0s",
            "5400000000000, 1h30m0s",
            "-2000000000, -2s"
    })
    @DisplayName("Should render durations in their canonical form")
    void shouldFormatCanonically(long nanos, String expected) {
        assertThat(DurationLiterals.format(Duration.ofNanos(nanos))).isEqualTo(expected);
    }

    @Test
    void formattedDurationsShouldParseBackToTheSameValue() {
        for (Duration duration : new Duration[]{Duration.ofMillis(50), Duration.ofSeconds(1), Duration.ofMinutes(1),
                Duration.ofHours(1).plusMillis(1), Duration.ofNanos(Long.MAX_VALUE), Duration.ofNanos(Long.MIN_VALUE)}) {
            assertThat(DurationLiterals.parse(DurationLiterals.format(duration))).isEqualTo(duration);
        }
    }
}
