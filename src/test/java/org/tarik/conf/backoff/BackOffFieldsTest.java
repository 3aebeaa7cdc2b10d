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
package org.tarik.conf.backoff;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.tarik.conf.schema.ConfigField;
import org.tarik.conf.schema.FieldType;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.conf.backoff.BackOffFields.newBackOffField;
import static org.tarik.conf.backoff.BackOffFields.newBackOffToggledField;

@DisplayName("Back-off field declaration Tests")
class BackOffFieldsTest {
    private static final String UNBOUNDED_SENTENCE =
            "Setting this value to a zeroed duration (such as `0s`) will result in unbounded retries.";

    @Test
    @DisplayName("Should declare three duration children with fallback defaults")
    void shouldDeclareIntervalFieldsWithFallbackDefaults() {
        // When
        ConfigField field = newBackOffField("backoff", false, null);

        // Then
        assertThat(field.name()).isEqualTo("backoff");
        assertThat(field.type()).isEqualTo(FieldType.OBJECT);
        assertThat(field.description()).isEqualTo("Determine time intervals and cut offs for retry attempts.");
        assertThat(field.children()).extracting(ConfigField::name)
                .containsExactly("initial_interval", "max_interval", "max_elapsed_time");
        assertThat(field.children()).extracting(ConfigField::type).containsOnly(FieldType.DURATION);
        assertThat(field.children()).extracting(ConfigField::defaultValue)
                .containsExactly(TextNode.valueOf("500ms"), TextNode.valueOf("10s"), TextNode.valueOf("1m"));
    }

    @Test
    void shouldDescribeAndExemplifyEachIntervalField() {
        // When
        ConfigField field = newBackOffField("backoff", false, null);

        // Then
        ConfigField initial = field.findChild("initial_interval").orElseThrow();
        assertThat(initial.description()).isEqualTo("The initial period to wait between retry attempts.");
        assertThat(initial.examples()).containsExactly("50ms", "1s");

        ConfigField max = field.findChild("max_interval").orElseThrow();
        assertThat(max.description()).isEqualTo("The maximum period to wait between retry attempts");
        assertThat(max.examples()).containsExactly("5s", "1m");

        ConfigField maxElapsed = field.findChild("max_elapsed_time").orElseThrow();
        assertThat(maxElapsed.description()).isEqualTo(
                "The maximum overall period of time to spend on retry attempts before the request is aborted.");
        assertThat(maxElapsed.examples()).containsExactly("1m", "1h");
    }

    @Test
    void maxElapsedTimeDescription_shouldNotMentionUnboundedRetries_whenNotAllowed() {
        ConfigField field = newBackOffField("backoff", false, null);

        assertThat(field.findChild("max_elapsed_time").orElseThrow().description())
                .doesNotContain(UNBOUNDED_SENTENCE);
    }

    @Test
    void maxElapsedTimeDescription_shouldMentionUnboundedRetries_whenAllowed() {
        ConfigField field = newBackOffField("backoff", true, null);

        assertThat(field.findChild("max_elapsed_time").orElseThrow().description()).isEqualTo(
                "The maximum overall period of time to spend on retry attempts before the request is aborted. "
                        + UNBOUNDED_SENTENCE);
    }

    @Test
    void shouldUseTemplateIntervalsAsDefaults() {
        // Given
        ExponentialBackOff template = ExponentialBackOff.defaults()
                .withInitialInterval(Duration.ofSeconds(1))
                .withMaxInterval(Duration.ofSeconds(30))
                .withMaxElapsedTime(Duration.ZERO);

        // When
        ConfigField field = newBackOffField("retries", true, template);

        // Then
        assertThat(field.children()).extracting(ConfigField::defaultValue)
                .containsExactly(TextNode.valueOf("1s"), TextNode.valueOf("30s"), TextNode.valueOf("0s"));
    }

    @Test
    @DisplayName("Toggled variant should declare 'enabled' as its first child, disabled by default")
    void toggledField_shouldDeclareEnabledFirst() {
        // When
        ConfigField field = newBackOffToggledField("backoff", false, null);

        // Then
        assertThat(field.children()).extracting(ConfigField::name)
                .containsExactly("enabled", "initial_interval", "max_interval", "max_elapsed_time");
        ConfigField enabled = field.children().get(0);
        assertThat(enabled.type()).isEqualTo(FieldType.BOOL);
        assertThat(enabled.description()).isEqualTo("Whether retries should be enabled.");
        assertThat(enabled.defaultValue()).isEqualTo(BooleanNode.FALSE);
        assertThat(field.description()).isEqualTo("Determine time intervals and cut offs for retry attempts.");
    }

    @Test
    void toggledField_shouldShareIntervalDeclarationsWithPlainVariant() {
        ConfigField plain = newBackOffField("backoff", true, null);
        ConfigField toggled = newBackOffToggledField("backoff", true, null);

        assertThat(toggled.children().subList(1, 4)).containsExactlyElementsOf(plain.children());
    }

    @Test
    void declarations_shouldBeIndependentValues() {
        ConfigField first = newBackOffField("backoff", true, null);
        ConfigField second = newBackOffField("backoff", false, null);

        assertThat(first.findChild("max_elapsed_time").orElseThrow().description())
                .isNotEqualTo(second.findChild("max_elapsed_time").orElseThrow().description());
    }

    @Test
    @DisplayName("Bounded elapsed time rule should only be attached when the lint is enabled")
    void maxElapsedTimeRule_shouldFollowLintSetting() {
        // When
        ConfigField withLint = BackOffFields.intervalFields(false, true, null).get(2);
        ConfigField withoutLint = BackOffFields.intervalFields(false, false, null).get(2);
        ConfigField unbounded = BackOffFields.intervalFields(true, true, null).get(2);

        // Then
        assertThat(withLint.rules()).hasSize(1);
        assertThat(withLint.rules().get(0).check(TextNode.valueOf("0s"))).isPresent();
        assertThat(withLint.rules().get(0).check(TextNode.valueOf("1m"))).isEmpty();
        assertThat(withoutLint.rules()).isEmpty();
        assertThat(unbounded.rules()).isEmpty();
        assertThat(withoutLint.description()).isEqualTo(withLint.description());
    }
}
