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
package org.tarik.conf.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tarik.conf.schema.ConfigFields.newBoolField;
import static org.tarik.conf.schema.ConfigFields.newDurationField;
import static org.tarik.conf.schema.ConfigFields.newObjectField;

class SchemaDocsTest {

    @Test
    void toJsonNode_shouldRenderNestedDeclarations() {
        // Given
        ConfigField field = newObjectField("retry",
                newBoolField("enabled").withDescription("Enables retries.").withDefault(false),
                newDurationField("delay").withDefault("1s").withExample("50ms").withExample("2s").asAdvanced())
                .withDescription("Retry settings.");

        // When
        JsonNode docs = SchemaDocs.toJsonNode(field);

        // Then
        assertThat(docs.get("name").asText()).isEqualTo("retry");
        assertThat(docs.get("type").asText()).isEqualTo("object");
        assertThat(docs.get("description").asText()).isEqualTo("Retry settings.");
        assertThat(docs.has("default")).isFalse();
        JsonNode children = docs.get("children");
        assertThat(children).hasSize(2);
        assertThat(children.get(0).get("default").booleanValue()).isFalse();
        assertThat(children.get(1).get("type").asText()).isEqualTo("duration");
        assertThat(children.get(1).get("default").asText()).isEqualTo("1s");
        assertThat(children.get(1).get("examples")).extracting(JsonNode::asText).containsExactly("50ms", "2s");
        assertThat(children.get(1).get("advanced").booleanValue()).isTrue();
    }

    @Test
    void toPrettyJson_shouldProduceParsableArray() throws Exception {
        // When
        String json = SchemaDocs.toPrettyJson(List.of(newDurationField("a"), newDurationField("b")));

        // Then
        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.isArray()).isTrue();
        assertThat(parsed).extracting(node -> node.get("name").asText()).containsExactly("a", "b");
    }

    @Test
    void shouldBeANonInstantiableUtility() throws Exception {
        assertThat(SchemaDocs.class).isFinal();
        assertThat(Modifier.isPrivate(SchemaDocs.class.getDeclaredConstructor().getModifiers())).isTrue();
    }
}
