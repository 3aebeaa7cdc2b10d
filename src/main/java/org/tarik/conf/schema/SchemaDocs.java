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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;

import static org.tarik.conf.utils.CommonUtils.getObjectPrettyPrinted;

/**
 * Renders field declarations as JSON documents, e.g. for generating reference docs of a config schema.
 */
public final class SchemaDocs {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SchemaDocs() {
    }

    public static ObjectNode toJsonNode(@NotNull ConfigField field) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", field.name());
        node.put("type", field.type().getDisplayName());
        node.put("description", field.description());
        field.findDefault().ifPresent(defaultValue -> node.set("default", defaultValue));
        if (!field.examples().isEmpty()) {
            var examples = node.putArray("examples");
            field.examples().forEach(examples::add);
        }
        if (field.optional()) {
            node.put("optional", true);
        }
        if (field.advanced()) {
            node.put("advanced", true);
        }
        if (!field.children().isEmpty()) {
            var children = node.putArray("children");
            field.children().forEach(child -> children.add(toJsonNode(child)));
        }
        return node;
    }

    public static String toPrettyJson(@NotNull List<ConfigField> fields) {
        var array = MAPPER.createArrayNode();
        fields.forEach(field -> array.add(toJsonNode(field)));
        return getObjectPrettyPrinted(MAPPER, array)
                .orElseThrow(() -> new IllegalStateException("Couldn't render the docs of the config schema"));
    }
}
