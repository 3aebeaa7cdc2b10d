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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Optional.ofNullable;
import static org.tarik.conf.utils.CommonUtils.isNotBlank;

/**
 * Immutable declaration of a single config field.
 * <p>
 * All {@code with*} methods return a new instance, the receiver is never modified. This allows the same declaration
 * to be embedded into any number of schemas and to be shared between threads.
 *
 * @param name         Name of the field within its parent object.
 * @param type         Value type of the field.
 * @param description  Human-readable description, may be empty.
 * @param defaultValue Value used when the field is absent, or {@code null} if the field has no default.
 * @param examples     Illustrative example values, in declaration order.
 * @param children     Child fields, only allowed for {@link FieldType#OBJECT} fields.
 * @param optional     Whether the field may be absent even though it has no default.
 * @param advanced     Whether the field is hidden from basic documentation.
 * @param rules        Checks applied to the resolved value.
 */
public record ConfigField(
        @NotNull String name,
        @NotNull FieldType type,
        @NotNull String description,
        @Nullable JsonNode defaultValue,
        @NotNull List<String> examples,
        @NotNull List<ConfigField> children,
        boolean optional,
        boolean advanced,
        @NotNull List<FieldRule> rules) {

    public ConfigField {
        checkArgument(isNotBlank(name), "Config field name must not be blank");
        checkNotNull(type, "Type of the config field '%s' must be provided", name);
        checkNotNull(description, "Description of the config field '%s' must not be null", name);
        examples = ImmutableList.copyOf(examples);
        children = ImmutableList.copyOf(children);
        rules = ImmutableList.copyOf(rules);
        defaultValue = defaultValue == null ? null : defaultValue.deepCopy();
        checkArgument(type == FieldType.OBJECT || children.isEmpty(),
                "Only object fields can have children, but '%s' is of type %s", name, type);
        var childNames = new HashSet<String>();
        for (ConfigField child : children) {
            checkArgument(childNames.add(child.name()), "Duplicate child field '%s' in object field '%s'",
                    child.name(), name);
        }
    }

    ConfigField(@NotNull String name, @NotNull FieldType type, @NotNull List<ConfigField> children) {
        this(name, type, "", null, List.of(), children, false, false, List.of());
    }

    public ConfigField withDescription(@NotNull String newDescription) {
        return new ConfigField(name, type, newDescription, defaultValue, examples, children, optional, advanced,
                rules);
    }

    /**
     * Appends the given sentence to the current description, separated by a single space.
     */
    public ConfigField appendDescription(@NotNull String sentence) {
        var newDescription = description.isEmpty() ? sentence : description + " " + sentence;
        return withDescription(newDescription);
    }

    public ConfigField withDefault(@NotNull String value) {
        return withDefault(JsonNodeFactory.instance.textNode(value));
    }

    public ConfigField withDefault(boolean value) {
        return withDefault(JsonNodeFactory.instance.booleanNode(value));
    }

    public ConfigField withDefault(long value) {
        return withDefault(JsonNodeFactory.instance.numberNode(value));
    }

    public ConfigField withDefault(@NotNull JsonNode value) {
        return new ConfigField(name, type, description, value, examples, children, optional, advanced, rules);
    }

    public ConfigField withExample(@NotNull String example) {
        var newExamples = ImmutableList.<String>builder().addAll(examples).add(example).build();
        return new ConfigField(name, type, description, defaultValue, newExamples, children, optional, advanced,
                rules);
    }

    public ConfigField withRule(@NotNull FieldRule rule) {
        var newRules = ImmutableList.<FieldRule>builder().addAll(rules).add(rule).build();
        return new ConfigField(name, type, description, defaultValue, examples, children, optional, advanced,
                newRules);
    }

    public ConfigField asOptional() {
        return new ConfigField(name, type, description, defaultValue, examples, children, true, advanced, rules);
    }

    public ConfigField asAdvanced() {
        return new ConfigField(name, type, description, defaultValue, examples, children, optional, true, rules);
    }

    /**
     * @return a copy of the default value, or {@code null} if the field has none
     */
    @Override
    @Nullable
    public JsonNode defaultValue() {
        return defaultValue == null ? null : defaultValue.deepCopy();
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Optional<JsonNode> findDefault() {
        return ofNullable(defaultValue());
    }

    public Optional<ConfigField> findChild(@NotNull String childName) {
        return children.stream()
                .filter(child -> child.name().equals(childName))
                .findFirst();
    }
}
