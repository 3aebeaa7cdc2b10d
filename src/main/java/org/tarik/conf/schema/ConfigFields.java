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

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Entry points for declaring config fields.
 */
public final class ConfigFields {

    private ConfigFields() {
    }

    public static ConfigField newStringField(@NotNull String name) {
        return new ConfigField(name, FieldType.STRING, List.of());
    }

    public static ConfigField newIntField(@NotNull String name) {
        return new ConfigField(name, FieldType.INT, List.of());
    }

    public static ConfigField newBoolField(@NotNull String name) {
        return new ConfigField(name, FieldType.BOOL, List.of());
    }

    /**
     * Declares a field holding a duration literal such as {@code 500ms}. Defaults of such fields are expected to be
     * literals as well, so that they are resolved by the same rules as user input.
     */
    public static ConfigField newDurationField(@NotNull String name) {
        return new ConfigField(name, FieldType.DURATION, List.of());
    }

    public static ConfigField newObjectField(@NotNull String name, @NotNull ConfigField... children) {
        return new ConfigField(name, FieldType.OBJECT, List.of(children));
    }

    public static ConfigField newObjectField(@NotNull String name, @NotNull List<ConfigField> children) {
        return new ConfigField(name, FieldType.OBJECT, children);
    }
}
