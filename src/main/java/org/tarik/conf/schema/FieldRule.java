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

import java.util.Optional;

/**
 * A check applied to the resolved value of a field, i.e. the user value or, if absent, the declared default.
 * The value has already passed the type check of the field.
 */
@FunctionalInterface
public interface FieldRule {

    /**
     * @return the description of the violation, or empty if the value is acceptable
     */
    Optional<String> check(JsonNode value);
}
