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
package org.tarik.conf.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.tarik.conf.exceptions.ConfigFieldException;
import org.tarik.conf.utils.DurationLiterals;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Optional.empty;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.INVALID_VALUE;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.MISSING;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.WRONG_TYPE;

/**
 * Read-only accessor of a config tree. Values are looked up by a path of field names relative to the root of this
 * accessor, errors always name the full path of the field.
 * <p>
 * The underlying tree is never modified, so a single instance can be read from any number of threads.
 */
public class ParsedConfig {
    private final JsonNode root;
    private final List<String> basePath;

    ParsedConfig(@NotNull JsonNode root, @NotNull List<String> basePath) {
        this.root = checkNotNull(root, "Config tree must not be null").deepCopy();
        this.basePath = ImmutableList.copyOf(basePath);
    }

    /**
     * Wraps an already resolved config tree. No defaults are applied and no type checks are done before values are
     * accessed, see {@link ConfigSpec#parse(JsonNode)} for that.
     */
    public static ParsedConfig of(@NotNull JsonNode root) {
        return new ParsedConfig(root, List.of());
    }

    public boolean contains(@NotNull String... path) {
        return find(path).isPresent();
    }

    /**
     * @return an accessor rooted at the object under the given path
     */
    public ParsedConfig namespace(@NotNull String... path) {
        JsonNode node = get(path);
        if (!node.isObject()) {
            throw wrongType(path, "an object", node);
        }
        return new ParsedConfig(node, fullPath(path));
    }

    public String fieldString(@NotNull String... path) {
        JsonNode node = get(path);
        if (!node.isTextual()) {
            throw wrongType(path, "a string", node);
        }
        return node.textValue();
    }

    public long fieldInt(@NotNull String... path) {
        JsonNode node = get(path);
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw wrongType(path, "an integer", node);
        }
        return node.longValue();
    }

    public boolean fieldBool(@NotNull String... path) {
        JsonNode node = get(path);
        if (!node.isBoolean()) {
            throw wrongType(path, "a bool", node);
        }
        return node.booleanValue();
    }

    public Duration fieldDuration(@NotNull String... path) {
        JsonNode node = get(path);
        if (!node.isTextual()) {
            throw wrongType(path, "a duration string", node);
        }
        try {
            return DurationLiterals.parse(node.textValue());
        } catch (IllegalArgumentException e) {
            throw new ConfigFieldException(fullPath(path), INVALID_VALUE,
                    "failed to parse as a duration: %s".formatted(e.getMessage()), e);
        }
    }

    public List<String> getBasePath() {
        return basePath;
    }

    private JsonNode get(String... path) {
        return find(path).orElseThrow(() -> new ConfigFieldException(fullPath(path), MISSING,
                "was not found in the config"));
    }

    private Optional<JsonNode> find(String... path) {
        JsonNode current = root;
        for (String segment : path) {
            if (!current.isObject()) {
                return empty();
            }
            current = current.get(segment);
            if (current == null || current.isNull()) {
                return empty();
            }
        }
        return Optional.of(current);
    }

    private List<String> fullPath(String... path) {
        return ImmutableList.<String>builder().addAll(basePath).add(path).build();
    }

    private ConfigFieldException wrongType(String[] path, String expected, JsonNode actual) {
        return new ConfigFieldException(fullPath(path), WRONG_TYPE,
                "expected %s, got %s".formatted(expected, actual.getNodeType().name().toLowerCase(Locale.ROOT)));
    }
}
