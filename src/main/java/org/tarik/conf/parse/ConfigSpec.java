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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.conf.SchemaConfig;
import org.tarik.conf.exceptions.ConfigFieldException;
import org.tarik.conf.exceptions.ConfigFieldException.Reason;
import org.tarik.conf.schema.ConfigField;
import org.tarik.conf.schema.FieldRule;
import org.tarik.conf.schema.SchemaDocs;
import org.tarik.conf.utils.DurationLiterals;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Optional.empty;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.INVALID_VALUE;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.MISSING;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.RULE_VIOLATION;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.UNKNOWN_FIELD;
import static org.tarik.conf.exceptions.ConfigFieldException.Reason.WRONG_TYPE;
import static org.tarik.conf.schema.FieldType.DURATION;
import static org.tarik.conf.schema.FieldType.OBJECT;
import static org.tarik.conf.utils.CommonUtils.readClasspathResource;
import static org.tarik.conf.utils.CommonUtils.toDottedPath;

/**
 * A config schema composed of top-level fields. It resolves raw config trees into {@link ParsedConfig} instances by
 * applying declared defaults, checking value types and running field rules.
 * <p>
 * Parsing stops at the first problem, while linting reports all of them.
 */
public class ConfigSpec {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigSpec.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final List<ConfigField> fields;

    private ConfigSpec(List<ConfigField> fields) {
        var names = new HashSet<String>();
        for (ConfigField field : fields) {
            checkArgument(names.add(field.name()), "Duplicate top-level field '%s' in config spec", field.name());
        }
        this.fields = ImmutableList.copyOf(fields);
    }

    public static ConfigSpec of(@NotNull ConfigField... fields) {
        return new ConfigSpec(List.of(fields));
    }

    public static ConfigSpec of(@NotNull List<ConfigField> fields) {
        return new ConfigSpec(fields);
    }

    public List<ConfigField> getFields() {
        return fields;
    }

    public ConfigSpec withField(@NotNull ConfigField field) {
        return new ConfigSpec(ImmutableList.<ConfigField>builder().addAll(fields).add(field).build());
    }

    public ParsedConfig parse(@NotNull JsonNode raw) {
        try {
            ObjectNode resolved = resolveObject(fields, raw, List.of(), new FailFastSink());
            LOG.debug("Parsed config with {} top-level field(s)", resolved.size());
            return new ParsedConfig(resolved, List.of());
        } catch (ConfigFieldException e) {
            LOG.warn("Config is invalid: {}", e.getMessage());
            throw e;
        }
    }

    public ParsedConfig parseJson(@NotNull String json) {
        return parse(readTree(JSON_MAPPER, json, "JSON"));
    }

    public ParsedConfig parseYaml(@NotNull String yaml) {
        return parse(readTree(YAML_MAPPER, yaml, "YAML"));
    }

    /**
     * Parses a classpath resource, treating {@code .json} files as JSON and everything else as YAML.
     */
    public ParsedConfig parseResource(@NotNull String resourcePath) {
        var content = readClasspathResource(resourcePath);
        LOG.info("Parsing config from resource '{}'", resourcePath);
        return resourcePath.endsWith(".json") ? parseJson(content) : parseYaml(content);
    }

    public List<LintIssue> lint(@NotNull JsonNode raw) {
        var sink = new CollectingSink();
        resolveObject(fields, raw, List.of(), sink);
        if (!sink.issues.isEmpty()) {
            LOG.debug("Linting found {} issue(s)", sink.issues.size());
        }
        return List.copyOf(sink.issues);
    }

    public List<LintIssue> lintYaml(@NotNull String yaml) {
        return lint(readTree(YAML_MAPPER, yaml, "YAML"));
    }

    public String renderDocs() {
        return SchemaDocs.toPrettyJson(fields);
    }

    // -----------------------------------------------------
    // Private methods
    private static JsonNode readTree(ObjectMapper mapper, String content, String format) {
        try {
            JsonNode tree = mapper.readTree(content);
            return tree == null || tree.isMissingNode() ? MissingNode.getInstance() : tree;
        } catch (JsonProcessingException e) {
            throw new ConfigFieldException(List.of(), INVALID_VALUE,
                    "config is not valid %s: %s".formatted(format, e.getOriginalMessage()), e);
        }
    }

    private ObjectNode resolveObject(List<ConfigField> declaredFields, @Nullable JsonNode raw, List<String> path,
                                     IssueSink sink) {
        ObjectNode resolved = JSON_MAPPER.createObjectNode();
        if (raw != null && !raw.isMissingNode() && !raw.isNull() && !raw.isObject()) {
            sink.report(path, WRONG_TYPE, "expected an object, got %s".formatted(typeName(raw)), null);
            return resolved;
        }
        boolean hasValues = raw != null && raw.isObject();
        for (ConfigField field : declaredFields) {
            var fieldPath = append(path, field.name());
            JsonNode value = hasValues ? raw.get(field.name()) : null;
            if (value != null && value.isNull()) {
                value = null;
            }
            resolveField(field, value, fieldPath, sink).ifPresent(node -> resolved.set(field.name(), node));
        }
        if (hasValues && sink.reportsUnknownFields()) {
            raw.fieldNames().forEachRemaining(name -> {
                if (declaredFields.stream().noneMatch(field -> field.name().equals(name))) {
                    sink.report(append(path, name), UNKNOWN_FIELD, "is not declared in the config spec", null);
                }
            });
        }
        return resolved;
    }

    private Optional<JsonNode> resolveField(ConfigField field, @Nullable JsonNode value, List<String> path,
                                            IssueSink sink) {
        if (field.type() == OBJECT) {
            if (value == null && field.optional()) {
                return empty();
            }
            if (value != null && !value.isObject()) {
                sink.report(path, WRONG_TYPE, "expected an object, got %s".formatted(typeName(value)), null);
                return empty();
            }
            // An absent object resolves to its children defaults
            ObjectNode resolved = resolveObject(field.children(), value, path, sink);
            return applyRules(field, resolved, path, sink);
        }

        JsonNode resolvedValue = value;
        if (resolvedValue == null) {
            if (field.hasDefault()) {
                resolvedValue = field.defaultValue();
                if (SchemaConfig.isDefaultsLoggingEnabled()) {
                    LOG.debug("Using default value {} for field '{}'", resolvedValue, toDottedPath(path));
                }
            } else if (field.optional()) {
                return empty();
            } else {
                sink.report(path, MISSING, "is required but was not provided", null);
                return empty();
            }
        }
        if (!isOfDeclaredType(field, resolvedValue, path, sink)) {
            return empty();
        }
        return applyRules(field, resolvedValue, path, sink);
    }

    private static boolean isOfDeclaredType(ConfigField field, JsonNode value, List<String> path, IssueSink sink) {
        boolean typeMatches = switch (field.type()) {
            case STRING, DURATION -> value.isTextual();
            case INT -> value.isIntegralNumber() && value.canConvertToLong();
            case BOOL -> value.isBoolean();
            case OBJECT -> value.isObject();
        };
        if (!typeMatches) {
            sink.report(path, WRONG_TYPE, "expected a %s, got %s".formatted(field.type().getDisplayName(),
                    typeName(value)), null);
            return false;
        }
        if (field.type() == DURATION) {
            try {
                DurationLiterals.parse(value.textValue());
            } catch (IllegalArgumentException e) {
                sink.report(path, INVALID_VALUE, "failed to parse as a duration: %s".formatted(e.getMessage()), e);
                return false;
            }
        }
        return true;
    }

    private static Optional<JsonNode> applyRules(ConfigField field, JsonNode value, List<String> path,
                                                 IssueSink sink) {
        boolean valid = true;
        for (FieldRule rule : field.rules()) {
            Optional<String> violation = rule.check(value);
            if (violation.isPresent()) {
                sink.report(path, RULE_VIOLATION, violation.get(), null);
                valid = false;
            }
        }
        return valid ? Optional.of(value) : empty();
    }

    private static List<String> append(List<String> path, String name) {
        return ImmutableList.<String>builder().addAll(path).add(name).build();
    }

    private static String typeName(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private interface IssueSink {
        void report(List<String> path, Reason reason, String message, @Nullable Throwable cause);

        boolean reportsUnknownFields();
    }

    private static class FailFastSink implements IssueSink {
        @Override
        public void report(List<String> path, Reason reason, String message, @Nullable Throwable cause) {
            throw cause == null
                    ? new ConfigFieldException(path, reason, message)
                    : new ConfigFieldException(path, reason, message, cause);
        }

        @Override
        public boolean reportsUnknownFields() {
            return false;
        }
    }

    private static class CollectingSink implements IssueSink {
        private final List<LintIssue> issues = new ArrayList<>();

        @Override
        public void report(List<String> path, Reason reason, String message, @Nullable Throwable cause) {
            issues.add(new LintIssue(path, reason, message));
        }

        @Override
        public boolean reportsUnknownFields() {
            return true;
        }
    }
}
