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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.conf.SchemaConfig;
import org.tarik.conf.parse.ParsedConfig;
import org.tarik.conf.schema.ConfigField;
import org.tarik.conf.schema.FieldRule;
import org.tarik.conf.utils.DurationLiterals;

import java.util.List;

import static com.google.common.collect.ObjectArrays.concat;
import static java.util.Optional.empty;
import static java.util.Optional.of;
import static org.tarik.conf.schema.ConfigFields.newBoolField;
import static org.tarik.conf.schema.ConfigFields.newDurationField;
import static org.tarik.conf.schema.ConfigFields.newObjectField;
import static org.tarik.conf.utils.CommonUtils.toDottedPath;

/**
 * Declarations of config fields describing an exponential back-off policy, and the extraction of
 * {@link ExponentialBackOff} values from configs parsed with them.
 */
public final class BackOffFields {
    private static final Logger LOG = LoggerFactory.getLogger(BackOffFields.class);

    public static final String ENABLED_FIELD = "enabled";
    public static final String INITIAL_INTERVAL_FIELD = "initial_interval";
    public static final String MAX_INTERVAL_FIELD = "max_interval";
    public static final String MAX_ELAPSED_TIME_FIELD = "max_elapsed_time";

    static final String OBJECT_DESCRIPTION = "Determine time intervals and cut offs for retry attempts.";
    static final String ENABLED_DESCRIPTION = "Whether retries should be enabled.";
    static final String INITIAL_INTERVAL_DESCRIPTION = "The initial period to wait between retry attempts.";
    static final String MAX_INTERVAL_DESCRIPTION = "The maximum period to wait between retry attempts";
    static final String MAX_ELAPSED_TIME_DESCRIPTION = "The maximum overall period of time to spend on retry " +
            "attempts before the request is aborted.";
    static final String UNBOUNDED_DESCRIPTION = "Setting this value to a zeroed duration (such as `0s`) will result " +
            "in unbounded retries.";

    private BackOffFields() {
    }

    /**
     * Declares an object field describing an exponential back-off policy. A {@link ExponentialBackOff} can be
     * extracted from the resulting parsed config with {@link #fieldBackOff(ParsedConfig, String...)}.
     *
     * @param name           name of the object field
     * @param allowUnbounded whether a zeroed {@code max_elapsed_time}, i.e. retrying forever, is acceptable. If not,
     *                       such a value is rejected while parsing unless the corresponding lint is disabled in
     *                       {@link SchemaConfig}
     * @param defaults       optional template providing the defaults of the interval fields. Without it the defaults
     *                       result in one minute of retry attempts, starting at 500ms intervals
     */
    public static ConfigField newBackOffField(@NotNull String name, boolean allowUnbounded,
                                              @Nullable ExponentialBackOff defaults) {
        return newObjectField(name, intervalFields(allowUnbounded, defaults))
                .withDescription(OBJECT_DESCRIPTION);
    }

    /**
     * Same as {@link #newBackOffField(String, boolean, ExponentialBackOff)}, with an additional {@code enabled} field
     * which is {@code false} by default. Use {@link #fieldBackOffToggled(ParsedConfig, String...)} for extraction.
     */
    public static ConfigField newBackOffToggledField(@NotNull String name, boolean allowUnbounded,
                                                     @Nullable ExponentialBackOff defaults) {
        var children = ImmutableList.<ConfigField>builder()
                .add(newBoolField(ENABLED_FIELD)
                        .withDescription(ENABLED_DESCRIPTION)
                        .withDefault(false))
                .addAll(intervalFields(allowUnbounded, defaults))
                .build();
        return newObjectField(name, children).withDescription(OBJECT_DESCRIPTION);
    }

    /**
     * Reads a back-off policy declared with {@link #newBackOffField(String, boolean, ExponentialBackOff)}. Fields are
     * read in declaration order and the first failing read is propagated as is.
     *
     * @param path path of the back-off object within the config
     * @throws org.tarik.conf.exceptions.ConfigFieldException if any of the fields is missing or invalid
     */
    public static ExponentialBackOff fieldBackOff(@NotNull ParsedConfig config, @NotNull String... path) {
        var backOff = ExponentialBackOff.defaults()
                .withInitialInterval(config.fieldDuration(concat(path, INITIAL_INTERVAL_FIELD)))
                .withMaxInterval(config.fieldDuration(concat(path, MAX_INTERVAL_FIELD)))
                .withMaxElapsedTime(config.fieldDuration(concat(path, MAX_ELAPSED_TIME_FIELD)));
        LOG.debug("Resolved back-off policy at '{}': {}", toDottedPath(List.of(path)), backOff);
        return backOff;
    }

    /**
     * Reads a back-off policy declared with {@link #newBackOffToggledField(String, boolean, ExponentialBackOff)}.
     * The {@code enabled} flag is read first, then the interval fields.
     *
     * @throws org.tarik.conf.exceptions.ConfigFieldException if any of the fields is missing or invalid
     */
    public static ToggledBackOff fieldBackOffToggled(@NotNull ParsedConfig config, @NotNull String... path) {
        boolean enabled = config.fieldBool(concat(path, ENABLED_FIELD));
        return new ToggledBackOff(fieldBackOff(config, path), enabled);
    }

    private static List<ConfigField> intervalFields(boolean allowUnbounded, @Nullable ExponentialBackOff defaults) {
        return intervalFields(allowUnbounded, SchemaConfig.isUnboundedBackOffLintEnabled(), defaults);
    }

    static List<ConfigField> intervalFields(boolean allowUnbounded, boolean boundedLintEnabled,
                                            @Nullable ExponentialBackOff defaults) {
        var resolvedDefaults = BackOffDefaults.resolve(defaults);

        var maxElapsedTime = newDurationField(MAX_ELAPSED_TIME_FIELD)
                .withDescription(MAX_ELAPSED_TIME_DESCRIPTION)
                .withDefault(resolvedDefaults.maxElapsedTime())
                .withExample("1m")
                .withExample("1h");
        if (allowUnbounded) {
            maxElapsedTime = maxElapsedTime.appendDescription(UNBOUNDED_DESCRIPTION);
        } else if (boundedLintEnabled) {
            maxElapsedTime = maxElapsedTime.withRule(boundedElapsedTimeRule());
        }

        return List.of(
                newDurationField(INITIAL_INTERVAL_FIELD)
                        .withDescription(INITIAL_INTERVAL_DESCRIPTION)
                        .withDefault(resolvedDefaults.initialInterval())
                        .withExample("50ms")
                        .withExample("1s"),
                newDurationField(MAX_INTERVAL_FIELD)
                        .withDescription(MAX_INTERVAL_DESCRIPTION)
                        .withDefault(resolvedDefaults.maxInterval())
                        .withExample("5s")
                        .withExample("1m"),
                maxElapsedTime);
    }

    private static FieldRule boundedElapsedTimeRule() {
        return value -> DurationLiterals.parse(value.textValue()).isZero()
                ? of("a zeroed duration would result in unbounded retries, which aren't allowed for this field")
                : empty();
    }
}
