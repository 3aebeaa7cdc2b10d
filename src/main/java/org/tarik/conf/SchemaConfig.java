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

package org.tarik.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.conf.utils.CommonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.Properties;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.empty;
import static java.util.Optional.ofNullable;

/**
 * Settings of the library itself. Each value is taken from the environment variable if set, otherwise from the
 * {@value #CONFIG_FILE} classpath resource, otherwise the built-in default is used.
 */
public class SchemaConfig {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaConfig.class);
    private static final String CONFIG_FILE = "conf-backoff.properties";
    private static final Properties properties = loadConfigPropertiesFromFile();

    public record ConfigProperty<T>(T value) {
    }

    // -----------------------------------------------------
    // Lint Config
    private static final ConfigProperty<Boolean> LINT_UNBOUNDED_BACKOFF_ENABLED = loadPropertyAsBoolean(
            "lint.unbounded.backoff.enabled", "LINT_UNBOUNDED_BACKOFF_ENABLED", "true");

    /**
     * Whether back-off fields declared without allowing unbounded retries reject a zero {@code max_elapsed_time}.
     */
    public static boolean isUnboundedBackOffLintEnabled() {
        return LINT_UNBOUNDED_BACKOFF_ENABLED.value();
    }

    // -----------------------------------------------------
    // Parse Config
    private static final ConfigProperty<Boolean> PARSE_LOG_DEFAULTS = loadPropertyAsBoolean("parse.log.defaults",
            "PARSE_LOG_DEFAULTS", "false");

    public static boolean isDefaultsLoggingEnabled() {
        return PARSE_LOG_DEFAULTS.value();
    }

    // -----------------------------------------------------
    // Private methods
    private static Properties loadConfigPropertiesFromFile() {
        var properties = new Properties();
        try (InputStream inputStream = SchemaConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                LOG.warn("Cannot find resource file '{}' in classpath, only environment variables and defaults " +
                        "will be used.", CONFIG_FILE);
                return properties;
            }
            properties.load(new InputStreamReader(inputStream, UTF_8));
            LOG.info("Loaded properties from {}", CONFIG_FILE);
            return properties;
        } catch (IOException e) {
            LOG.error("Error loading properties file {}", CONFIG_FILE, e);
            throw new UncheckedIOException(e);
        }
    }

    private static Optional<String> getProperty(String key, String envVar) {
        var envVariableOptional = ofNullable(envVar)
                .map(System::getenv)
                .map(String::trim)
                .filter(CommonUtils::isNotBlank);
        if (envVariableOptional.isPresent()) {
            LOG.info("Using environment variable '{}' for key '{}' with value '{}'", envVar, key,
                    envVariableOptional.get());
            return envVariableOptional;
        } else {
            var propertyFileValueOptional = ofNullable(properties.getProperty(key))
                    .map(String::trim)
                    .filter(CommonUtils::isNotBlank);
            if (propertyFileValueOptional.isPresent()) {
                LOG.info("Using property file value for key '{}' with value '{}'", key,
                        propertyFileValueOptional.get());
                return propertyFileValueOptional;
            } else {
                return empty();
            }
        }
    }

    private static String getProperty(String key, String envVar, String defaultValue) {
        return getProperty(key, envVar).orElseGet(() -> {
            LOG.info("Using default value for key '{}'", key);
            return defaultValue;
        });
    }

    private static ConfigProperty<Boolean> loadPropertyAsBoolean(String propertyKey, String envVar,
            String defaultValue) {
        var value = getProperty(propertyKey, envVar, defaultValue);
        Boolean parsed = CommonUtils.parseStringAsBoolean(value)
                .orElseThrow(() -> new IllegalArgumentException(
                        "The value of property '%s' is not a correct boolean value:%s".formatted(propertyKey, value)));
        return new ConfigProperty<>(parsed);
    }
}
