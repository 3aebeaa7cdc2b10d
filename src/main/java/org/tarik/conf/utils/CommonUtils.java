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
package org.tarik.conf.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.IOUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.empty;
import static java.util.Optional.of;

public class CommonUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CommonUtils.class);

    public static Optional<String> getObjectPrettyPrinted(ObjectMapper mapper, Object object) {
        try {
            return of(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(object));
        } catch (JsonProcessingException e) {
            LOG.error("Couldn't write the provided object as a pretty string.", e);
            return empty();
        }
    }

    public static Optional<Boolean> parseStringAsBoolean(String str) {
        if (isBlank(str)) {
            return empty();
        }
        var trimmed = str.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return of(true);
        } else if (trimmed.equalsIgnoreCase("false")) {
            return of(false);
        } else {
            LOG.error("Failed to parse string as boolean: '{}'", str);
            return empty();
        }
    }

    public static boolean isBlank(String str) {
        return str == null || str.isBlank();
    }

    public static boolean isNotBlank(String str) {
        return !isBlank(str);
    }

    public static String toDottedPath(@NotNull List<String> path) {
        return path.isEmpty() ? "<root>" : String.join(".", path);
    }

    public static String readClasspathResource(@NotNull String resourcePath) {
        try (InputStream inputStream = CommonUtils.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new UncheckedIOException(new IOException("Couldn't find the resource: %s".formatted(resourcePath)));
            }
            return IOUtils.toString(inputStream, UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read the contents of the resource %s".formatted(resourcePath), e);
        }
    }
}
