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

import org.jetbrains.annotations.Nullable;

import static org.tarik.conf.utils.DurationLiterals.format;

/**
 * Default values of the interval fields of a back-off declaration, as duration literals.
 */
public record BackOffDefaults(String initialInterval, String maxInterval, String maxElapsedTime) {
    static final String FALLBACK_INITIAL_INTERVAL = "500ms";
    static final String FALLBACK_MAX_INTERVAL = "10s";
    static final String FALLBACK_MAX_ELAPSED_TIME = "1m";

    /**
     * Renders the intervals of the given template, or falls back to one minute of retry attempts starting at 500ms
     * intervals when no template is given.
     */
    public static BackOffDefaults resolve(@Nullable ExponentialBackOff template) {
        if (template == null) {
            return new BackOffDefaults(FALLBACK_INITIAL_INTERVAL, FALLBACK_MAX_INTERVAL, FALLBACK_MAX_ELAPSED_TIME);
        }
        return new BackOffDefaults(format(template.initialInterval()), format(template.maxInterval()),
                format(template.maxElapsedTime()));
    }
}
