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

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parameters of an exponential back-off policy used for timing retry attempts. Executing retries is up to the
 * consumer of this value.
 *
 * @param initialInterval     Initial period to wait between retry attempts.
 * @param randomizationFactor Jitter applied to each computed interval, e.g. 0.5 means ±50%.
 * @param multiplier          Factor by which the interval grows after each attempt.
 * @param maxInterval         Upper bound of the period between retry attempts.
 * @param maxElapsedTime      Overall period after which retrying stops. Zero means no limit.
 */
public record ExponentialBackOff(
        @NotNull Duration initialInterval,
        double randomizationFactor,
        double multiplier,
        @NotNull Duration maxInterval,
        @NotNull Duration maxElapsedTime) {

    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(500);
    public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5;
    public static final double DEFAULT_MULTIPLIER = 1.5;
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_MAX_ELAPSED_TIME = Duration.ofMinutes(15);

    public ExponentialBackOff {
        checkNotNull(initialInterval, "Initial interval must not be null");
        checkNotNull(maxInterval, "Max interval must not be null");
        checkNotNull(maxElapsedTime, "Max elapsed time must not be null");
    }

    public static ExponentialBackOff defaults() {
        return new ExponentialBackOff(DEFAULT_INITIAL_INTERVAL, DEFAULT_RANDOMIZATION_FACTOR, DEFAULT_MULTIPLIER,
                DEFAULT_MAX_INTERVAL, DEFAULT_MAX_ELAPSED_TIME);
    }

    public ExponentialBackOff withInitialInterval(@NotNull Duration interval) {
        return new ExponentialBackOff(interval, randomizationFactor, multiplier, maxInterval, maxElapsedTime);
    }

    public ExponentialBackOff withMaxInterval(@NotNull Duration interval) {
        return new ExponentialBackOff(initialInterval, randomizationFactor, multiplier, interval, maxElapsedTime);
    }

    public ExponentialBackOff withMaxElapsedTime(@NotNull Duration elapsedTime) {
        return new ExponentialBackOff(initialInterval, randomizationFactor, multiplier, maxInterval, elapsedTime);
    }

    public boolean isUnbounded() {
        return maxElapsedTime.isZero();
    }
}
