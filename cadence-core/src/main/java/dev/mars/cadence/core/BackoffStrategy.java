/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.cadence.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the delay between two attempts of a task grows.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum BackoffStrategy {

    /** Every retry waits the base delay. */
    FIXED("fixed"),

    /** Retry {@code n} waits {@code base * n}. */
    LINEAR("linear"),

    /** Retry {@code n} waits {@code base * 2^(n-1)}. */
    EXPONENTIAL("exponential");

    private final String value;

    BackoffStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a strategy from its configuration name (case-insensitive).
     *
     * @param value the configured name, e.g. {@code "linear"}
     * @return the matching strategy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static BackoffStrategy fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            for (BackoffStrategy strategy : values()) {
                if (strategy.value.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown backoff strategy: " + value
                + " (expected fixed, linear or exponential)");
    }
}
