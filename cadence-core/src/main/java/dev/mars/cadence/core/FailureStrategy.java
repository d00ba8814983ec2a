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
 * Decides how the failures of a stage's tasks turn into the stage outcome.
 *
 * <ul>
 *   <li>{@link #CONTINUE_ON_ERROR} - the stage always reports success; failures stay on the tasks.</li>
 *   <li>{@link #STOP_ON_ERROR} - a sequential stage aborts at its first failed task and the
 *       workflow halts; a parallel stage still joins every launched task.</li>
 *   <li>{@link #RETRY_FAILED} - the stage re-passes over tasks whose dependencies were recorded
 *       after the first pass; it reports failure if any task failed but never halts the workflow.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum FailureStrategy {

    CONTINUE_ON_ERROR("continue_on_error"),

    STOP_ON_ERROR("stop_on_error"),

    RETRY_FAILED("retry_failed");

    private final String value;

    FailureStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return {@code true} if a failed stage under this strategy halts the whole workflow
     */
    public boolean haltsWorkflow() {
        return this == STOP_ON_ERROR;
    }

    /**
     * Parses a strategy from its configuration name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FailureStrategy fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            for (FailureStrategy strategy : values()) {
                if (strategy.value.equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown failure strategy: " + value
                + " (expected continue_on_error, stop_on_error or retry_failed)");
    }
}
