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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Enumeration of workflow execution statuses.
 *
 * <p>Transitions only move toward a terminal state, with RUNNING ⇄ PAUSED as the one
 * reversible pair.</p>
 */
public enum WorkflowStatus {

    /**
     * Workflow is built but has not been started.
     */
    PENDING("pending"),

    /**
     * Workflow is currently running.
     */
    RUNNING("running"),

    /**
     * Workflow execution has been paused.
     */
    PAUSED("paused"),

    /**
     * Workflow has completed successfully.
     */
    COMPLETED("completed"),

    /**
     * Workflow execution has failed.
     */
    FAILED("failed"),

    /**
     * Workflow execution has been cancelled.
     */
    CANCELLED("cancelled");

    private static final Map<WorkflowStatus, Set<WorkflowStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<WorkflowStatus, Set<WorkflowStatus>>(WorkflowStatus.class);
        map.put(PENDING, EnumSet.of(RUNNING, CANCELLED));
        map.put(RUNNING, EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED));
        map.put(PAUSED, EnumSet.of(RUNNING, FAILED, CANCELLED));
        map.put(COMPLETED, EnumSet.noneOf(WorkflowStatus.class));
        map.put(FAILED, EnumSet.noneOf(WorkflowStatus.class));
        map.put(CANCELLED, EnumSet.noneOf(WorkflowStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<WorkflowStatus> getValidTransitions() {
        return TRANSITIONS.get(this);
    }
}
