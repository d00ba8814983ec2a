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
 * Lifecycle states of a single task within a workflow run.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * PENDING → RUNNING → COMPLETED
 *    ↓         ↓  ↑
 * SKIPPED   RETRYING
 *              RUNNING → FAILED (attempts exhausted)
 * </pre>
 *
 * <p>COMPLETED, FAILED and SKIPPED are terminal. A task only enters SKIPPED when the
 * stage that owns it aborts before the task was dispatched.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum TaskStatus {

    /** Declared but not yet dispatched. */
    PENDING("pending"),

    /** An attempt is in flight on an agent. */
    RUNNING("running"),

    /** The last attempt failed and the task is waiting out its backoff delay. */
    RETRYING("retrying"),

    /** An attempt succeeded within its deadline. */
    COMPLETED("completed"),

    /** Every allowed attempt failed. */
    FAILED("failed"),

    /** Never dispatched because its stage was aborted. */
    SKIPPED("skipped");

    // ── Transition table ───────────────────────────────────────────────

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<TaskStatus, Set<TaskStatus>>(TaskStatus.class);
        map.put(PENDING, EnumSet.of(RUNNING, SKIPPED));
        map.put(RUNNING, EnumSet.of(COMPLETED, RETRYING, FAILED));
        map.put(RETRYING, EnumSet.of(RUNNING));
        map.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        map.put(FAILED, EnumSet.noneOf(TaskStatus.class));
        map.put(SKIPPED, EnumSet.noneOf(TaskStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    /**
     * Checks whether a transition from this status to {@code target} is legal.
     *
     * @param target the requested status
     * @return {@code true} if the transition table allows it
     */
    public boolean canTransitionTo(TaskStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /**
     * @return the statuses reachable from this one, never {@code null}
     */
    public Set<TaskStatus> getValidTransitions() {
        return TRANSITIONS.get(this);
    }
}
