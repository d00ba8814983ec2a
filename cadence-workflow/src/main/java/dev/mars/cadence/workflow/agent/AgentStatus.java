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

package dev.mars.cadence.workflow.agent;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operational state of an agent.
 *
 * <p>Only {@code ACTIVE} agents accept new work. The other two states keep the agent registered
 * but make {@link AbstractAgent#healthCheck()} fail, so selection passes over them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum AgentStatus {

    /** Agent is available for work. */
    ACTIVE("active", "Agent is available for work", true),

    /** Agent is stopped and will not accept work. */
    INACTIVE("inactive", "Agent is inactive", false),

    /** Agent is in planned maintenance and will not accept work. */
    MAINTENANCE("maintenance", "Agent is in maintenance mode", false);

    private final String value;
    private final String description;
    private final boolean availableForWork;

    AgentStatus(String value, String description, boolean availableForWork) {
        this.value = value;
        this.description = description;
        this.availableForWork = availableForWork;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAvailableForWork() {
        return availableForWork;
    }
}
