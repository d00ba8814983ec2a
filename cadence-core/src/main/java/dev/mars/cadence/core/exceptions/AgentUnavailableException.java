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

package dev.mars.cadence.core.exceptions;

import dev.mars.cadence.core.Capability;
import dev.mars.cadence.core.FailureKind;

/**
 * Thrown when no registered agent of the required capability passes its health check.
 */
public class AgentUnavailableException extends TaskFailureException {

    private final Capability capability;

    public AgentUnavailableException(String taskId, Capability capability) {
        super(taskId, "No available agent for capability " + capability);
        this.capability = capability;
    }

    public Capability getCapability() {
        return capability;
    }

    @Override
    public FailureKind getFailureKind() {
        return FailureKind.AGENT_UNAVAILABLE;
    }
}
