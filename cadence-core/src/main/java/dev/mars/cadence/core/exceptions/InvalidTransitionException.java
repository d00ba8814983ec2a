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

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Thrown when a task or workflow is asked to move to a status its transition table forbids.
 *
 * <p>Carries the entity identifier, the current and requested states, and the states that
 * would have been legal, so the message alone explains the rejection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InvalidTransitionException extends CadenceException {

    private final String entityId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;
    private final Collection<? extends Enum<?>> validTransitions;

    public InvalidTransitionException(String entityId, Enum<?> currentState,
                                      Enum<?> requestedState, Collection<? extends Enum<?>> validTransitions) {
        super(String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
                entityId, currentState, requestedState, formatTransitions(validTransitions)));
        this.entityId = entityId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTransitions = validTransitions;
    }

    public String getEntityId() {
        return entityId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    public Collection<? extends Enum<?>> getValidTransitions() {
        return validTransitions;
    }

    private static String formatTransitions(Collection<? extends Enum<?>> transitions) {
        if (transitions == null || transitions.isEmpty()) {
            return "[]";
        }
        return transitions.stream()
                .map(Enum::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
