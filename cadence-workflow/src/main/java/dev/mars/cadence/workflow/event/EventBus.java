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

package dev.mars.cadence.workflow.event;

import java.util.Map;

/**
 * In-process publish/subscribe channel between the orchestrator and its observers.
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>Listeners of a type are called one after another, in subscription order, on the
 *       publishing thread.</li>
 *   <li>A listener that throws is logged and skipped; delivery to the remaining listeners
 *       continues and the publisher never sees the exception.</li>
 *   <li>Publishing a type nobody subscribed to does nothing.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface EventBus {

    /**
     * Registers a listener for one event type.
     *
     * @param eventType the event type, e.g. {@code "task.completed"}
     * @param listener the callback
     * @return a handle that removes the listener again
     */
    Subscription subscribe(String eventType, EventListener listener);

    /**
     * Delivers an event to every listener of its type.
     *
     * @param eventType the event type
     * @param payload event fields, copied before delivery
     */
    void publish(String eventType, Map<String, Object> payload);

    /**
     * @return number of listeners currently registered for {@code eventType}
     */
    int getSubscriberCount(String eventType);
}
