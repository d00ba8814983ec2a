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

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous {@link EventBus} backed by copy-on-write listener lists.
 *
 * <p>Publishing iterates a snapshot of the listener list, so listeners may subscribe or cancel
 * from inside a callback, and several threads may publish at once (parallel stages do).</p>
 *
 * <p>A listener that throws a {@code RuntimeException} or {@code AssertionError} is logged and
 * skipped. Other errors propagate to the publisher.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger logger = Logger.getLogger(InMemoryEventBus.class.getName());

    private final Map<String, List<EventListener>> listeners = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryEventBus() {
        this(Clock.systemUTC());
    }

    public InMemoryEventBus(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public Subscription subscribe(String eventType, EventListener listener) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(listener, "Listener cannot be null");

        List<EventListener> typeListeners = listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
        typeListeners.add(listener);
        logger.fine("Subscribed listener to " + eventType);

        return () -> typeListeners.remove(listener);
    }

    @Override
    public void publish(String eventType, Map<String, Object> payload) {
        List<EventListener> typeListeners = listeners.get(eventType);
        if (typeListeners == null || typeListeners.isEmpty()) {
            return;
        }

        WorkflowEvent event = new WorkflowEvent(eventType, payload, clock.instant());
        for (EventListener listener : typeListeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException | AssertionError e) {
                logger.log(Level.SEVERE, "Error in event listener for " + eventType + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Event listener exception details for: " + eventType, e);
                }
            }
        }
    }

    @Override
    public int getSubscriberCount(String eventType) {
        List<EventListener> typeListeners = listeners.get(eventType);
        return typeListeners != null ? typeListeners.size() : 0;
    }
}
