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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryEventBus delivery and listener isolation.
 */
class InMemoryEventBusTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private InMemoryEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new InMemoryEventBus(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Listeners receive events in subscription order")
    void testDeliveryOrder() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(EventTypes.WORKFLOW_STARTED, event -> calls.add("first"));
        eventBus.subscribe(EventTypes.WORKFLOW_STARTED, event -> calls.add("second"));

        eventBus.publish(EventTypes.WORKFLOW_STARTED, Map.of(EventTypes.WORKFLOW_ID, "wf-1"));

        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    @DisplayName("Event carries type, payload and publish time")
    void testEventContents() {
        List<WorkflowEvent> received = new ArrayList<>();
        eventBus.subscribe(EventTypes.TASK_COMPLETED, received::add);

        eventBus.publish(EventTypes.TASK_COMPLETED, Map.of(EventTypes.TASK_ID, "analyze", EventTypes.ATTEMPTS, 2));

        assertEquals(1, received.size());
        WorkflowEvent event = received.get(0);
        assertEquals(EventTypes.TASK_COMPLETED, event.getType());
        assertEquals("analyze", event.getString(EventTypes.TASK_ID));
        assertEquals(2, event.get(EventTypes.ATTEMPTS));
        assertEquals(NOW, event.getPublishedAt());
        assertThrows(UnsupportedOperationException.class, () -> event.getPayload().put("extra", "value"));
    }

    @Test
    @DisplayName("Only listeners of the published type are notified")
    void testTypeFiltering() {
        List<WorkflowEvent> failed = new ArrayList<>();
        eventBus.subscribe(EventTypes.WORKFLOW_FAILED, failed::add);

        eventBus.publish(EventTypes.WORKFLOW_COMPLETED, Map.of());

        assertTrue(failed.isEmpty());
    }

    @Test
    @DisplayName("Publishing with no subscribers is a no-op")
    void testPublishWithoutSubscribers() {
        assertDoesNotThrow(() -> eventBus.publish("custom.event", Map.of()));
        assertEquals(0, eventBus.getSubscriberCount("custom.event"));
    }

    @Test
    @DisplayName("A throwing listener does not stop later listeners")
    void testListenerExceptionIsolated() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(EventTypes.TASK_FAILED, event -> {
            throw new IllegalStateException("listener broken");
        });
        eventBus.subscribe(EventTypes.TASK_FAILED, event -> calls.add(event.getString(EventTypes.TASK_ID)));

        assertDoesNotThrow(() -> eventBus.publish(EventTypes.TASK_FAILED, Map.of(EventTypes.TASK_ID, "deploy")));
        assertEquals(List.of("deploy"), calls);
    }

    @Test
    @DisplayName("A listener failing an assertion does not stop later listeners")
    void testListenerAssertionIsolated() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(EventTypes.TASK_COMPLETED, event -> {
            throw new AssertionError("unexpected payload");
        });
        eventBus.subscribe(EventTypes.TASK_COMPLETED, event -> calls.add(event.getString(EventTypes.TASK_ID)));

        assertDoesNotThrow(() -> eventBus.publish(EventTypes.TASK_COMPLETED, Map.of(EventTypes.TASK_ID, "build")));
        assertEquals(List.of("build"), calls);
    }

    @Test
    @DisplayName("Cancelled subscription stops delivery")
    void testCancelSubscription() {
        List<WorkflowEvent> received = new ArrayList<>();
        Subscription subscription = eventBus.subscribe(EventTypes.WORKFLOW_PAUSED, received::add);
        assertEquals(1, eventBus.getSubscriberCount(EventTypes.WORKFLOW_PAUSED));

        subscription.cancel();
        eventBus.publish(EventTypes.WORKFLOW_PAUSED, Map.of());

        assertTrue(received.isEmpty());
        assertEquals(0, eventBus.getSubscriberCount(EventTypes.WORKFLOW_PAUSED));
    }

    @Test
    @DisplayName("A listener may subscribe another listener during delivery")
    void testSubscribeDuringDelivery() {
        List<String> calls = new ArrayList<>();
        eventBus.subscribe(EventTypes.WORKFLOW_RESUMED, event -> {
            calls.add("outer");
            eventBus.subscribe(EventTypes.WORKFLOW_RESUMED, inner -> calls.add("inner"));
        });

        eventBus.publish(EventTypes.WORKFLOW_RESUMED, Map.of());
        assertEquals(List.of("outer"), calls);
        assertEquals(2, eventBus.getSubscriberCount(EventTypes.WORKFLOW_RESUMED));
    }

    @Test
    @DisplayName("Null arguments to subscribe are rejected")
    void testSubscribeRejectsNull() {
        assertThrows(NullPointerException.class, () -> eventBus.subscribe(null, event -> { }));
        assertThrows(NullPointerException.class, () -> eventBus.subscribe(EventTypes.WORKFLOW_STARTED, null));
    }
}
