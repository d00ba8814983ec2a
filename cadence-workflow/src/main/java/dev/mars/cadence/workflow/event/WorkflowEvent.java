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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A published event: its type, its payload and the instant it was published.
 *
 * <p>The payload keeps insertion order and may hold {@code null} values (an absent result,
 * for instance).</p>
 */
public final class WorkflowEvent {

    private final String type;
    private final Map<String, Object> payload;
    private final Instant publishedAt;

    public WorkflowEvent(String type, Map<String, Object> payload, Instant publishedAt) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        this.publishedAt = Objects.requireNonNull(publishedAt, "Publish time cannot be null");
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Object get(String key) {
        return payload.get(key);
    }

    public String getString(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    @Override
    public String toString() {
        return "WorkflowEvent{type='" + type + "', payload=" + payload + '}';
    }
}
