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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The kind of work a task needs and an agent provides.
 *
 * <p>Capabilities are open: the constants below cover the standard application-generation
 * pipeline, and anything else can be introduced with {@link #of(String)} and registered
 * against an agent without touching the engine.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Capability {

    private static final Pattern NAME_PATTERN = Pattern.compile("[a-z][a-z0-9_.-]*");

    public static final Capability ORCHESTRATOR = new Capability("orchestrator");
    public static final Capability REQUIREMENT_ANALYSIS = new Capability("requirement_analysis");
    public static final Capability ARCHITECTURE_PLANNING = new Capability("architecture_planning");
    public static final Capability TEMPLATE_SELECTION = new Capability("template_selection");
    public static final Capability CODE_GENERATION = new Capability("code_generation");
    public static final Capability TESTING = new Capability("testing");
    public static final Capability DEPLOYMENT = new Capability("deployment");

    private final String name;

    private Capability(String name) {
        this.name = name;
    }

    /**
     * Returns the capability with the given name.
     *
     * @param name lowercase identifier such as {@code "code_generation"}
     * @throws IllegalArgumentException if the name is blank or not a lowercase identifier
     */
    public static Capability of(String name) {
        Objects.requireNonNull(name, "Capability name cannot be null");
        String normalized = name.trim().toLowerCase();
        if (!NAME_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid capability name: '" + name + "'");
        }
        return new Capability(normalized);
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Capability) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
