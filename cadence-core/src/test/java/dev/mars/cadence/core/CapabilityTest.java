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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityTest {

    @Test
    void ofNormalizesToLowercase() {
        assertEquals(Capability.CODE_GENERATION, Capability.of(" Code_Generation "));
        assertEquals("code_generation", Capability.of("CODE_GENERATION").getName());
    }

    @Test
    void customCapabilitiesAreValues() {
        Capability first = Capability.of("security_review");
        Capability second = Capability.of("security_review");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals("security_review", first.toString());
        assertNotEquals(Capability.TESTING, first);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "1abc", "code generation", "code/gen"})
    void rejectsInvalidNames(String name) {
        assertThrows(IllegalArgumentException.class, () -> Capability.of(name));
    }

    @Test
    void rejectsNull() {
        assertThrows(NullPointerException.class, () -> Capability.of(null));
    }
}
