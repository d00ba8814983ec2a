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

import dev.mars.cadence.core.Capability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for AgentRegistry registration and first-healthy selection.
 */
class AgentRegistryTest {

    @Mock
    private Agent primaryCoder;

    @Mock
    private Agent backupCoder;

    @Mock
    private Agent tester;

    private AgentRegistry registry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        stubAgent(primaryCoder, "coder-1", Capability.CODE_GENERATION);
        stubAgent(backupCoder, "coder-2", Capability.CODE_GENERATION);
        stubAgent(tester, "tester-1", Capability.TESTING);
        registry = new AgentRegistry();
    }

    private static void stubAgent(Agent agent, String id, Capability capability) {
        when(agent.getAgentId()).thenReturn(id);
        when(agent.getCapability()).thenReturn(capability);
    }

    @Test
    void testSelectsFirstHealthyAgentInRegistrationOrder() {
        when(primaryCoder.healthCheck()).thenReturn(true);
        when(backupCoder.healthCheck()).thenReturn(true);
        registry.register(primaryCoder);
        registry.register(backupCoder);

        assertEquals(Optional.of(primaryCoder), registry.selectAgent(Capability.CODE_GENERATION));
        verify(backupCoder, never()).healthCheck();
    }

    @Test
    void testSkipsUnhealthyAgents() {
        when(primaryCoder.healthCheck()).thenReturn(false);
        when(backupCoder.healthCheck()).thenReturn(true);
        registry.register(primaryCoder);
        registry.register(backupCoder);

        assertEquals(Optional.of(backupCoder), registry.selectAgent(Capability.CODE_GENERATION));
    }

    @Test
    void testNoHealthyAgentYieldsEmpty() {
        when(primaryCoder.healthCheck()).thenReturn(false);
        registry.register(primaryCoder);

        assertTrue(registry.selectAgent(Capability.CODE_GENERATION).isEmpty());
        assertTrue(registry.selectAgent(Capability.DEPLOYMENT).isEmpty());
    }

    @Test
    void testDuplicateAgentIdRejected() {
        registry.register(primaryCoder);

        Agent impostor = mock(Agent.class);
        stubAgent(impostor, "coder-1", Capability.TESTING);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.register(impostor));
        assertEquals("Agent already registered: coder-1", e.getMessage());
        assertEquals(1, registry.size());
        assertTrue(registry.getAgents(Capability.TESTING).isEmpty());
    }

    @Test
    void testUnregister() {
        registry.register(primaryCoder);
        registry.register(tester);

        assertTrue(registry.unregister("coder-1"));
        assertFalse(registry.unregister("coder-1"));
        assertFalse(registry.unregister("unknown"));

        assertTrue(registry.getAgent("coder-1").isEmpty());
        assertEquals(Set.of(Capability.TESTING), registry.getCapabilities());
        assertTrue(registry.selectAgent(Capability.CODE_GENERATION).isEmpty());
    }

    @Test
    void testLookups() {
        registry.register(primaryCoder);
        registry.register(backupCoder);
        registry.register(tester);

        assertEquals(3, registry.size());
        assertEquals(List.of(primaryCoder, backupCoder), registry.getAgents(Capability.CODE_GENERATION));
        assertEquals(List.of(primaryCoder, backupCoder, tester), registry.getAllAgents());
        assertEquals(Optional.of(tester), registry.getAgent("tester-1"));
        assertThrows(UnsupportedOperationException.class, () -> registry.getAllAgents().add(tester));
    }

    @Test
    void testRegisterRejectsNull() {
        assertThrows(NullPointerException.class, () -> registry.register(null));
    }
}
