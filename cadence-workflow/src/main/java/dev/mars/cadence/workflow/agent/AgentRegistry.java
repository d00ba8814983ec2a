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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Agents grouped by capability, in registration order.
 *
 * <p>Selection is a linear scan that returns the first agent whose health check passes. There
 * is no load balancing: an earlier healthy agent always wins.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class AgentRegistry {

    private static final Logger logger = Logger.getLogger(AgentRegistry.class.getName());

    private final Map<Capability, List<Agent>> agentsByCapability = new LinkedHashMap<>();
    private final Map<String, Agent> agentsById = new LinkedHashMap<>();

    /**
     * Registers an agent under its capability.
     *
     * @throws IllegalArgumentException if an agent with the same id is already registered
     */
    public synchronized void register(Agent agent) {
        Objects.requireNonNull(agent, "Agent cannot be null");
        String agentId = Objects.requireNonNull(agent.getAgentId(), "Agent ID cannot be null");
        Capability capability = Objects.requireNonNull(agent.getCapability(), "Agent capability cannot be null");

        if (agentsById.containsKey(agentId)) {
            throw new IllegalArgumentException("Agent already registered: " + agentId);
        }
        agentsById.put(agentId, agent);
        agentsByCapability.computeIfAbsent(capability, k -> new CopyOnWriteArrayList<>()).add(agent);
        logger.info("Registered agent " + agentId + " for capability " + capability);
    }

    /**
     * Removes an agent.
     *
     * @return {@code true} if the agent was registered
     */
    public synchronized boolean unregister(String agentId) {
        Agent agent = agentsById.remove(agentId);
        if (agent == null) {
            return false;
        }
        List<Agent> agents = agentsByCapability.get(agent.getCapability());
        if (agents != null) {
            agents.remove(agent);
            if (agents.isEmpty()) {
                agentsByCapability.remove(agent.getCapability());
            }
        }
        logger.info("Unregistered agent " + agentId);
        return true;
    }

    /**
     * Returns the first registered agent of {@code capability} that reports healthy.
     *
     * <p>Selection does not reserve capacity. Concurrent callers may pick the same agent; an
     * {@link AbstractAgent} rejects the calls that find it full, which fails that attempt.</p>
     */
    public Optional<Agent> selectAgent(Capability capability) {
        List<Agent> candidates;
        synchronized (this) {
            candidates = agentsByCapability.get(capability);
        }
        if (candidates == null) {
            return Optional.empty();
        }
        // health checks run outside the registry lock
        for (Agent agent : candidates) {
            if (agent.healthCheck()) {
                return Optional.of(agent);
            }
        }
        return Optional.empty();
    }

    public synchronized List<Agent> getAgents(Capability capability) {
        List<Agent> agents = agentsByCapability.get(capability);
        return agents != null ? List.copyOf(agents) : List.of();
    }

    public synchronized Optional<Agent> getAgent(String agentId) {
        return Optional.ofNullable(agentsById.get(agentId));
    }

    public synchronized Set<Capability> getCapabilities() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(agentsByCapability.keySet()));
    }

    public synchronized List<Agent> getAllAgents() {
        return Collections.unmodifiableList(new ArrayList<>(agentsById.values()));
    }

    public synchronized int size() {
        return agentsById.size();
    }
}
