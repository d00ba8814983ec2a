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

import dev.mars.cadence.config.CadenceConfiguration;
import dev.mars.cadence.core.Capability;
import dev.mars.cadence.core.Task;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Base class for agents that tracks status and load.
 *
 * <p>Subclasses implement {@link #doExecute(Task)}; {@link #execute(Task)} counts the call as
 * in flight until the returned future settles. An agent is healthy while it is
 * {@link AgentStatus#ACTIVE} and below its concurrency ceiling.</p>
 *
 * <p>The ceiling is enforced when the load slot is taken, not only by the health check: callers
 * that passed {@link #healthCheck()} together can still race for the last slot, and the loser
 * gets a future failed with {@link RejectedExecutionException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public abstract class AbstractAgent implements Agent {

    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 5;

    private static final Logger logger = Logger.getLogger(AbstractAgent.class.getName());

    private final String agentId;
    private final Capability capability;
    private final int maxConcurrentTasks;
    private final AtomicInteger currentLoad = new AtomicInteger();
    private volatile AgentStatus status = AgentStatus.ACTIVE;

    protected AbstractAgent(String agentId, Capability capability) {
        this(agentId, capability, DEFAULT_MAX_CONCURRENT_TASKS);
    }

    /**
     * Creates an agent whose concurrency ceiling comes from
     * {@link CadenceConfiguration#getAgentMaxConcurrentTasks()}.
     */
    protected AbstractAgent(String agentId, Capability capability, CadenceConfiguration configuration) {
        this(agentId, capability, configuration.getAgentMaxConcurrentTasks());
    }

    protected AbstractAgent(String agentId, Capability capability, int maxConcurrentTasks) {
        this.agentId = Objects.requireNonNull(agentId, "Agent ID cannot be null");
        this.capability = Objects.requireNonNull(capability, "Capability cannot be null");
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
        }
        this.maxConcurrentTasks = maxConcurrentTasks;
    }

    /**
     * Performs the actual work of one attempt.
     */
    protected abstract CompletableFuture<Map<String, Object>> doExecute(Task task);

    @Override
    public final CompletableFuture<Map<String, Object>> execute(Task task) {
        if (!reserveSlot()) {
            logger.fine("Agent " + agentId + " at capacity, rejecting task " + task.getId());
            return CompletableFuture.failedFuture(new RejectedExecutionException(
                    "Agent " + agentId + " is at capacity (" + maxConcurrentTasks + " tasks)"));
        }
        CompletableFuture<Map<String, Object>> result;
        try {
            result = doExecute(task);
        } catch (RuntimeException e) {
            currentLoad.decrementAndGet();
            return CompletableFuture.failedFuture(e);
        }
        if (result == null) {
            currentLoad.decrementAndGet();
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Agent " + agentId + " returned no result future"));
        }
        result.whenComplete((r, e) -> currentLoad.decrementAndGet());
        return result;
    }

    private boolean reserveSlot() {
        int load;
        do {
            load = currentLoad.get();
            if (load >= maxConcurrentTasks) {
                return false;
            }
        } while (!currentLoad.compareAndSet(load, load + 1));
        return true;
    }

    @Override
    public boolean healthCheck() {
        return status.isAvailableForWork() && currentLoad.get() < maxConcurrentTasks;
    }

    @Override
    public String getAgentId() {
        return agentId;
    }

    @Override
    public Capability getCapability() {
        return capability;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public void setStatus(AgentStatus status) {
        AgentStatus previous = this.status;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        if (previous != status) {
            logger.info("Agent " + agentId + " status changed: " + previous + " -> " + status);
        }
    }

    public int getCurrentLoad() {
        return currentLoad.get();
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
               "agentId='" + agentId + '\'' +
               ", capability=" + capability +
               ", status=" + status +
               ", load=" + currentLoad.get() + "/" + maxConcurrentTasks +
               '}';
    }
}
