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

package dev.mars.cadence.workflow;

import dev.mars.cadence.core.Capability;
import dev.mars.cadence.core.Task;
import dev.mars.cadence.workflow.agent.AbstractAgent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Agent double whose behaviour per call is supplied by the test.
 */
class ScriptedAgent extends AbstractAgent {

    private final Function<Task, CompletableFuture<Map<String, Object>>> behaviour;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<String> executedTaskIds = Collections.synchronizedList(new ArrayList<>());

    ScriptedAgent(String agentId, Capability capability, int maxConcurrentTasks,
                  Function<Task, CompletableFuture<Map<String, Object>>> behaviour) {
        super(agentId, capability, maxConcurrentTasks);
        this.behaviour = behaviour;
    }

    ScriptedAgent(String agentId, Capability capability,
                  Function<Task, CompletableFuture<Map<String, Object>>> behaviour) {
        this(agentId, capability, 10, behaviour);
    }

    static ScriptedAgent succeeding(String agentId, Capability capability) {
        return new ScriptedAgent(agentId, capability,
                task -> CompletableFuture.completedFuture(Map.of("task", task.getId())));
    }

    static ScriptedAgent failing(String agentId, Capability capability, String message) {
        return new ScriptedAgent(agentId, capability,
                task -> CompletableFuture.failedFuture(new IllegalStateException(message)));
    }

    /**
     * Fails every call for the given task ids and succeeds for all others.
     */
    static ScriptedAgent failingFor(String agentId, Capability capability, Set<String> failingTaskIds) {
        return new ScriptedAgent(agentId, capability, task -> failingTaskIds.contains(task.getId())
                ? CompletableFuture.failedFuture(new IllegalStateException("Generation failed for " + task.getId()))
                : CompletableFuture.completedFuture(Map.of("task", task.getId())));
    }

    @Override
    protected CompletableFuture<Map<String, Object>> doExecute(Task task) {
        invocations.incrementAndGet();
        executedTaskIds.add(task.getId());
        return behaviour.apply(task);
    }

    int getInvocations() {
        return invocations.get();
    }

    List<String> getExecutedTaskIds() {
        synchronized (executedTaskIds) {
            return List.copyOf(executedTaskIds);
        }
    }
}
