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

package dev.mars.cadence.core.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Task-level dependency graph of a workflow, used to reject unresolvable or cyclic
 * dependency declarations before a workflow exists.
 */
public class DependencyGraph {

    private final Map<String, Set<String>> dependencies = new LinkedHashMap<>();

    /**
     * Adds a node with its declared dependencies. Adding the same id twice merges the edges.
     */
    public void addTask(String taskId, Set<String> dependsOn) {
        dependencies.computeIfAbsent(taskId, k -> new LinkedHashSet<>()).addAll(dependsOn);
    }

    public Set<String> getTaskIds() {
        return Set.copyOf(dependencies.keySet());
    }

    public Set<String> getDependencies(String taskId) {
        return dependencies.getOrDefault(taskId, Set.of());
    }

    /**
     * Kahn's algorithm over the resolvable edges.
     *
     * @return the task ids in an order where every task follows its dependencies
     * @throws IllegalStateException if a cycle prevents a complete ordering
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String taskId : dependencies.keySet()) {
            inDegree.put(taskId, 0);
        }
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (dependencies.containsKey(dependency)) {
                    inDegree.merge(entry.getKey(), 1, Integer::sum);
                }
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((taskId, degree) -> {
            if (degree == 0) {
                queue.add(taskId);
            }
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
                if (entry.getValue().contains(current)) {
                    int remaining = inDegree.merge(entry.getKey(), -1, Integer::sum);
                    if (remaining == 0) {
                        queue.add(entry.getKey());
                    }
                }
            }
        }

        if (order.size() != dependencies.size()) {
            List<String> remaining = new ArrayList<>(dependencies.keySet());
            remaining.removeAll(order);
            throw new IllegalStateException("Circular dependency detected among tasks: " + remaining);
        }
        return order;
    }

    public boolean hasCycles() {
        try {
            topologicalOrder();
            return false;
        } catch (IllegalStateException e) {
            return true;
        }
    }

    /**
     * Reports missing dependencies, self-dependencies and cycles.
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            String taskId = entry.getKey();
            for (String dependency : entry.getValue()) {
                if (dependency.equals(taskId)) {
                    result.addError("tasks." + taskId + ".dependsOn", "Task cannot depend on itself");
                } else if (!dependencies.containsKey(dependency)) {
                    result.addError("tasks." + taskId + ".dependsOn",
                            "Dependency '" + dependency + "' not found in workflow");
                }
            }
        }
        if (hasCycles()) {
            result.addError("Circular dependencies detected between tasks");
        }
        return result;
    }

    @Override
    public String toString() {
        return "DependencyGraph{dependencies=" + dependencies + '}';
    }
}
