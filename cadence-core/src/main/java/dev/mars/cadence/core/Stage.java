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

import java.util.List;
import java.util.Objects;

/**
 * A group of tasks sharing an execution mode and a failure strategy.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class Stage {

    private final String name;
    private final List<Task> tasks;
    private final boolean parallel;
    private final FailureStrategy failureStrategy;

    public Stage(String name, List<Task> tasks, boolean parallel, FailureStrategy failureStrategy) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Stage name is required");
        }
        this.name = name;
        this.tasks = tasks != null ? List.copyOf(tasks) : List.of();
        this.parallel = parallel;
        this.failureStrategy = Objects.requireNonNull(failureStrategy, "Failure strategy cannot be null");
    }

    /**
     * Sequential stop-on-error stage, the most conservative combination.
     */
    public static Stage sequential(String name, Task... tasks) {
        return new Stage(name, List.of(tasks), false, FailureStrategy.STOP_ON_ERROR);
    }

    /**
     * Parallel stop-on-error stage.
     */
    public static Stage parallel(String name, Task... tasks) {
        return new Stage(name, List.of(tasks), true, FailureStrategy.STOP_ON_ERROR);
    }

    public String getName() {
        return name;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    public boolean isParallel() {
        return parallel;
    }

    public FailureStrategy getFailureStrategy() {
        return failureStrategy;
    }

    @Override
    public String toString() {
        return "Stage{" +
               "name='" + name + '\'' +
               ", tasks=" + tasks.size() +
               ", parallel=" + parallel +
               ", failureStrategy=" + failureStrategy +
               '}';
    }
}
