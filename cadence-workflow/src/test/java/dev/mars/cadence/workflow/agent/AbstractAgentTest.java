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
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AbstractAgent load tracking and health.
 */
class AbstractAgentTest {

    private static final Task TASK = Task.builder()
            .id("generate")
            .capability(Capability.CODE_GENERATION)
            .build();

    private static class StubAgent extends AbstractAgent {
        private final Function<Task, CompletableFuture<Map<String, Object>>> behaviour;

        StubAgent(int maxConcurrentTasks, Function<Task, CompletableFuture<Map<String, Object>>> behaviour) {
            super("coder-1", Capability.CODE_GENERATION, maxConcurrentTasks);
            this.behaviour = behaviour;
        }

        @Override
        protected CompletableFuture<Map<String, Object>> doExecute(Task task) {
            return behaviour.apply(task);
        }
    }

    @Test
    void testLoadHeldUntilFutureSettles() {
        CompletableFuture<Map<String, Object>> pending = new CompletableFuture<>();
        StubAgent agent = new StubAgent(1, task -> pending);

        CompletableFuture<Map<String, Object>> result = agent.execute(TASK);

        assertEquals(1, agent.getCurrentLoad());
        assertFalse(agent.healthCheck(), "agent at its ceiling is not healthy");

        pending.complete(Map.of("files", 3));
        assertEquals(0, agent.getCurrentLoad());
        assertTrue(agent.healthCheck());
        assertEquals(Map.of("files", 3), result.join());
    }

    @Test
    void testExecuteBeyondCeilingIsRejected() {
        CompletableFuture<Map<String, Object>> pending = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();
        StubAgent agent = new StubAgent(1, task -> {
            calls.incrementAndGet();
            return pending;
        });

        agent.execute(TASK);
        CompletableFuture<Map<String, Object>> rejected = agent.execute(TASK);

        ExecutionException e = assertThrows(ExecutionException.class, rejected::get);
        assertInstanceOf(RejectedExecutionException.class, e.getCause());
        assertEquals("Agent coder-1 is at capacity (1 tasks)", e.getCause().getMessage());
        assertEquals(1, calls.get());
        assertEquals(1, agent.getCurrentLoad());

        pending.complete(Map.of());
        assertEquals(0, agent.getCurrentLoad());
    }

    @Test
    void testConcurrentCallersNeverExceedCeiling() throws Exception {
        int callers = 16;
        StubAgent agent = new StubAgent(3, task -> new CompletableFuture<>());
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<CompletableFuture<Map<String, Object>>>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return agent.execute(TASK);
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<CompletableFuture<Map<String, Object>>> result : results) {
                if (!result.get(5, TimeUnit.SECONDS).isCompletedExceptionally()) {
                    accepted++;
                }
            }
            assertEquals(3, accepted);
            assertEquals(3, agent.getCurrentLoad());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testLoadReleasedOnCancellation() {
        CompletableFuture<Map<String, Object>> pending = new CompletableFuture<>();
        StubAgent agent = new StubAgent(2, task -> pending);

        agent.execute(TASK).cancel(true);

        assertEquals(0, agent.getCurrentLoad());
    }

    @Test
    void testThrowingAgentYieldsFailedFuture() {
        StubAgent agent = new StubAgent(2, task -> {
            throw new IllegalStateException("model offline");
        });

        CompletableFuture<Map<String, Object>> result = agent.execute(TASK);

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertEquals("model offline", e.getCause().getMessage());
        assertEquals(0, agent.getCurrentLoad());
    }

    @Test
    void testNullFutureYieldsFailedFuture() {
        StubAgent agent = new StubAgent(2, task -> null);

        CompletableFuture<Map<String, Object>> result = agent.execute(TASK);

        assertTrue(result.isCompletedExceptionally());
        assertEquals(0, agent.getCurrentLoad());
    }

    @Test
    void testStatusControlsHealth() {
        StubAgent agent = new StubAgent(2, task -> CompletableFuture.completedFuture(Map.of()));
        assertEquals(AgentStatus.ACTIVE, agent.getStatus());
        assertTrue(agent.healthCheck());

        agent.setStatus(AgentStatus.MAINTENANCE);
        assertFalse(agent.healthCheck());
        assertEquals("Agent is in maintenance mode", agent.getStatus().getDescription());

        agent.setStatus(AgentStatus.ACTIVE);
        assertTrue(agent.healthCheck());
    }

    @Test
    void testConcurrencyCeilingFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(CadenceConfiguration.AGENT_MAX_CONCURRENT_TASKS, "2");
        CadenceConfiguration configuration = new CadenceConfiguration(properties);

        AbstractAgent agent = new AbstractAgent("tester-1", Capability.TESTING, configuration) {
            @Override
            protected CompletableFuture<Map<String, Object>> doExecute(Task task) {
                return new CompletableFuture<>();
            }
        };

        assertEquals(2, agent.getMaxConcurrentTasks());
        agent.execute(TASK);
        assertTrue(agent.healthCheck());
        agent.execute(TASK);
        assertFalse(agent.healthCheck());
    }

    @Test
    void testInvalidCeilingRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new StubAgent(0, task -> CompletableFuture.completedFuture(Map.of())));
    }
}
