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

import dev.mars.cadence.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    private static Task task(String id, String... dependsOn) {
        return Task.builder().id(id).capability(Capability.TESTING).dependsOn(dependsOn).build();
    }

    private static Workflow twoStageWorkflow() {
        return Workflow.builder()
                .id("wf-1")
                .name("Build app")
                .projectId("proj-1")
                .stage(Stage.sequential("analysis", task("a"), task("b", "a")))
                .stage(Stage.parallel("build", task("c", "b"), task("d", "b")))
                .metadata("owner", "platform")
                .build();
    }

    @Test
    void buildIndexesTasksInStageOrder() {
        Workflow workflow = twoStageWorkflow();

        assertEquals(4, workflow.getTotalTaskCount());
        assertEquals(List.of("a", "b", "c", "d"),
                workflow.getTasks().stream().map(Task::getId).collect(java.util.stream.Collectors.toList()));
        assertTrue(workflow.findTask("c").isPresent());
        assertTrue(workflow.findTask("zzz").isEmpty());
        assertEquals("platform", workflow.getMetadata().get("owner"));
        assertEquals(WorkflowStatus.PENDING, workflow.getStatus());
    }

    @Test
    void generatesIdWhenAbsent() {
        Workflow workflow = Workflow.builder().name("n").projectId("p").stage(Stage.sequential("s", task("a"))).build();
        assertNotNull(workflow.getId());
        assertFalse(workflow.getId().isBlank());
    }

    @Test
    void rejectsUnknownDependency() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Workflow.builder()
                .name("broken").projectId("p")
                .stage(Stage.sequential("s", task("a", "ghost")))
                .build());
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void rejectsDuplicateTaskIdsAcrossStages() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Workflow.builder()
                .name("dup").projectId("p")
                .stage(Stage.sequential("one", task("a")))
                .stage(Stage.sequential("two", task("a")))
                .build());
        assertTrue(e.getMessage().contains("Duplicate task id: a"));
    }

    @Test
    void rejectsCycles() {
        assertThrows(IllegalArgumentException.class, () -> Workflow.builder()
                .name("cycle").projectId("p")
                .stage(Stage.parallel("s", task("a", "b"), task("b", "a")))
                .build());
    }

    @Test
    void rejectsSelfDependency() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Workflow.builder()
                .name("self").projectId("p")
                .stage(Stage.sequential("s", task("a", "a")))
                .build());
        assertTrue(e.getMessage().contains("itself"));
    }

    @Test
    void completedTaskCountFollowsTaskStatus() throws InvalidTransitionException {
        Workflow workflow = twoStageWorkflow();
        Task a = workflow.findTask("a").orElseThrow();
        a.beginAttempt(T0);
        a.complete(null, T0);

        assertEquals(1, workflow.getCompletedTaskCount());
    }

    @Test
    void failedWorkflowKeepsFirstError() throws InvalidTransitionException {
        Workflow workflow = twoStageWorkflow();
        workflow.markStarted(T0);

        assertTrue(workflow.markFailed("Stage analysis failed", FailureKind.STAGE_FAILURE, T0));
        assertFalse(workflow.markFailed("later", FailureKind.WORKFLOW_EXECUTION_ERROR, T0));
        assertFalse(workflow.markCancelled(T0));

        assertEquals("Stage analysis failed", workflow.getErrorMessage().orElseThrow());
        assertEquals(FailureKind.STAGE_FAILURE, workflow.getFailureKind().orElseThrow());
    }

    @Test
    void cancelledWorkflowCannotComplete() throws InvalidTransitionException {
        Workflow workflow = twoStageWorkflow();
        workflow.markStarted(T0);
        assertTrue(workflow.markCancelled(T0.plusSeconds(1)));

        assertThrows(InvalidTransitionException.class, () -> workflow.markCompleted(T0.plusSeconds(2)));
        assertEquals(WorkflowStatus.CANCELLED, workflow.getStatus());
        assertEquals(T0.plusSeconds(1), workflow.getCompletedAt().orElseThrow());
    }

    @Test
    void transitionIfOnlyFiresFromExpectedStatus() throws InvalidTransitionException {
        Workflow workflow = twoStageWorkflow();
        assertFalse(workflow.transitionIf(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED));

        workflow.markStarted(T0);
        assertTrue(workflow.transitionIf(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED));
        assertFalse(workflow.transitionIf(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED));
        assertEquals(WorkflowStatus.PAUSED, workflow.getStatus());
    }

    @Test
    void awaitWhilePausedReturnsOnResume() throws Exception {
        Workflow workflow = twoStageWorkflow();
        workflow.markStarted(T0);
        workflow.transitionTo(WorkflowStatus.PAUSED);

        CountDownLatch waiting = new CountDownLatch(1);
        AtomicReference<WorkflowStatus> observed = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            waiting.countDown();
            try {
                observed.set(workflow.awaitWhilePaused());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        assertTrue(waiting.await(5, TimeUnit.SECONDS));

        workflow.transitionTo(WorkflowStatus.RUNNING);
        waiter.join(5000);

        assertFalse(waiter.isAlive());
        assertEquals(WorkflowStatus.RUNNING, observed.get());
    }
}
