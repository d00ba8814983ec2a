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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StatusTransitionTest {

    @Nested
    @DisplayName("Task status")
    class TaskStatusTransitions {

        @Test
        void pendingMovesToRunningOrSkipped() {
            assertEquals(Set.of(TaskStatus.RUNNING, TaskStatus.SKIPPED), TaskStatus.PENDING.getValidTransitions());
        }

        @Test
        void runningEndsOrRetries() {
            assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED));
            assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RETRYING));
            assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED));
            assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.PENDING));
        }

        @Test
        void retryingOnlyReturnsToRunning() {
            assertEquals(Set.of(TaskStatus.RUNNING), TaskStatus.RETRYING.getValidTransitions());
        }

        @ParameterizedTest
        @EnumSource(value = TaskStatus.class, names = {"COMPLETED", "FAILED", "SKIPPED"})
        @DisplayName("Terminal task states have no outgoing transitions")
        void terminalStatesAreFinal(TaskStatus status) {
            assertTrue(status.isTerminal());
            assertTrue(status.getValidTransitions().isEmpty());
            for (TaskStatus target : TaskStatus.values()) {
                assertFalse(status.canTransitionTo(target));
            }
        }

        @ParameterizedTest
        @EnumSource(value = TaskStatus.class, names = {"PENDING", "RUNNING", "RETRYING"})
        void nonTerminalStates(TaskStatus status) {
            assertFalse(status.isTerminal());
        }

        @Test
        void wireValuesAreLowercase() {
            assertEquals("retrying", TaskStatus.RETRYING.getValue());
            assertEquals("skipped", TaskStatus.SKIPPED.getValue());
        }
    }

    @Nested
    @DisplayName("Workflow status")
    class WorkflowStatusTransitions {

        @Test
        void runningAndPausedAlternate() {
            assertTrue(WorkflowStatus.RUNNING.canTransitionTo(WorkflowStatus.PAUSED));
            assertTrue(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.RUNNING));
        }

        @Test
        void pendingCannotSkipToCompleted() {
            assertFalse(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.COMPLETED));
            assertFalse(WorkflowStatus.PENDING.canTransitionTo(WorkflowStatus.PAUSED));
        }

        @Test
        void pausedWorkflowCanBeCancelledButNotCompleted() {
            assertTrue(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.CANCELLED));
            assertFalse(WorkflowStatus.PAUSED.canTransitionTo(WorkflowStatus.COMPLETED));
        }

        @ParameterizedTest
        @EnumSource(value = WorkflowStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
        @DisplayName("Terminal workflow states have no outgoing transitions")
        void terminalStatesAreFinal(WorkflowStatus status) {
            assertTrue(status.isTerminal());
            assertTrue(status.getValidTransitions().isEmpty());
        }

        @Test
        void onlyCompletedIsSuccessful() {
            for (WorkflowStatus status : WorkflowStatus.values()) {
                assertEquals(status == WorkflowStatus.COMPLETED, status.isSuccessful(), status.name());
            }
        }

        @Test
        void runningAndPausedAreActive() {
            assertTrue(WorkflowStatus.RUNNING.isActive());
            assertTrue(WorkflowStatus.PAUSED.isActive());
            assertFalse(WorkflowStatus.PENDING.isActive());
            assertFalse(WorkflowStatus.COMPLETED.isActive());
        }
    }
}
