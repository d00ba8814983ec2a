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

package dev.mars.cadence.workflow.observability;

import dev.mars.cadence.config.CadenceConfiguration;
import dev.mars.cadence.core.Capability;
import dev.mars.cadence.core.FailureKind;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * OpenTelemetry metrics for the orchestration engine.
 *
 * Provides:
 * - cadence.workflow.active (gauge) - Workflow runs in progress
 * - cadence.workflow.total (counter) - Workflow runs started
 * - cadence.workflow.completed (counter) - Runs that completed
 * - cadence.workflow.failed (counter) - Runs that failed
 * - cadence.workflow.cancelled (counter) - Runs halted by cancellation
 * - cadence.task.total (counter) - Task attempts dispatched
 * - cadence.task.failed (counter) - Tasks that failed terminally
 * - cadence.task.retries (counter) - Retries scheduled
 * - cadence.workflow.duration.seconds (histogram) - Run duration distribution
 * - cadence.task.duration.seconds (histogram) - Duration of completed tasks
 *
 * <p>Each orchestrator owns one instance. Without an SDK installed the global provider is a
 * no-op, so recording is always safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = Logger.getLogger(WorkflowMetrics.class.getName());
    private static final String METER_NAME = "cadence-workflow";

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsCancelled;
    private final LongCounter tasksTotal;
    private final LongCounter tasksFailed;
    private final LongCounter taskRetries;

    // Histograms
    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram taskDuration;

    // Gauge (backed by AtomicLong)
    private final AtomicLong activeWorkflows = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> CAPABILITY_KEY = AttributeKey.stringKey("task.capability");
    private static final AttributeKey<String> FAILURE_KIND_KEY = AttributeKey.stringKey("failure.kind");

    public WorkflowMetrics(OpenTelemetry openTelemetry) {
        Objects.requireNonNull(openTelemetry, "OpenTelemetry cannot be null");
        Meter meter = openTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("cadence.workflow.total")
                .setDescription("Total number of workflow runs started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("cadence.workflow.completed")
                .setDescription("Number of workflow runs that completed")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("cadence.workflow.failed")
                .setDescription("Number of workflow runs that failed")
                .setUnit("1")
                .build();

        workflowsCancelled = meter.counterBuilder("cadence.workflow.cancelled")
                .setDescription("Number of workflow runs halted by cancellation")
                .setUnit("1")
                .build();

        tasksTotal = meter.counterBuilder("cadence.task.total")
                .setDescription("Total number of task attempts dispatched")
                .setUnit("1")
                .build();

        tasksFailed = meter.counterBuilder("cadence.task.failed")
                .setDescription("Number of tasks that failed after their last attempt")
                .setUnit("1")
                .build();

        taskRetries = meter.counterBuilder("cadence.task.retries")
                .setDescription("Number of task retries scheduled")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("cadence.workflow.duration.seconds")
                .setDescription("Workflow run duration in seconds")
                .setUnit("s")
                .build();

        taskDuration = meter.histogramBuilder("cadence.task.duration.seconds")
                .setDescription("Completed task duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("cadence.workflow.active")
                .setDescription("Number of workflow runs in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.fine("WorkflowMetrics initialized");
    }

    /**
     * Metrics on the globally registered OpenTelemetry, or no-op metrics when the configuration
     * disables them.
     */
    public static WorkflowMetrics fromConfiguration(CadenceConfiguration configuration) {
        if (!configuration.isMetricsEnabled()) {
            return new WorkflowMetrics(OpenTelemetry.noop());
        }
        return new WorkflowMetrics(GlobalOpenTelemetry.get());
    }

    public void recordWorkflowStarted(String workflowName) {
        workflowsTotal.add(1, workflowAttributes(workflowName));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowName, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowName);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowFailed(String workflowName, FailureKind failureKind, double durationSeconds) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(FAILURE_KIND_KEY, failureKind != null ? failureKind.getValue() : "unknown")
                .build();
        workflowsFailed.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
    }

    public void recordWorkflowCancelled(String workflowName) {
        activeWorkflows.decrementAndGet();
        workflowsCancelled.add(1, workflowAttributes(workflowName));
    }

    public void recordTaskDispatched(String workflowName, Capability capability) {
        tasksTotal.add(1, taskAttributes(workflowName, capability));
    }

    public void recordTaskCompleted(String workflowName, Capability capability, double durationSeconds) {
        taskDuration.record(durationSeconds, taskAttributes(workflowName, capability));
    }

    public void recordTaskRetry(String workflowName, Capability capability) {
        taskRetries.add(1, taskAttributes(workflowName, capability));
    }

    public void recordTaskFailed(String workflowName, Capability capability, FailureKind failureKind) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_NAME_KEY, workflowName)
                .put(CAPABILITY_KEY, capability.getName())
                .put(FAILURE_KIND_KEY, failureKind != null ? failureKind.getValue() : "unknown")
                .build();
        tasksFailed.add(1, attrs);
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowName) {
        return Attributes.of(WORKFLOW_NAME_KEY, workflowName);
    }

    private static Attributes taskAttributes(String workflowName, Capability capability) {
        return Attributes.of(WORKFLOW_NAME_KEY, workflowName, CAPABILITY_KEY, capability.getName());
    }
}
