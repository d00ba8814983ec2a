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

package dev.mars.cadence.workflow.parser;

import dev.mars.cadence.config.CadenceConfiguration;
import dev.mars.cadence.core.BackoffStrategy;
import dev.mars.cadence.core.Capability;
import dev.mars.cadence.core.FailureStrategy;
import dev.mars.cadence.core.RetryPolicy;
import dev.mars.cadence.core.Stage;
import dev.mars.cadence.core.Task;
import dev.mars.cadence.core.Workflow;
import dev.mars.cadence.core.validation.ValidationResult;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses workflow definitions using SnakeYAML.
 *
 * <pre>
 * metadata:
 *   name: Generate inventory service
 *   projectId: proj-42
 *   labels: { team: platform }
 * spec:
 *   stages:
 *     - name: analysis
 *       parallel: false
 *       failureStrategy: stop_on_error
 *       tasks:
 *         - id: requirements
 *           capability: requirement_analysis
 *           input: { spec: inventory.md }
 *           timeout: 30s
 *           retryPolicy: { maxAttempts: 2, backoffStrategy: fixed, baseDelay: 500ms }
 *         - id: architecture
 *           capability: architecture_planning
 *           dependsOn: [requirements]
 * </pre>
 *
 * <p>Durations are written as {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h} or a plain
 * number of seconds. Unset task timeouts and retry settings come from the configuration.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = Logger.getLogger(YamlWorkflowDefinitionParser.class.getName());

    private final Yaml yaml;
    private final RetryPolicy defaultRetryPolicy;
    private final Duration defaultTimeout;

    public YamlWorkflowDefinitionParser() {
        this(RetryPolicy.defaults(), Task.DEFAULT_TIMEOUT);
    }

    public YamlWorkflowDefinitionParser(CadenceConfiguration configuration) {
        this(configuration.defaultRetryPolicy(), configuration.defaultTaskTimeout());
    }

    private YamlWorkflowDefinitionParser(RetryPolicy defaultRetryPolicy, Duration defaultTimeout) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public Workflow parse(Path definitionFile) throws WorkflowParseException {
        try {
            String content = Files.readString(definitionFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + definitionFile, e);
        }
    }

    @Override
    public Workflow parseFromString(String content) throws WorkflowParseException {
        Map<String, Object> data = load(content);
        Workflow workflow = parseWorkflow(data);
        logger.fine("Parsed workflow '" + workflow.getName() + "' with " + workflow.getStages().size()
                + " stages and " + workflow.getTotalTaskCount() + " tasks");
        return workflow;
    }

    @Override
    public ValidationResult validateSchema(String content) {
        ValidationResult result = new ValidationResult();
        Object data;
        try {
            data = yaml.load(content);
        } catch (YAMLException e) {
            result.addError("YAML syntax error: " + e.getMessage());
            return result;
        }
        if (!(data instanceof Map)) {
            result.addError("Empty or invalid YAML content");
            return result;
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> root = (Map<String, Object>) data;
        Map<String, Object> metadata = root.get("metadata") instanceof Map ? asMap(root.get("metadata")) : null;
        if (metadata == null) {
            result.addError("metadata", "Required field 'metadata' is missing");
        } else if (isBlank(getStringValue(metadata, "name"))) {
            result.addError("metadata.name", "Required field 'name' is missing");
        }

        Map<String, Object> spec = root.get("spec") instanceof Map ? asMap(root.get("spec")) : null;
        if (spec == null) {
            result.addError("spec", "Required field 'spec' is missing");
        } else if (!(spec.get("stages") instanceof List)) {
            result.addError("spec.stages", "Required field 'stages' is missing");
        } else if (((List<?>) spec.get("stages")).isEmpty()) {
            result.addWarning("spec.stages", "No stages defined");
        }
        return result;
    }

    private Map<String, Object> load(String content) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
        if (data == null) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("Workflow definition must be a YAML mapping");
        }
        return asMap(data);
    }

    private Workflow parseWorkflow(Map<String, Object> data) throws WorkflowParseException {
        Map<String, Object> metadata = requireMap(data, "metadata", "metadata");
        String name = requireString(metadata, "name", "metadata.name");
        String projectId = requireString(metadata, "projectId", "metadata.projectId");

        Workflow.Builder builder = Workflow.builder()
                .id(getStringValue(metadata, "id"))
                .name(name)
                .projectId(projectId);

        String description = getStringValue(metadata, "description");
        if (description != null) {
            builder.metadata("description", description);
        }
        Map<String, String> labels = parseLabels(getMapValue(metadata, "labels", "metadata.labels"));
        if (!labels.isEmpty()) {
            builder.metadata("labels", labels);
        }

        Map<String, Object> spec = requireMap(data, "spec", "spec");
        List<Object> stages = getListValue(spec, "stages", "spec.stages");
        if (stages == null) {
            throw new WorkflowParseException("spec.stages", "Required field 'stages' is missing");
        }
        for (int i = 0; i < stages.size(); i++) {
            String path = "spec.stages[" + i + "]";
            builder.stage(parseStage(toMap(stages.get(i), path), path));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException("spec.stages", e.getMessage(), e);
        }
    }

    private Stage parseStage(Map<String, Object> data, String path) throws WorkflowParseException {
        String name = requireString(data, "name", path + ".name");
        boolean parallel = getBooleanValue(data, "parallel", false, path + ".parallel");

        FailureStrategy failureStrategy = FailureStrategy.STOP_ON_ERROR;
        String strategyValue = getStringValue(data, "failureStrategy");
        if (strategyValue != null) {
            try {
                failureStrategy = FailureStrategy.fromValue(strategyValue);
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(path + ".failureStrategy", e.getMessage(), e);
            }
        }

        List<Object> tasksData = getListValue(data, "tasks", path + ".tasks");
        List<Task> tasks = new ArrayList<>();
        if (tasksData != null) {
            for (int i = 0; i < tasksData.size(); i++) {
                String taskPath = path + ".tasks[" + i + "]";
                tasks.add(parseTask(toMap(tasksData.get(i), taskPath), taskPath));
            }
        }
        return new Stage(name, tasks, parallel, failureStrategy);
    }

    private Task parseTask(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = requireString(data, "id", path + ".id");
        String capabilityName = requireString(data, "capability", path + ".capability");

        Capability capability;
        try {
            capability = Capability.of(capabilityName);
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".capability", e.getMessage(), e);
        }

        Task.Builder builder = Task.builder()
                .id(id)
                .name(getStringValue(data, "name"))
                .capability(capability)
                .dependsOn(parseStringList(getListValue(data, "dependsOn", path + ".dependsOn")))
                .retryPolicy(parseRetryPolicy(getMapValue(data, "retryPolicy", path + ".retryPolicy"), path + ".retryPolicy"));

        Map<String, Object> input = getMapValue(data, "input", path + ".input");
        if (input != null) {
            builder.input(new LinkedHashMap<>(input));
        }

        Duration timeout = parseDuration(getStringValue(data, "timeout"), path + ".timeout");
        builder.timeout(timeout != null ? timeout : defaultTimeout);

        Duration estimated = parseDuration(getStringValue(data, "estimatedDuration"), path + ".estimatedDuration");
        if (estimated != null) {
            builder.estimatedDuration(estimated);
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private RetryPolicy parseRetryPolicy(Map<String, Object> data, String path) throws WorkflowParseException {
        if (data == null) {
            return defaultRetryPolicy;
        }

        RetryPolicy.Builder builder = defaultRetryPolicy.toBuilder();
        if (data.containsKey("maxAttempts")) {
            builder.maxAttempts(getIntValue(data, "maxAttempts", path + ".maxAttempts"));
        }
        String strategy = getStringValue(data, "backoffStrategy");
        if (strategy != null) {
            try {
                builder.backoffStrategy(BackoffStrategy.fromValue(strategy));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(path + ".backoffStrategy", e.getMessage(), e);
            }
        }
        Duration baseDelay = parseDuration(getStringValue(data, "baseDelay"), path + ".baseDelay");
        if (baseDelay != null) {
            builder.baseDelay(baseDelay);
        }
        Duration maxDelay = parseDuration(getStringValue(data, "maxDelay"), path + ".maxDelay");
        if (maxDelay != null) {
            builder.maxDelay(maxDelay);
        } else if (baseDelay != null && baseDelay.compareTo(defaultRetryPolicy.getMaxDelay()) > 0) {
            builder.maxDelay(baseDelay);
        }
        if (data.containsKey("jitter")) {
            builder.jitter(getBooleanValue(data, "jitter", true, path + ".jitter"));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    /**
     * Parses {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h} or plain seconds.
     *
     * @return the duration, or {@code null} when the value is absent
     */
    static Duration parseDuration(String value, String path) throws WorkflowParseException {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String trimmed = value.trim().toLowerCase();
        try {
            if (trimmed.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim()));
            } else if (trimmed.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else if (trimmed.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else if (trimmed.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
            } else {
                return Duration.ofSeconds(Long.parseLong(trimmed));
            }
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Invalid duration '" + value + "'", e);
        }
    }

    // Utility methods for safe type conversion

    private static String getStringValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private static String requireString(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        String value = getStringValue(data, key);
        if (isBlank(value)) {
            throw new WorkflowParseException(path, "Required field '" + key + "' is missing");
        }
        return value.trim();
    }

    private static Map<String, Object> requireMap(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        Map<String, Object> value = getMapValue(data, key, path);
        if (value == null) {
            throw new WorkflowParseException(path, "Required field '" + key + "' is missing");
        }
        return value;
    }

    private static Map<String, Object> getMapValue(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        if (data == null) return null;
        Object value = data.get(key);
        if (value == null) return null;
        return toMap(value, path);
    }

    private static Map<String, Object> toMap(Object value, String path) throws WorkflowParseException {
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Expected a mapping but found " + describe(value));
        }
        return asMap(value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> getListValue(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        if (data == null) return null;
        Object value = data.get(key);
        if (value == null) return null;
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path, "Expected a list but found " + describe(value));
        }
        return (List<Object>) value;
    }

    private static boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue, String path)
            throws WorkflowParseException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim().toLowerCase();
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new WorkflowParseException(path, "Expected true or false but found '" + value + "'");
    }

    private static int getIntValue(Map<String, Object> data, String key, String path) throws WorkflowParseException {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new WorkflowParseException(path, "Expected an integer but found '" + value + "'", e);
        }
    }

    private static Map<String, String> parseLabels(Map<String, Object> data) {
        if (data == null) return Map.of();

        Map<String, String> labels = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            labels.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        return labels;
    }

    private static List<String> parseStringList(List<Object> data) {
        if (data == null) return List.of();

        List<String> result = new ArrayList<>();
        for (Object item : data) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static String describe(Object value) {
        return value instanceof List ? "a list" : "'" + value + "'";
    }
}
