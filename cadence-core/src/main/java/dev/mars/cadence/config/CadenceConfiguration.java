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

package dev.mars.cadence.config;

import dev.mars.cadence.core.BackoffStrategy;
import dev.mars.cadence.core.RetryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the Cadence orchestration engine.
 *
 * <p>Values are layered: built-in defaults, then the first {@code cadence.properties} found on
 * disk (or on the classpath), then {@code cadence.*} system properties. The
 * {@link #CadenceConfiguration(Properties)} constructor skips the file and system layers, which
 * keeps tests hermetic.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CadenceConfiguration {
    private static final Logger logger = Logger.getLogger(CadenceConfiguration.class.getName());

    public static final String RETRY_MAX_ATTEMPTS = "cadence.retry.max.attempts";
    public static final String RETRY_BACKOFF_STRATEGY = "cadence.retry.backoff.strategy";
    public static final String RETRY_BASE_DELAY_MS = "cadence.retry.base.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "cadence.retry.max.delay.ms";
    public static final String RETRY_JITTER = "cadence.retry.jitter";
    public static final String TASK_TIMEOUT_MS = "cadence.task.timeout.ms";
    public static final String AGENT_MAX_CONCURRENT_TASKS = "cadence.agent.max.concurrent.tasks";
    public static final String ENGINE_PARALLEL_WORKERS = "cadence.engine.parallel.workers";
    public static final String METRICS_ENABLED = "cadence.monitoring.metrics.enabled";

    private static final int DEFAULT_MAX_ATTEMPTS = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    private static final String DEFAULT_BACKOFF_STRATEGY = "exponential";
    private static final long DEFAULT_BASE_DELAY_MS = RetryPolicy.DEFAULT_BASE_DELAY.toMillis();
    private static final long DEFAULT_MAX_DELAY_MS = RetryPolicy.DEFAULT_MAX_DELAY.toMillis();
    private static final long DEFAULT_TASK_TIMEOUT_MS = 300_000;
    private static final int DEFAULT_AGENT_MAX_CONCURRENT_TASKS = 5;
    private static final int DEFAULT_PARALLEL_WORKERS = 8;

    private final Properties properties;

    public CadenceConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public CadenceConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Retry configuration
    public int getMaxRetryAttempts() {
        return getIntProperty(RETRY_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @throws IllegalArgumentException if the configured name is not a known strategy
     */
    public BackoffStrategy getBackoffStrategy() {
        return BackoffStrategy.fromValue(getStringProperty(RETRY_BACKOFF_STRATEGY, DEFAULT_BACKOFF_STRATEGY));
    }

    public Duration getRetryBaseDelay() {
        return Duration.ofMillis(getLongProperty(RETRY_BASE_DELAY_MS, DEFAULT_BASE_DELAY_MS));
    }

    public Duration getRetryMaxDelay() {
        return Duration.ofMillis(getLongProperty(RETRY_MAX_DELAY_MS, DEFAULT_MAX_DELAY_MS));
    }

    public boolean isRetryJitterEnabled() {
        return getBooleanProperty(RETRY_JITTER, true);
    }

    /**
     * Retry policy assembled from the {@code cadence.retry.*} keys, used for tasks that do not
     * declare their own.
     */
    public RetryPolicy defaultRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(getMaxRetryAttempts())
                .backoffStrategy(getBackoffStrategy())
                .baseDelay(getRetryBaseDelay())
                .maxDelay(getRetryMaxDelay())
                .jitter(isRetryJitterEnabled())
                .build();
    }

    // Task and agent configuration
    public Duration defaultTaskTimeout() {
        return Duration.ofMillis(getLongProperty(TASK_TIMEOUT_MS, DEFAULT_TASK_TIMEOUT_MS));
    }

    public int getAgentMaxConcurrentTasks() {
        return getIntProperty(AGENT_MAX_CONCURRENT_TASKS, DEFAULT_AGENT_MAX_CONCURRENT_TASKS);
    }

    // Engine configuration

    /**
     * Worker threads kept alive for parallel stages. Busier passes add threads beyond this.
     */
    public int getParallelWorkers() {
        return Math.max(1, getIntProperty(ENGINE_PARALLEL_WORKERS, DEFAULT_PARALLEL_WORKERS));
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(RETRY_MAX_ATTEMPTS, String.valueOf(DEFAULT_MAX_ATTEMPTS));
        properties.setProperty(RETRY_BACKOFF_STRATEGY, DEFAULT_BACKOFF_STRATEGY);
        properties.setProperty(RETRY_BASE_DELAY_MS, String.valueOf(DEFAULT_BASE_DELAY_MS));
        properties.setProperty(RETRY_MAX_DELAY_MS, String.valueOf(DEFAULT_MAX_DELAY_MS));
        properties.setProperty(RETRY_JITTER, "true");
        properties.setProperty(TASK_TIMEOUT_MS, String.valueOf(DEFAULT_TASK_TIMEOUT_MS));
        properties.setProperty(AGENT_MAX_CONCURRENT_TASKS, String.valueOf(DEFAULT_AGENT_MAX_CONCURRENT_TASKS));
        properties.setProperty(ENGINE_PARALLEL_WORKERS, String.valueOf(DEFAULT_PARALLEL_WORKERS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "cadence.properties",
                "config/cadence.properties",
                System.getProperty("user.home") + "/.cadence/cadence.properties",
                "/etc/cadence/cadence.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("cadence.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().stringPropertyNames().stream()
                .filter(key -> key.startsWith("cadence."))
                .forEach(key -> {
                    properties.setProperty(key, System.getProperty(key));
                    logger.fine("Override from system property: " + key + "=" + System.getProperty(key));
                });
    }

    @Override
    public String toString() {
        return "CadenceConfiguration{" +
                "maxRetryAttempts=" + getMaxRetryAttempts() +
                ", backoffStrategy=" + getProperty(RETRY_BACKOFF_STRATEGY) +
                ", taskTimeout=" + defaultTaskTimeout() +
                ", parallelWorkers=" + getParallelWorkers() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
