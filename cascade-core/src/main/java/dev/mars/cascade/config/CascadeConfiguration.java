package dev.mars.cascade.config;

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

import dev.mars.cascade.engine.EngineSettings;
import dev.mars.cascade.outcome.RenderingMode;
import dev.mars.cascade.strategy.FreeStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration management for Cascade.
 * Layers, lowest precedence first: built-in defaults, the first readable {@code cascade.properties}
 * file (working directory, {@code config/}, {@code ~/.cascade/}, then the classpath),
 * {@code CASCADE_*} environment variables, {@code cascade.*} system properties, and finally
 * values set through {@link #setProperty(String, String)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class CascadeConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CascadeConfiguration.class);

    public static final String STRATEGY = "cascade.strategy";
    public static final String CONCURRENCY_LIMIT = "cascade.concurrency.limit";
    public static final String RENDERING_MODE = "cascade.rendering.mode";
    public static final String ENFORCE_DECLARED_OUTCOMES = "cascade.outcomes.enforce.declared";
    public static final String CANCEL_GRACE_MS = "cascade.cancel.grace.ms";
    public static final String RUNNERS_DIRECTORY = "cascade.runners.directory";
    public static final String SHELL_INJECT_FUNCTIONS = "cascade.shell.inject.functions";
    public static final String WORKFLOW_FILE = "cascade.workflow.file";

    private static final String PREFIX = "cascade.";
    private static final String ENV_PREFIX = "CASCADE_";
    private static final String FILE_NAME = "cascade.properties";

    // Default configuration values
    private static final String DEFAULT_STRATEGY = FreeStrategy.NAME;
    private static final int DEFAULT_CONCURRENCY_LIMIT = 0;
    private static final String DEFAULT_RENDERING_MODE = "lenient";
    private static final long DEFAULT_CANCEL_GRACE_MS = 5000;

    private final Properties properties;

    public CascadeConfiguration() {
        this(Paths.get(""), System.getenv(), System.getProperties());
    }

    /**
     * Defaults plus the given properties; no files, environment or system properties are read.
     */
    public CascadeConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    /**
     * Full layering, with the working directory, environment and system properties supplied by
     * the caller.
     */
    public CascadeConfiguration(Path workingDirectory, Map<String, String> environment, Properties systemProperties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile(workingDirectory);
        loadConfigurationFromEnvironment(environment);
        loadConfigurationFromSystemProperties(systemProperties);
    }

    // Engine configuration
    public String getStrategy() {
        return getStringProperty(STRATEGY, DEFAULT_STRATEGY).trim().toLowerCase(Locale.ROOT);
    }

    public int getConcurrencyLimit() {
        int limit = getIntProperty(CONCURRENCY_LIMIT, DEFAULT_CONCURRENCY_LIMIT);
        if (limit < 0) {
            logger.warn("Negative value for property {}: {}. Using default: {}", CONCURRENCY_LIMIT, limit,
                    DEFAULT_CONCURRENCY_LIMIT);
            return DEFAULT_CONCURRENCY_LIMIT;
        }
        return limit;
    }

    /**
     * @throws IllegalArgumentException if the configured mode is neither {@code strict} nor {@code lenient}
     */
    public RenderingMode getRenderingMode() {
        return RenderingMode.fromValue(getStringProperty(RENDERING_MODE, DEFAULT_RENDERING_MODE).trim());
    }

    public boolean isEnforceDeclaredOutcomes() {
        return getBooleanProperty(ENFORCE_DECLARED_OUTCOMES, false);
    }

    public Duration getCancelGracePeriod() {
        long millis = getLongProperty(CANCEL_GRACE_MS, DEFAULT_CANCEL_GRACE_MS);
        return Duration.ofMillis(millis < 0 ? DEFAULT_CANCEL_GRACE_MS : millis);
    }

    // Runner configuration
    public Optional<Path> getRunnersDirectory() {
        return optionalPath(RUNNERS_DIRECTORY);
    }

    public boolean isShellInjectFunctions() {
        return getBooleanProperty(SHELL_INJECT_FUNCTIONS, true);
    }

    // Workflow source
    public Optional<Path> getWorkflowFile() {
        return optionalPath(WORKFLOW_FILE);
    }

    /**
     * Builds engine settings from the current values.
     *
     * @throws IllegalArgumentException if the rendering mode is unrecognised
     */
    public EngineSettings toEngineSettings() {
        return EngineSettings.builder()
                .strategy(getStrategy())
                .concurrencyLimit(getConcurrencyLimit())
                .renderingMode(getRenderingMode())
                .enforceDeclaredOutcomes(isEnforceDeclaredOutcomes())
                .cancelGracePeriod(getCancelGracePeriod())
                .build();
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

    private Optional<Path> optionalPath(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value.trim()));
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
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
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
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
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
        properties.setProperty(STRATEGY, DEFAULT_STRATEGY);
        properties.setProperty(CONCURRENCY_LIMIT, String.valueOf(DEFAULT_CONCURRENCY_LIMIT));
        properties.setProperty(RENDERING_MODE, DEFAULT_RENDERING_MODE);
        properties.setProperty(ENFORCE_DECLARED_OUTCOMES, "false");
        properties.setProperty(CANCEL_GRACE_MS, String.valueOf(DEFAULT_CANCEL_GRACE_MS));
        properties.setProperty(SHELL_INJECT_FUNCTIONS, "true");
    }

    private void loadConfigurationFromFile(Path workingDirectory) {
        Path[] configFiles = {
                workingDirectory.resolve(FILE_NAME),
                workingDirectory.resolve("config").resolve(FILE_NAME),
                Paths.get(System.getProperty("user.home"), ".cascade", FILE_NAME)
        };

        for (Path configPath : configFiles) {
            if (Files.isRegularFile(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    // CASCADE_CONCURRENCY_LIMIT -> cascade.concurrency.limit
    private void loadConfigurationFromEnvironment(Map<String, String> environment) {
        environment.forEach((name, value) -> {
            if (name.startsWith(ENV_PREFIX) && name.length() > ENV_PREFIX.length()) {
                String key = name.toLowerCase(Locale.ROOT).replace('_', '.');
                properties.setProperty(key, value);
                logger.debug("Override from environment: {}={}", key, value);
            }
        });
    }

    private void loadConfigurationFromSystemProperties(Properties systemProperties) {
        systemProperties.stringPropertyNames().stream()
                .filter(name -> name.startsWith(PREFIX))
                .forEach(name -> {
                    properties.setProperty(name, systemProperties.getProperty(name));
                    logger.debug("Override from system property: {}={}", name, systemProperties.getProperty(name));
                });
    }

    @Override
    public String toString() {
        return "CascadeConfiguration{" +
                "strategy='" + getStrategy() + '\'' +
                ", concurrencyLimit=" + getConcurrencyLimit() +
                ", renderingMode=" + properties.getProperty(RENDERING_MODE) +
                ", enforceDeclaredOutcomes=" + isEnforceDeclaredOutcomes() +
                ", cancelGracePeriod=" + getCancelGracePeriod() +
                '}';
    }
}
