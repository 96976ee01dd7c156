package dev.mars.cascade.workflow;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decides which workflow document to load. An explicit argument wins; {@code -} means standard
 * input; otherwise exactly one of {@code cascade.yml} and {@code cascade.yaml} must exist in the
 * working directory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public class WorkflowSourceLocator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowSourceLocator.class);

    public static final String STDIN_ARGUMENT = "-";
    public static final List<String> DEFAULT_FILE_NAMES = List.of("cascade.yml", "cascade.yaml");
    private static final List<String> SUPPORTED_SUFFIXES = List.of(".yml", ".yaml");

    private final Path workingDirectory;

    public WorkflowSourceLocator() {
        this(Paths.get(""));
    }

    public WorkflowSourceLocator(Path workingDirectory) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
    }

    /**
     * @param argument explicit source, {@code -}, or null to scan the working directory
     */
    public WorkflowSource locate(String argument) throws WorkflowSourceException {
        if (argument != null && !argument.isBlank()) {
            return locateExplicit(argument.trim());
        }
        return scan();
    }

    private WorkflowSource locateExplicit(String argument) throws WorkflowSourceException {
        if (STDIN_ARGUMENT.equals(argument)) {
            logger.info("Using stdin as workflow source");
            return WorkflowSource.stdin();
        }
        Path path = workingDirectory.resolve(argument);
        if (!Files.exists(path)) {
            throw new WorkflowSourceException("Given workflow file does not exist: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new WorkflowSourceException("Given workflow source is not a file: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (SUPPORTED_SUFFIXES.stream().noneMatch(fileName::endsWith)) {
            throw new WorkflowSourceException("Unrecognized source: " + path + " (expected one of " + SUPPORTED_SUFFIXES + ")");
        }
        logger.info("Using given workflow file: {}", path);
        return WorkflowSource.file(path);
    }

    private WorkflowSource scan() throws WorkflowSourceException {
        logger.debug("Looking for workflow files in '{}'", workingDirectory.toAbsolutePath());
        Path located = null;
        for (String candidate : DEFAULT_FILE_NAMES) {
            Path path = workingDirectory.resolve(candidate);
            if (Files.isRegularFile(path)) {
                if (located != null) {
                    throw new WorkflowSourceException("Multiple workflow sources detected in "
                            + workingDirectory.toAbsolutePath() + ": " + located.getFileName() + ", " + candidate);
                }
                located = path;
            }
        }
        if (located == null) {
            throw new WorkflowSourceException("No workflow source detected in " + workingDirectory.toAbsolutePath());
        }
        logger.info("Detected the workflow source: {}", located);
        return WorkflowSource.file(located);
    }
}
