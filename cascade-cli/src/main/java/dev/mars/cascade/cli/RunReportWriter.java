package dev.mars.cascade.cli;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.cascade.engine.ActionReport;
import dev.mars.cascade.engine.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Serializes a {@link RunResult} as indented JSON with ISO-8601 timestamps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-27
 * @version 1.0
 */
public class RunReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(RunReportWriter.class);

    private final ObjectMapper mapper;

    public RunReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(RunResult result) throws JsonProcessingException {
        return mapper.writeValueAsString(RunReport.of(result));
    }

    /**
     * Writes the report, creating parent directories as needed.
     */
    public void write(RunResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), RunReport.of(result));
        logger.info("Run report written to {}", file);
    }

    @JsonPropertyOrder({"runId", "strategy", "verdict", "exitCode", "startedAt", "finishedAt", "durationMillis", "actions"})
    static final class RunReport {
        public final String runId;
        public final String strategy;
        public final String verdict;
        public final int exitCode;
        public final Instant startedAt;
        public final Instant finishedAt;
        public final long durationMillis;
        public final List<ActionEntry> actions;

        private RunReport(RunResult result) {
            this.runId = result.getRunId();
            this.strategy = result.getStrategy();
            this.verdict = result.getVerdict().name();
            this.exitCode = result.getExitCode().getCode();
            this.startedAt = result.getStartedAt();
            this.finishedAt = result.getFinishedAt();
            this.durationMillis = result.getDuration().toMillis();
            this.actions = result.getActions().values().stream()
                    .map(ActionEntry::new)
                    .collect(Collectors.toList());
        }

        static RunReport of(RunResult result) {
            return new RunReport(result);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"id", "kind", "state", "cause", "exitCode", "startedAt", "finishedAt", "outcomes"})
    static final class ActionEntry {
        public final String id;
        public final String kind;
        public final String state;
        public final String cause;
        public final Integer exitCode;
        public final Instant startedAt;
        public final Instant finishedAt;
        public final Map<String, String> outcomes;

        private ActionEntry(ActionReport report) {
            this.id = report.getActionId();
            this.kind = report.getKind();
            this.state = report.getState().name();
            this.cause = report.getCause().orElse(null);
            this.exitCode = report.getExitCode().orElse(null);
            this.startedAt = report.getStartedAt().orElse(null);
            this.finishedAt = report.getFinishedAt().orElse(null);
            this.outcomes = report.getOutcomes();
        }
    }
}
