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

import dev.mars.cascade.core.ActionDescriptor;
import dev.mars.cascade.core.ActionState;
import dev.mars.cascade.engine.ActionEvent;
import dev.mars.cascade.engine.ActionReport;
import dev.mars.cascade.engine.RunResult;
import dev.mars.cascade.engine.RunVerdict;
import dev.mars.cascade.graph.DependencyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConsoleDisplayTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private ConsoleDisplay display;

    @BeforeEach
    void setUp() throws Exception {
        display = new ConsoleDisplay(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        DependencyGraph graph = DependencyGraph.build(List.of(
                ActionDescriptor.builder("db").kind("echo").build(),
                ActionDescriptor.builder("migrate").kind("shell").dependsOn("db").build()));
        display.onRunStarted("run-1", graph);
    }

    private List<String> lines() {
        return buffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private static ActionEvent event(String id, ActionState from, ActionState to, String cause) {
        return new ActionEvent("run-1", id, from, to, Instant.now(), cause);
    }

    @Test
    void messagesArePrefixedAndAligned() {
        display.onActionMessage("run-1", "db", "ready");
        display.onActionMessage("run-1", "migrate", "applied 3 migrations");

        assertThat(lines()).containsSubsequence("[db     ] | ready", "[migrate] | applied 3 migrations");
        assertThat(lines().get(0)).isEqualTo("Starting run run-1 with 2 action(s)");
    }

    @Test
    void onlyTerminalTransitionsArePrinted() {
        display.onTransition(event("db", ActionState.PENDING, ActionState.READY, null));
        display.onTransition(event("db", ActionState.READY, ActionState.RUNNING, null));
        display.onTransition(event("db", ActionState.RUNNING, ActionState.FAILURE, "Exit code: 2"));
        display.onTransition(event("migrate", ActionState.PENDING, ActionState.SKIPPED,
                "Upstream action 'db' ended in FAILURE"));

        assertThat(lines()).containsExactly(
                "Starting run run-1 with 2 action(s)",
                "[db     ] FAILURE: Exit code: 2",
                "[migrate] SKIPPED: Upstream action 'db' ended in FAILURE");
    }

    @Test
    void bannerSummarisesStates() {
        ActionReport failed = mock(ActionReport.class);
        when(failed.getActionId()).thenReturn("db");
        when(failed.getState()).thenReturn(ActionState.FAILURE);
        when(failed.getCause()).thenReturn(Optional.of("Exit code: 2"));
        ActionReport skipped = mock(ActionReport.class);
        when(skipped.getActionId()).thenReturn("migrate");
        when(skipped.getState()).thenReturn(ActionState.SKIPPED);
        ActionReport lint = mock(ActionReport.class);
        when(lint.getActionId()).thenReturn("lint");
        when(lint.getState()).thenReturn(ActionState.WARNING);
        when(lint.getCause()).thenReturn(Optional.of("Exit code: 1"));

        Map<String, ActionReport> reports = new LinkedHashMap<>();
        reports.put("db", failed);
        reports.put("migrate", skipped);
        reports.put("lint", lint);
        RunResult result = mock(RunResult.class);
        when(result.getRunId()).thenReturn("run-1");
        when(result.getVerdict()).thenReturn(RunVerdict.FAILURE);
        when(result.getDuration()).thenReturn(Duration.ofMillis(1500));
        when(result.getActions()).thenReturn(reports);

        display.onRunFinished(result);

        assertThat(lines()).containsSubsequence(
                ConsoleDisplay.RULE,
                "Run run-1 finished: FAILURE in 1.50s",
                "  SUCCESS: 0 WARNING: 1 FAILURE: 1 SKIPPED: 1 CANCELLED: 0",
                "  failed: db (Exit code: 2)",
                "  warning: lint (Exit code: 1)",
                ConsoleDisplay.RULE);
    }
}
