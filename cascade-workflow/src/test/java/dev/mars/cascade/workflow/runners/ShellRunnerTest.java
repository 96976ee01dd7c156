package dev.mars.cascade.workflow.runners;

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

import dev.mars.cascade.runner.ActionInvocation;
import dev.mars.cascade.runner.ActionResult;
import dev.mars.cascade.runner.CancelSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real {@code /bin/sh} processes.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
@DisplayName("ShellRunner")
class ShellRunnerTest {

    private final List<String> messages = new CopyOnWriteArrayList<>();

    private ActionInvocation invocation(Map<String, Object> parameters) {
        return new ActionInvocation("sh", ShellRunner.KIND, parameters, List.of(), messages::add);
    }

    private ActionResult run(Map<String, Object> parameters) throws Exception {
        return new ShellRunner().run(invocation(parameters), new CancelSignal());
    }

    @Nested
    @DisplayName("Process execution")
    class Execution {

        @Test
        @DisplayName("forwards stdout and stderr lines")
        void forwardsBothStreams() throws Exception {
            ActionResult result = run(Map.of("command", "echo out-line; echo err-line >&2"));

            assertTrue(result.isSuccess());
            assertThat(messages).containsExactlyInAnyOrder("out-line", "err-line");
        }

        @Test
        @DisplayName("non-zero exit is a failure carrying the code")
        void nonZeroExit() throws Exception {
            ActionResult result = run(Map.of("command", "echo failing; exit 3"));

            assertEquals(ActionResult.Status.FAILURE, result.getStatus());
            assertEquals("Exit code: 3", result.getCause().orElseThrow());
            assertEquals(3, result.getExitCode().orElseThrow());
            assertThat(messages).containsExactly("failing");
        }

        @Test
        @DisplayName("environment is merged over the inherited one")
        void environmentAndWorkingDirectory(@TempDir Path dir) throws Exception {
            ActionResult result = run(Map.of(
                    "command", "echo \"$REGION:$(pwd -P)\"",
                    "environment", Map.of("REGION", "eu"),
                    "cwd", dir.toString()));

            assertTrue(result.isSuccess());
            assertThat(messages).containsExactly("eu:" + dir.toRealPath());
        }

        @Test
        @DisplayName("file is sourced")
        void sourcesFile(@TempDir Path dir) throws Exception {
            Path script = dir.resolve("steps.sh");
            Files.writeString(script, "echo from-file\nyield_outcome origin file\n");

            ActionResult result = run(Map.of("file", script.toString()));

            assertTrue(result.isSuccess());
            assertThat(messages).containsExactly("from-file");
            assertEquals(Map.of("origin", "file"), result.getOutcomes());
        }

        @Test
        @DisplayName("missing working directory fails before starting")
        void missingWorkingDirectory(@TempDir Path dir) throws Exception {
            ActionResult result = run(Map.of("command", "true", "cwd", dir.resolve("absent").toString()));

            assertEquals(ActionResult.Status.FAILURE, result.getStatus());
            assertThat(result.getCause().orElseThrow()).startsWith("Working directory does not exist");
        }

        @Test
        @DisplayName("command and file are mutually exclusive")
        void commandXorFile() throws Exception {
            assertEquals("Both command and file specified",
                    run(Map.of("command", "true", "file", "x.sh")).getCause().orElseThrow());
            assertEquals("Neither command nor file specified",
                    run(Map.of()).getCause().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("yield_outcome publishes key and value")
        void yieldFunction() throws Exception {
            ActionResult result = run(Map.of("command", "echo building; yield_outcome version 1.2.3"));

            assertTrue(result.isSuccess());
            assertEquals(Map.of("version", "1.2.3"), result.getOutcomes());
            assertThat(messages).containsExactly("building");
        }

        @Test
        @DisplayName("yield_outcome reads the value from stdin when not given")
        void yieldFromStdin() throws Exception {
            ActionResult result = run(Map.of("command", "echo hello | yield_outcome greeting"));

            assertEquals(Map.of("greeting", "hello"), result.getOutcomes());
        }

        @Test
        @DisplayName("hand-written service messages work without the function")
        void rawServiceMessage() throws Exception {
            ActionResult result = new ShellRunner(false).run(invocation(Map.of(
                    "command", "echo 'prefix ##cascade[yield-outcome-b64 a2V5 dmFsdWU=]##'")), new CancelSignal());

            assertTrue(result.isSuccess());
            assertEquals(Map.of("key", "value"), result.getOutcomes());
            assertThat(messages).containsExactly("prefix ");
        }

        @Test
        @DisplayName("without injection yield_outcome does not exist")
        void injectionDisabled() throws Exception {
            ActionResult result = new ShellRunner(false).run(
                    invocation(Map.of("command", "yield_outcome a b")), new CancelSignal());

            assertEquals(ActionResult.Status.FAILURE, result.getStatus());
            assertEquals(127, result.getExitCode().orElseThrow());
        }

        @Test
        @DisplayName("outcomes of a failed process are discarded")
        void failedProcessYieldsNothing() throws Exception {
            ActionResult result = run(Map.of("command", "yield_outcome version 1; exit 1"));

            assertTrue(result.getOutcomes().isEmpty());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancel terminates the process and reports cancelled")
        void cancelTerminatesProcess() throws Exception {
            CancelSignal signal = new CancelSignal();
            ShellRunner runner = new ShellRunner();
            CompletableFuture<ActionResult> future = CompletableFuture.supplyAsync(() -> {
                try {
                    return runner.run(invocation(Map.of("command", "echo started; sleep 30")), signal);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });

            await().atMost(Duration.ofSeconds(5)).until(() -> messages.contains("started"));
            signal.cancel();

            ActionResult result = future.get(10, TimeUnit.SECONDS);
            assertEquals(ActionResult.Status.CANCELLED, result.getStatus());
        }

        @Test
        @DisplayName("an already raised signal prevents the start")
        void cancelledBeforeStart() throws Exception {
            CancelSignal signal = new CancelSignal();
            signal.cancel();

            ActionResult result = new ShellRunner().run(invocation(Map.of("command", "echo never")), signal);

            assertEquals(ActionResult.Status.CANCELLED, result.getStatus());
            assertTrue(messages.isEmpty());
        }
    }
}
