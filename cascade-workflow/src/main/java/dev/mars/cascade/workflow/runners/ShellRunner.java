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
import dev.mars.cascade.runner.ActionRunner;
import dev.mars.cascade.runner.CancelSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs a shell snippet ({@code command}) or sources a script ({@code file}) through
 * {@code /bin/sh -c}. Both output streams are forwarded line by line as action messages; stdout
 * additionally goes through a {@link ServiceMessageScanner} so scripts can yield outcomes.
 *
 * <p>Optional parameters: {@code environment} (mapping merged over the inherited environment)
 * and {@code cwd}. On cancellation the process tree is destroyed and a cancelled result is
 * returned.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-25
 * @version 1.0
 */
public class ShellRunner implements ActionRunner {

    private static final Logger logger = LoggerFactory.getLogger(ShellRunner.class);

    public static final String KIND = "shell";

    static final String COMMAND = "command";
    static final String FILE = "file";
    static final String ENVIRONMENT = "environment";
    static final String CWD = "cwd";

    private static final String SHELL = "/bin/sh";
    private static final long PUMP_JOIN_MILLIS = 2000;
    private static final long KILL_AFTER_MILLIS = 1000;
    private static final long POLL_MILLIS = 100;

    /**
     * Prepended to every script when function injection is on. Prints the service message
     * understood by {@link ServiceMessageScanner}; the value is read from stdin when not given.
     */
    static final String YIELD_FUNCTIONS = String.join("\n",
            "yield_outcome(){",
            "  [ \"$1\" = \"\" ] && echo \"Missing key (first argument)\" && return 1",
            "  command -v base64 >/dev/null || ( echo \"Missing command: base64\" && return 2 )",
            "  [ \"$2\" = \"\" ] && value=\"$(cat /dev/stdin)\" || value=\"$2\"",
            "  echo \"##cascade[yield-outcome-b64 $(printf \"$1\" | base64 | tr -d '\\n') $(printf \"$value\" | base64 | tr -d '\\n')]##\"",
            "  return 0",
            "}",
            "");

    private final boolean injectFunctions;

    public ShellRunner() {
        this(true);
    }

    public ShellRunner(boolean injectFunctions) {
        this.injectFunctions = injectFunctions;
    }

    public boolean isInjectFunctions() {
        return injectFunctions;
    }

    @Override
    public ActionResult run(ActionInvocation invocation, CancelSignal cancelSignal) throws IOException {
        Optional<String> command = invocation.getStringParameter(COMMAND);
        Optional<String> file = invocation.getStringParameter(FILE);
        if (command.isPresent() && file.isPresent()) {
            return ActionResult.failure("Both command and file specified");
        }
        if (command.isEmpty() && file.isEmpty()) {
            return ActionResult.failure("Neither command nor file specified");
        }
        String script = command.orElseGet(() -> ". '" + file.get() + "'");
        if (injectFunctions) {
            script = YIELD_FUNCTIONS + script;
        }

        ProcessBuilder builder = new ProcessBuilder(SHELL, "-c", script);
        Optional<Object> environment = invocation.getParameter(ENVIRONMENT);
        if (environment.isPresent()) {
            if (!(environment.get() instanceof Map)) {
                return ActionResult.failure("Parameter '" + ENVIRONMENT + "' should be a mapping");
            }
            Map<String, String> processEnvironment = builder.environment();
            ((Map<?, ?>) environment.get()).forEach((key, value) ->
                    processEnvironment.put(String.valueOf(key), value == null ? "" : String.valueOf(value)));
        }
        Optional<String> cwd = invocation.getStringParameter(CWD);
        if (cwd.isPresent()) {
            File directory = new File(cwd.get());
            if (!directory.isDirectory()) {
                return ActionResult.failure("Working directory does not exist: " + cwd.get());
            }
            builder.directory(directory);
        }

        if (cancelSignal.isCancelled()) {
            return ActionResult.cancelled("Cancelled before start");
        }

        String actionId = invocation.getActionId();
        logger.debug("Action '{}': starting shell process", actionId);
        Process process = builder.start();
        // No input is ever written; an open pipe would block readers of stdin.
        process.getOutputStream().close();
        CancelSignal.Registration registration = cancelSignal.onCancel(() -> destroy(process, actionId));
        try {
            ServiceMessageScanner scanner = new ServiceMessageScanner(actionId, invocation::emit);
            Thread stdoutPump = pump(process.getInputStream(), scanner, actionId, "stdout", cancelSignal);
            Thread stderrPump = pump(process.getErrorStream(), invocation::emit, actionId, "stderr", cancelSignal);

            int exitCode;
            try {
                exitCode = awaitExit(process, cancelSignal, actionId);
                // Pipes stay open while background children hold them.
                stdoutPump.join(PUMP_JOIN_MILLIS);
                stderrPump.join(PUMP_JOIN_MILLIS);
            } catch (InterruptedException e) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                return ActionResult.cancelled("Interrupted while waiting for the shell process");
            }

            if (cancelSignal.isCancelled()) {
                return ActionResult.cancelled("Shell process terminated on cancellation (exit code " + exitCode + ")");
            }
            if (exitCode != 0) {
                return ActionResult.failure("Exit code: " + exitCode, exitCode);
            }
            return ActionResult.success(scanner.getOutcomes());
        } finally {
            registration.close();
        }
    }

    private static Thread pump(InputStream stream, Consumer<String> sink, String actionId, String streamName,
                               CancelSignal cancelSignal) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                if (cancelSignal.isCancelled()) {
                    logger.debug("Action '{}': {} closed on cancellation", actionId, streamName);
                } else {
                    logger.warn("Action '{}': failed reading {}: {}", actionId, streamName, e.getMessage());
                }
            }
        }, "cascade-" + streamName + "-" + actionId);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Waits for the process, escalating to a forced kill when it outlives a cancellation by
     * {@value #KILL_AFTER_MILLIS} ms.
     */
    private static int awaitExit(Process process, CancelSignal cancelSignal, String actionId) throws InterruptedException {
        long cancelSeenAt = -1;
        while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (!cancelSignal.isCancelled()) {
                continue;
            }
            long now = System.currentTimeMillis();
            if (cancelSeenAt < 0) {
                cancelSeenAt = now;
            } else if (now - cancelSeenAt > KILL_AFTER_MILLIS && process.isAlive()) {
                logger.warn("Action '{}': shell process {} ignored termination; killing it", actionId, process.pid());
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        }
        return process.exitValue();
    }

    private static void destroy(Process process, String actionId) {
        if (!process.isAlive()) {
            return;
        }
        logger.info("Action '{}': terminating shell process {}", actionId, process.pid());
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }
}
