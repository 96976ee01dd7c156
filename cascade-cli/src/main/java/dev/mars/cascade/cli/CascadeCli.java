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

import dev.mars.cascade.config.CascadeConfiguration;
import dev.mars.cascade.core.ActionDescriptor;
import dev.mars.cascade.core.exceptions.GraphValidationException;
import dev.mars.cascade.core.exceptions.RunAbortedException;
import dev.mars.cascade.engine.EngineSettings;
import dev.mars.cascade.engine.ExitCode;
import dev.mars.cascade.engine.RunHandle;
import dev.mars.cascade.engine.RunResult;
import dev.mars.cascade.engine.SimpleExecutionEngine;
import dev.mars.cascade.graph.DependencyGraph;
import dev.mars.cascade.runner.ActionRunnerRegistry;
import dev.mars.cascade.strategy.StrategyRegistry;
import dev.mars.cascade.workflow.WorkflowDefinition;
import dev.mars.cascade.workflow.WorkflowLoadException;
import dev.mars.cascade.workflow.WorkflowSource;
import dev.mars.cascade.workflow.WorkflowSourceException;
import dev.mars.cascade.workflow.WorkflowSourceLocator;
import dev.mars.cascade.workflow.YamlWorkflowLoader;
import dev.mars.cascade.workflow.plugins.RunnerPluginLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeoutException;

/**
 * Command-line entry point. {@link #execute(String...)} does the work and returns the process
 * exit code, so it can be driven from tests; {@link #main(String[])} adds the shutdown hook and
 * {@code System.exit}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-27
 * @version 1.0
 */
public class CascadeCli {

    private static final Logger logger = LoggerFactory.getLogger(CascadeCli.class);

    private final Path workingDirectory;
    private final InputStream stdin;
    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, String> environment;
    private final Properties systemProperties;
    private boolean installShutdownHook;

    public CascadeCli(Path workingDirectory, InputStream stdin, PrintStream out, PrintStream err,
                      Map<String, String> environment, Properties systemProperties) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
        this.stdin = Objects.requireNonNull(stdin, "Input stream cannot be null");
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
        this.err = Objects.requireNonNull(err, "Error stream cannot be null");
        this.environment = Map.copyOf(environment);
        this.systemProperties = systemProperties;
    }

    public static void main(String[] args) {
        CascadeCli cli = new CascadeCli(Paths.get(""), System.in, System.out, System.err,
                System.getenv(), System.getProperties());
        cli.installShutdownHook = true;
        System.exit(cli.execute(args));
    }

    public int execute(String... args) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (CliUsageException e) {
            return usageError(e.getMessage());
        }
        if (arguments.isHelp()) {
            out.println(CliArguments.usage());
            return ExitCode.SUCCESS.getCode();
        }
        arguments.getLogLevel().ifPresent(level -> {
            if (!LogLevels.apply(level)) {
                err.println("Warning: log level ignored; Logback is not the active SLF4J binding");
            }
        });

        CascadeConfiguration configuration = new CascadeConfiguration(workingDirectory, environment, systemProperties);
        arguments.applyTo(configuration);
        EngineSettings settings;
        try {
            settings = configuration.toEngineSettings();
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        }
        StrategyRegistry strategies = new StrategyRegistry();
        if (!strategies.isRegistered(settings.getStrategyName())) {
            return usageError("Unknown execution strategy: '" + settings.getStrategyName()
                    + "'. Available: " + strategies.getNames());
        }

        WorkflowDefinition definition;
        DependencyGraph graph;
        try {
            String requested = arguments.getWorkflow()
                    .orElseGet(() -> configuration.getWorkflowFile().map(Path::toString).orElse(null));
            WorkflowSource source = new WorkflowSourceLocator(workingDirectory).locate(requested);
            definition = new YamlWorkflowLoader().load(source, stdin);
            graph = definition.toGraph();
        } catch (WorkflowSourceException e) {
            return fail(ExitCode.SOURCE_ERROR, e.getMessage());
        } catch (WorkflowLoadException e) {
            return fail(ExitCode.LOAD_ERROR, e.getMessage());
        } catch (GraphValidationException e) {
            return fail(ExitCode.VALIDATION_ERROR, e.getMessage());
        }

        RunnerPluginLoader plugins = new RunnerPluginLoader(configuration);
        try {
            ActionRunnerRegistry registry = plugins.createRegistry();
            if (arguments.getCommand() == CliArguments.Command.VALIDATE) {
                return validate(definition, graph, registry);
            }
            return run(arguments, definition, graph, settings, registry, strategies);
        } finally {
            try {
                plugins.close();
            } catch (IOException e) {
                logger.warn("Failed to release runner plugin jars: {}", e.getMessage());
            }
        }
    }

    private int validate(WorkflowDefinition definition, DependencyGraph graph, ActionRunnerRegistry registry) {
        for (ActionDescriptor action : graph.getDescriptors()) {
            if (!registry.isRegistered(action.getKind())) {
                return fail(ExitCode.VALIDATION_ERROR, "Action '" + action.getId() + "' uses unknown kind '"
                        + action.getKind() + "'. Available: " + registry.getKinds());
            }
        }
        List<List<String>> tiers = graph.getExecutionTiers();
        out.println("Workflow '" + definition.getSource() + "' is valid: "
                + graph.size() + " action(s) in " + tiers.size() + " tier(s)");
        for (int i = 0; i < tiers.size(); i++) {
            out.println("  tier " + (i + 1) + ": " + String.join(", ", tiers.get(i)));
        }
        return ExitCode.SUCCESS.getCode();
    }

    private int run(CliArguments arguments, WorkflowDefinition definition, DependencyGraph graph,
                    EngineSettings settings, ActionRunnerRegistry registry, StrategyRegistry strategies) {
        SimpleExecutionEngine engine = new SimpleExecutionEngine(settings, registry, strategies);
        Thread hook = null;
        try {
            engine.addListener(new ConsoleDisplay(out));
            RunHandle handle;
            try {
                handle = engine.start(graph, definition.getContext());
            } catch (GraphValidationException e) {
                return fail(ExitCode.VALIDATION_ERROR, e.getMessage());
            }
            if (installShutdownHook) {
                hook = cancelOnShutdown(handle, settings.getCancelGracePeriod());
            }

            RunResult result;
            try {
                result = handle.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handle.cancel();
                return fail(ExitCode.CANCELLED, "Interrupted");
            } catch (RunAbortedException e) {
                logger.error("Run {} aborted", e.getRunId(), e);
                return fail(ExitCode.INTERNAL_ERROR, "Internal error: " + e.getMessage());
            }

            if (arguments.getReportFile().isPresent()) {
                Path reportFile = workingDirectory.resolve(arguments.getReportFile().get());
                try {
                    new RunReportWriter().write(result, reportFile);
                } catch (IOException e) {
                    err.println("Error: failed to write run report " + reportFile + ": " + e.getMessage());
                }
            }
            return result.getExitCode().getCode();
        } finally {
            removeHook(hook);
            engine.shutdown();
        }
    }

    private Thread cancelOnShutdown(RunHandle handle, Duration gracePeriod) {
        Thread hook = new Thread(() -> {
            if (handle.isDone()) {
                return;
            }
            err.println("Interrupted; cancelling run " + handle.getRunId());
            handle.cancel();
            try {
                handle.await(gracePeriod.plusSeconds(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (TimeoutException | RunAbortedException e) {
                logger.warn("Run {} did not finish cleanly after cancellation: {}", handle.getRunId(), e.getMessage());
            }
        }, "cascade-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private static void removeHook(Thread hook) {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM is shutting down; keeping cancellation hook");
        }
    }

    private int usageError(String message) {
        err.println("Error: " + message);
        err.println(CliArguments.usage());
        return ExitCode.USAGE_ERROR.getCode();
    }

    private int fail(ExitCode code, String message) {
        err.println("Error: " + message);
        return code.getCode();
    }
}
