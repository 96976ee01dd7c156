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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command line: {@code cascade <run|validate> [WORKFLOW] [options]}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-27
 * @version 1.0
 */
public final class CliArguments {

    public enum Command {
        RUN,
        VALIDATE
    }

    static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    private Command command;
    private String workflow;
    private String strategy;
    private Integer concurrency;
    private boolean strictOutcomes;
    private boolean enforceDeclared;
    private Path runnersDirectory;
    private Path reportFile;
    private String logLevel;
    private boolean help;

    private CliArguments() {
    }

    public static CliArguments parse(String... args) throws CliUsageException {
        CliArguments parsed = new CliArguments();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            if (arg.startsWith("--") && arg.contains("=")) {
                inlineValue = arg.substring(arg.indexOf('=') + 1);
                arg = arg.substring(0, arg.indexOf('='));
            }

            switch (arg) {
                case "-h":
                case "--help":
                    parsed.help = true;
                    break;
                case "-s":
                case "--strategy":
                    parsed.strategy = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    break;
                case "-c":
                case "--concurrency":
                    parsed.concurrency = parseConcurrency(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    break;
                case "--strict-outcomes":
                    parsed.strictOutcomes = true;
                    break;
                case "--enforce-declared":
                    parsed.enforceDeclared = true;
                    break;
                case "--runners-dir":
                    parsed.runnersDirectory = Paths.get(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    break;
                case "--report":
                    parsed.reportFile = Paths.get(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    break;
                case "-l":
                case "--log-level":
                    parsed.logLevel = parseLogLevel(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    break;
                default:
                    if (arg.length() > 1 && arg.startsWith("-")) {
                        throw new CliUsageException("Unknown option: " + arg);
                    }
                    parsed.positional(arg);
            }
        }

        if (!parsed.help && parsed.command == null) {
            throw new CliUsageException("No command given");
        }
        return parsed;
    }

    private void positional(String arg) throws CliUsageException {
        if (command == null) {
            try {
                command = Command.valueOf(arg.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new CliUsageException("Unknown command: '" + arg + "'", e);
            }
        } else if (workflow == null) {
            workflow = arg;
        } else {
            throw new CliUsageException("Unexpected argument: " + arg);
        }
    }

    private static String value(String[] args, int index, String option) throws CliUsageException {
        if (index >= args.length) {
            throw new CliUsageException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static int parseConcurrency(String value) throws CliUsageException {
        try {
            int limit = Integer.parseInt(value.trim());
            if (limit < 0) {
                throw new CliUsageException("Concurrency must be zero (unbounded) or positive: " + value);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new CliUsageException("Concurrency must be an integer: " + value, e);
        }
    }

    private static String parseLogLevel(String value) throws CliUsageException {
        String level = value.trim().toUpperCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(level)) {
            throw new CliUsageException("Unknown log level: " + value);
        }
        return level;
    }

    /**
     * Writes the options that map to configuration keys over {@code configuration}.
     */
    public void applyTo(CascadeConfiguration configuration) {
        if (strategy != null) {
            configuration.setProperty(CascadeConfiguration.STRATEGY, strategy);
        }
        if (concurrency != null) {
            configuration.setProperty(CascadeConfiguration.CONCURRENCY_LIMIT, String.valueOf(concurrency));
        }
        if (strictOutcomes) {
            configuration.setProperty(CascadeConfiguration.RENDERING_MODE, "strict");
        }
        if (enforceDeclared) {
            configuration.setProperty(CascadeConfiguration.ENFORCE_DECLARED_OUTCOMES, "true");
        }
        if (runnersDirectory != null) {
            configuration.setProperty(CascadeConfiguration.RUNNERS_DIRECTORY, runnersDirectory.toString());
        }
    }

    public Command getCommand() {
        return command;
    }

    public Optional<String> getWorkflow() {
        return Optional.ofNullable(workflow);
    }

    public Optional<String> getStrategy() {
        return Optional.ofNullable(strategy);
    }

    public Optional<Integer> getConcurrency() {
        return Optional.ofNullable(concurrency);
    }

    public boolean isStrictOutcomes() {
        return strictOutcomes;
    }

    public boolean isEnforceDeclared() {
        return enforceDeclared;
    }

    public Optional<Path> getRunnersDirectory() {
        return Optional.ofNullable(runnersDirectory);
    }

    public Optional<Path> getReportFile() {
        return Optional.ofNullable(reportFile);
    }

    public Optional<String> getLogLevel() {
        return Optional.ofNullable(logLevel);
    }

    public boolean isHelp() {
        return help;
    }

    static String usage() {
        return String.join(System.lineSeparator(),
                "Usage: cascade <run|validate> [WORKFLOW] [options]",
                "",
                "WORKFLOW is a .yml/.yaml file or '-' for standard input. When omitted, cascade.yml or",
                "cascade.yaml in the current directory is used.",
                "",
                "Options:",
                "  -s, --strategy <name>     Execution strategy: free, loose, strict, sequential (default: free)",
                "  -c, --concurrency <n>     Maximum actions running at once, 0 for unbounded (default: 0)",
                "  --strict-outcomes         Fail an action when a reference cannot be resolved",
                "  --enforce-declared        Fail an action that does not produce its declared outcomes",
                "  --runners-dir <dir>       Directory of runner plugin jars",
                "  --report <file>           Write a JSON run report",
                "  -l, --log-level <level>   TRACE, DEBUG, INFO, WARN, ERROR or OFF (default: WARN)",
                "  -h, --help                Show this help message",
                "",
                "Exit codes: 0 success, 1 failure, 2 usage error, 101 internal error, 102 load error,",
                "            103 validation error, 104 source error, 130 cancelled");
    }
}
