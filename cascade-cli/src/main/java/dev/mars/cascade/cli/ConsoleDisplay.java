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

import dev.mars.cascade.core.ActionState;
import dev.mars.cascade.engine.ActionEvent;
import dev.mars.cascade.engine.ActionReport;
import dev.mars.cascade.engine.ExecutionListener;
import dev.mars.cascade.engine.RunResult;
import dev.mars.cascade.graph.DependencyGraph;

import java.io.PrintStream;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Prints run progress to a stream: action messages prefixed with the action id, terminal
 * transitions as they happen, and a summary banner at the end.
 *
 * <pre>
 * [build ] | compiling
 * [build ] SUCCESS
 * [deploy] SKIPPED: Upstream action 'build' ended in FAILURE
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-27
 * @version 1.0
 */
public class ConsoleDisplay implements ExecutionListener {

    static final String RULE = "=".repeat(60);

    private final PrintStream out;
    private volatile int idWidth;

    public ConsoleDisplay(PrintStream out) {
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
    }

    @Override
    public void onRunStarted(String runId, DependencyGraph graph) {
        idWidth = graph.getActionIds().stream().mapToInt(String::length).max().orElse(0);
        println("Starting run " + runId + " with " + graph.size() + " action(s)");
    }

    @Override
    public void onTransition(ActionEvent event) {
        if (!event.isTerminal()) {
            return;
        }
        String line = prefix(event.actionId()) + " " + event.to();
        if (event.to() != ActionState.SUCCESS && event.cause() != null) {
            line += ": " + event.cause();
        }
        println(line);
    }

    @Override
    public void onActionMessage(String runId, String actionId, String message) {
        println(prefix(actionId) + " | " + message);
    }

    @Override
    public void onRunFinished(RunResult result) {
        Map<ActionState, Integer> counts = new EnumMap<>(ActionState.class);
        for (ActionReport report : result.getActions().values()) {
            counts.merge(report.getState(), 1, Integer::sum);
        }

        StringBuilder banner = new StringBuilder();
        banner.append(RULE).append(System.lineSeparator());
        banner.append(String.format(Locale.ROOT, "Run %s finished: %s in %.2fs",
                result.getRunId(), result.getVerdict(), result.getDuration().toMillis() / 1000.0));
        banner.append(System.lineSeparator()).append(' ');
        for (ActionState state : new ActionState[]{ActionState.SUCCESS, ActionState.WARNING,
                ActionState.FAILURE, ActionState.SKIPPED, ActionState.CANCELLED}) {
            banner.append(' ').append(state).append(": ").append(counts.getOrDefault(state, 0));
        }
        banner.append(System.lineSeparator());
        for (ActionReport report : result.getActions().values()) {
            if (report.getState() == ActionState.FAILURE || report.getState() == ActionState.WARNING) {
                banner.append(report.getState() == ActionState.FAILURE ? "  failed: " : "  warning: ")
                        .append(report.getActionId())
                        .append(report.getCause().map(cause -> " (" + cause + ")").orElse(""))
                        .append(System.lineSeparator());
            }
        }
        banner.append(RULE);
        println(banner.toString());
    }

    private String prefix(String actionId) {
        StringBuilder sb = new StringBuilder("[").append(actionId);
        for (int i = actionId.length(); i < idWidth; i++) {
            sb.append(' ');
        }
        return sb.append(']').toString();
    }

    // Messages arrive from worker threads.
    private void println(String line) {
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
