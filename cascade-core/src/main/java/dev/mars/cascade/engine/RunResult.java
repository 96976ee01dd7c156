package dev.mars.cascade.engine;

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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Immutable result of a finished run: the verdict, one report per action in topological
 * order, the lifecycle events in the order they were applied, and the outcomes produced.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class RunResult {

    private final String runId;
    private final String strategy;
    private final RunVerdict verdict;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Map<String, ActionReport> actions;
    private final List<ActionEvent> events;
    private final Map<String, Map<String, String>> outcomes;

    public RunResult(String runId, String strategy, RunVerdict verdict, Instant startedAt, Instant finishedAt,
                     List<ActionReport> actions, List<ActionEvent> events,
                     Map<String, Map<String, String>> outcomes) {
        this.runId = runId;
        this.strategy = strategy;
        this.verdict = verdict;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        Map<String, ActionReport> byId = new LinkedHashMap<>();
        actions.forEach(report -> byId.put(report.getActionId(), report));
        this.actions = Collections.unmodifiableMap(byId);
        this.events = List.copyOf(events);
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public String getRunId() {
        return runId;
    }

    public String getStrategy() {
        return strategy;
    }

    public RunVerdict getVerdict() {
        return verdict;
    }

    public ExitCode getExitCode() {
        return ExitCode.forVerdict(verdict);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Reports keyed by action id, in topological order.
     */
    public Map<String, ActionReport> getActions() {
        return actions;
    }

    public ActionReport getAction(String actionId) {
        ActionReport report = actions.get(actionId);
        if (report == null) {
            throw new NoSuchElementException("Unknown action: " + actionId);
        }
        return report;
    }

    public ActionState getState(String actionId) {
        return getAction(actionId).getState();
    }

    public List<String> getActionsIn(ActionState state) {
        return actions.values().stream()
                .filter(report -> report.getState() == state)
                .map(ActionReport::getActionId)
                .collect(Collectors.toList());
    }

    public List<ActionEvent> getEvents() {
        return events;
    }

    /**
     * Events of a single action, oldest first.
     */
    public List<ActionEvent> getEvents(String actionId) {
        return events.stream()
                .filter(event -> event.actionId().equals(actionId))
                .collect(Collectors.toList());
    }

    public Map<String, Map<String, String>> getOutcomes() {
        return outcomes;
    }

    public boolean isSuccessful() {
        return verdict.isSuccessful();
    }

    @Override
    public String toString() {
        return "RunResult{" +
                "runId='" + runId + '\'' +
                ", verdict=" + verdict +
                ", actions=" + actions.size() +
                ", duration=" + getDuration() +
                '}';
    }
}
