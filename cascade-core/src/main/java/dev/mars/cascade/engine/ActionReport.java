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
import java.util.Map;
import java.util.Optional;

/**
 * Final record of one action in a finished run.
 */
public final class ActionReport {

    private final String actionId;
    private final String kind;
    private final ActionState state;
    private final String cause;
    private final Integer exitCode;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Map<String, String> outcomes;

    public ActionReport(String actionId, String kind, ActionState state, String cause, Integer exitCode,
                        Instant startedAt, Instant finishedAt, Map<String, String> outcomes) {
        this.actionId = actionId;
        this.kind = kind;
        this.state = state;
        this.cause = cause;
        this.exitCode = exitCode;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public String getActionId() {
        return actionId;
    }

    public String getKind() {
        return kind;
    }

    public ActionState getState() {
        return state;
    }

    public Optional<String> getCause() {
        return Optional.ofNullable(cause);
    }

    public Optional<Integer> getExitCode() {
        return Optional.ofNullable(exitCode);
    }

    /**
     * Empty for actions that never ran.
     */
    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public Optional<Duration> getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, finishedAt));
    }

    public Map<String, String> getOutcomes() {
        return outcomes;
    }

    @Override
    public String toString() {
        return "ActionReport{" +
                "actionId='" + actionId + '\'' +
                ", state=" + state +
                (cause != null ? ", cause='" + cause + '\'' : "") +
                '}';
    }
}
