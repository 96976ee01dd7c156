package dev.mars.cascade.runner;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a runner reports when it returns: outcomes on success, a cause on failure, or an
 * acknowledgement that it stopped because of cancellation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ActionResult {

    public enum Status {
        SUCCESS,
        FAILURE,
        CANCELLED
    }

    private final Status status;
    private final Map<String, String> outcomes;
    private final String cause;
    private final Integer exitCode;
    private final Throwable error;

    private ActionResult(Status status, Map<String, String> outcomes, String cause,
                         Integer exitCode, Throwable error) {
        this.status = status;
        this.outcomes = outcomes;
        this.cause = cause;
        this.exitCode = exitCode;
        this.error = error;
    }

    public static ActionResult success() {
        return success(Map.of());
    }

    public static ActionResult success(Map<String, String> outcomes) {
        Objects.requireNonNull(outcomes, "Outcomes cannot be null");
        outcomes.forEach((name, value) -> {
            if (name == null) {
                throw new IllegalArgumentException("Outcome names cannot be null");
            }
            if (value == null) {
                throw new IllegalArgumentException("Outcome '" + name + "' has a null value");
            }
        });
        return new ActionResult(Status.SUCCESS,
                Collections.unmodifiableMap(new LinkedHashMap<>(outcomes)), null, null, null);
    }

    public static ActionResult failure(String cause) {
        return new ActionResult(Status.FAILURE, Map.of(), cause, null, null);
    }

    public static ActionResult failure(String cause, int exitCode) {
        return new ActionResult(Status.FAILURE, Map.of(), cause, exitCode, null);
    }

    public static ActionResult failure(String cause, Throwable error) {
        return new ActionResult(Status.FAILURE, Map.of(), cause, null, error);
    }

    public static ActionResult cancelled(String reason) {
        return new ActionResult(Status.CANCELLED, Map.of(), reason, null, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, String> getOutcomes() {
        return outcomes;
    }

    public Optional<String> getCause() {
        return Optional.ofNullable(cause);
    }

    /**
     * Exit code reported by process-backed runners.
     */
    public Optional<Integer> getExitCode() {
        return Optional.ofNullable(exitCode);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "ActionResult{" +
                "status=" + status +
                (cause != null ? ", cause='" + cause + '\'' : "") +
                (exitCode != null ? ", exitCode=" + exitCode : "") +
                ", outcomes=" + outcomes.keySet() +
                '}';
    }
}
