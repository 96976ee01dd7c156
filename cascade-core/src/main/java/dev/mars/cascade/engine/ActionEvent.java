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

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One state transition of one action.
 *
 * @param runId     run the action belongs to
 * @param actionId  the action
 * @param from      state before the transition
 * @param to        state after the transition
 * @param timestamp when the engine applied it
 * @param cause     failure, skip or cancel reason; null for other transitions
 */
public record ActionEvent(String runId, String actionId, ActionState from, ActionState to,
                          Instant timestamp, String cause) {

    public ActionEvent {
        Objects.requireNonNull(runId, "Run id cannot be null");
        Objects.requireNonNull(actionId, "Action id cannot be null");
        Objects.requireNonNull(from, "From state cannot be null");
        Objects.requireNonNull(to, "To state cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
    }

    public Optional<String> getCause() {
        return Optional.ofNullable(cause);
    }

    public boolean isTerminal() {
        return to.isTerminal();
    }
}
