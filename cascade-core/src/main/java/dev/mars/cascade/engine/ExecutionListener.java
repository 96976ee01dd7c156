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

import dev.mars.cascade.graph.DependencyGraph;

/**
 * Receives run progress. Run and transition callbacks arrive in order on the run's loop
 * thread; action messages arrive on the worker thread that emitted them, so implementations
 * that keep state must be thread safe. Exceptions thrown by a listener are logged and
 * otherwise ignored.
 */
public interface ExecutionListener {

    default void onRunStarted(String runId, DependencyGraph graph) {
    }

    default void onTransition(ActionEvent event) {
    }

    default void onActionMessage(String runId, String actionId, String message) {
    }

    default void onRunFinished(RunResult result) {
    }
}
