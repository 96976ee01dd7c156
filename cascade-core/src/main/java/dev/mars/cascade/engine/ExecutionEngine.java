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

import dev.mars.cascade.core.ActionDescriptor;
import dev.mars.cascade.core.exceptions.GraphValidationException;
import dev.mars.cascade.graph.DependencyGraph;

import java.util.List;
import java.util.Map;

/**
 * Executes dependency graphs of actions.
 */
public interface ExecutionEngine {

    /**
     * Starts a run on a validated graph.
     *
     * @param graph   the actions to run
     * @param context workflow context variables available to {@code @{context.*}} references
     * @return a handle on the run
     * @throws GraphValidationException if an action names a runner kind that is not registered
     */
    RunHandle start(DependencyGraph graph, Map<String, Object> context) throws GraphValidationException;

    default RunHandle start(DependencyGraph graph) throws GraphValidationException {
        return start(graph, Map.of());
    }

    /**
     * Builds the graph from raw descriptors, validates it, and starts a run.
     *
     * @throws GraphValidationException on a duplicate id, unknown dependency, cycle or unknown kind;
     *                                  no action starts in that case
     */
    default RunHandle start(List<ActionDescriptor> actions, Map<String, Object> context)
            throws GraphValidationException {
        return start(DependencyGraph.build(actions), context);
    }

    /**
     * Runs a graph and waits for the result.
     */
    default RunResult run(DependencyGraph graph, Map<String, Object> context)
            throws GraphValidationException, InterruptedException {
        return start(graph, context).await();
    }

    default RunResult run(List<ActionDescriptor> actions)
            throws GraphValidationException, InterruptedException {
        return start(actions, Map.of()).await();
    }

    void addListener(ExecutionListener listener);

    void removeListener(ExecutionListener listener);

    /**
     * Cancels every active run and releases the engine's threads.
     */
    void shutdown();
}
