package dev.mars.cascade.strategy;

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
import dev.mars.cascade.graph.DependencyGraph;

/**
 * Read-only view of a run that a strategy decides against.
 */
public interface SchedulingContext {

    DependencyGraph getGraph();

    ActionState getState(String actionId);

    /**
     * Number of actions currently in {@link ActionState#RUNNING}.
     */
    int getRunningCount();

    ConcurrencyLimiter getLimiter();
}
