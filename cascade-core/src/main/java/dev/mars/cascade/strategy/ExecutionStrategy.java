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

import java.util.List;

/**
 * Decides which ready actions start, which are skipped and which wait.
 *
 * <p>Called only from the engine loop thread. A strategy must take a permit from
 * {@link SchedulingContext#getLimiter()} for every action it dispatches and must not
 * dispatch when none is available. Whenever nothing is running and at least one action is
 * ready, the decision must dispatch or skip something, otherwise the run cannot progress.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public interface ExecutionStrategy {

    String getName();

    /**
     * @param context view of the run
     * @param ready   actions in {@code READY}, in topological order
     */
    SchedulingDecision schedule(SchedulingContext context, List<String> ready);
}
