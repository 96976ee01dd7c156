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
import java.util.Map;

/**
 * Concurrent strategy that waits for dependencies to finish but ignores how they finished:
 * dependents of a failed action still run, unless the dependency was declared strict. Pair it
 * with lenient rendering so that references to outcomes the failed action never produced
 * render empty.
 */
public class LooseStrategy implements ExecutionStrategy {

    public static final String NAME = "loose";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SchedulingDecision schedule(SchedulingContext context, List<String> ready) {
        Map<String, String> blocked = FailurePropagation.blockedDescendants(context.getGraph(), context::getState,
                FailurePropagation.EdgePolicy.STRICT_EDGES_ONLY);
        SchedulingDecision.Builder decision = SchedulingDecision.builder();
        for (String actionId : ready) {
            String origin = blocked.get(actionId);
            if (origin != null) {
                decision.skip(actionId, FailurePropagation.describe(origin, context.getState(origin)));
            } else if (context.getLimiter().tryAcquire()) {
                decision.dispatch(actionId);
            }
        }
        return decision.build();
    }
}
