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

import java.util.List;
import java.util.Map;

/**
 * Runs one action at a time in the graph's fixed topological order. Subclasses choose
 * whether the first failure halts the whole run or only blocks its descendants.
 */
public abstract class SingleLaneStrategy implements ExecutionStrategy {

    /**
     * @return true if every remaining action is skipped after the first failure
     */
    protected abstract boolean haltsOnFailure();

    /**
     * @return how dependency edges are judged once the run has not halted
     */
    protected abstract FailurePropagation.EdgePolicy edgePolicy();

    @Override
    public SchedulingDecision schedule(SchedulingContext context, List<String> ready) {
        if (context.getRunningCount() > 0 || ready.isEmpty()) {
            return SchedulingDecision.deferAll();
        }

        SchedulingDecision.Builder decision = SchedulingDecision.builder();
        if (haltsOnFailure()) {
            String failed = firstUnsuccessful(context);
            if (failed != null) {
                String reason = "Run halted after '" + failed + "' ended in " + context.getState(failed);
                ready.forEach(actionId -> decision.skip(actionId, reason));
                return decision.build();
            }
        }

        Map<String, String> blocked = FailurePropagation.blockedDescendants(context.getGraph(), context::getState,
                edgePolicy());
        String next = null;
        for (String actionId : ready) {
            String origin = blocked.get(actionId);
            if (origin != null) {
                decision.skip(actionId, FailurePropagation.describe(origin, context.getState(origin)));
            } else if (next == null || isBefore(context, actionId, next)) {
                next = actionId;
            }
        }
        if (next != null && context.getLimiter().tryAcquire()) {
            decision.dispatch(next);
        }
        return decision.build();
    }

    private static boolean isBefore(SchedulingContext context, String candidate, String current) {
        return context.getGraph().getOrderIndex(candidate) < context.getGraph().getOrderIndex(current);
    }

    private static String firstUnsuccessful(SchedulingContext context) {
        for (String actionId : context.getGraph().getTopologicalOrder()) {
            ActionState state = context.getState(actionId);
            if (state.isUnsuccessful()) {
                return actionId;
            }
        }
        return null;
    }
}
