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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Forward pass shared by the strategies that skip work downstream of a bad outcome. Each
 * dependency edge is judged by an {@link EdgePolicy}; an action is blocked as soon as one of
 * its edges blocks, and a blocked action counts as SKIPPED for the edges leaving it.
 */
public final class FailurePropagation {

    /**
     * Decides whether a dependency edge stops its dependent from running.
     */
    public enum EdgePolicy {

        /** Failures block every edge; other bad outcomes block strict edges only. */
        PROPAGATE {
            @Override
            boolean blocks(ActionState upstream, boolean upstreamBlocked, boolean strictEdge) {
                return upstreamBlocked || upstream.isUnsuccessful()
                        || (strictEdge && upstream.blocksStrictDependents());
            }
        },

        /** Every edge is treated as strict. */
        ALL_STRICT {
            @Override
            boolean blocks(ActionState upstream, boolean upstreamBlocked, boolean strictEdge) {
                return upstreamBlocked || upstream.blocksStrictDependents();
            }
        },

        /** Only edges declared strict ever block. */
        STRICT_EDGES_ONLY {
            @Override
            boolean blocks(ActionState upstream, boolean upstreamBlocked, boolean strictEdge) {
                return strictEdge && (upstreamBlocked || upstream.blocksStrictDependents());
            }
        };

        abstract boolean blocks(ActionState upstream, boolean upstreamBlocked, boolean strictEdge);
    }

    private FailurePropagation() {
    }

    /**
     * Same as {@link #blockedDescendants(DependencyGraph, Function, EdgePolicy)} with
     * {@link EdgePolicy#PROPAGATE}.
     */
    public static Map<String, String> blockedDescendants(DependencyGraph graph,
                                                         Function<String, ActionState> states) {
        return blockedDescendants(graph, states, EdgePolicy.PROPAGATE);
    }

    /**
     * @param graph  the run's graph
     * @param states current state of each action
     * @param policy how each dependency edge is judged
     * @return each blocked action mapped to the action whose outcome started the chain, in
     *         topological order
     */
    public static Map<String, String> blockedDescendants(DependencyGraph graph,
                                                         Function<String, ActionState> states,
                                                         EdgePolicy policy) {
        Map<String, String> blocked = new LinkedHashMap<>();
        for (String actionId : graph.getTopologicalOrder()) {
            for (String dependency : graph.getDependencies(actionId)) {
                boolean upstreamBlocked = blocked.containsKey(dependency);
                boolean strictEdge = graph.isStrictDependency(actionId, dependency);
                if (policy.blocks(states.apply(dependency), upstreamBlocked, strictEdge)) {
                    blocked.put(actionId, upstreamBlocked ? blocked.get(dependency) : dependency);
                    break;
                }
            }
        }
        return blocked;
    }

    /**
     * Skip reason recorded for an action blocked by {@code origin}.
     */
    public static String describe(String origin, ActionState originState) {
        return "Upstream action '" + origin + "' ended in " + originState;
    }
}
