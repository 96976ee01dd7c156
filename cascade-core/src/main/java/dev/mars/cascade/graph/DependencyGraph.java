package dev.mars.cascade.graph;

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

import java.util.*;

/**
 * Validated, immutable dependency graph of the actions in a workflow.
 *
 * <p>Every query answers in declaration order so that two builds of the same descriptors
 * produce the same topological order and the same tiers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = new DependencyGraph(
            Map.of(), Map.of(), Map.of(), List.of(), List.of());

    private final Map<String, ActionDescriptor> descriptors;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;
    private final List<String> topologicalOrder;
    private final List<List<String>> executionTiers;
    private final Map<String, Integer> orderIndex;

    private DependencyGraph(Map<String, ActionDescriptor> descriptors,
                            Map<String, Set<String>> dependencies,
                            Map<String, Set<String>> dependents,
                            List<String> topologicalOrder,
                            List<List<String>> executionTiers) {
        this.descriptors = descriptors;
        this.dependencies = dependencies;
        this.dependents = dependents;
        this.topologicalOrder = topologicalOrder;
        this.executionTiers = executionTiers;
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < topologicalOrder.size(); i++) {
            index.put(topologicalOrder.get(i), i);
        }
        this.orderIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Validates the descriptors and builds the graph.
     *
     * @param actions descriptors in declaration order
     * @return the graph; an empty input yields an empty graph
     * @throws GraphValidationException on a duplicate id, a dependency on an undeclared id,
     *                                  or a cycle (the first one found is reported)
     */
    public static DependencyGraph build(Collection<ActionDescriptor> actions) throws GraphValidationException {
        Objects.requireNonNull(actions, "Actions cannot be null");
        if (actions.isEmpty()) {
            return EMPTY;
        }

        Map<String, ActionDescriptor> byId = new LinkedHashMap<>();
        for (ActionDescriptor action : actions) {
            if (byId.putIfAbsent(action.getId(), action) != null) {
                throw new GraphValidationException(GraphValidationException.Kind.DUPLICATE_ACTION,
                        action.getId(), "Duplicate action id: '" + action.getId() + "'");
            }
        }

        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            dependents.put(id, new LinkedHashSet<>());
        }
        for (ActionDescriptor action : byId.values()) {
            for (String dependency : action.getDependencies()) {
                if (!byId.containsKey(dependency)) {
                    throw new GraphValidationException(GraphValidationException.Kind.UNKNOWN_DEPENDENCY,
                            action.getId(), "Action '" + action.getId()
                            + "' depends on unknown action '" + dependency + "'");
                }
            }
            dependencies.put(action.getId(), action.getDependencies());
        }
        // dependents follow declaration order of the dependent, not of the edge
        for (ActionDescriptor action : byId.values()) {
            for (String dependency : action.getDependencies()) {
                dependents.get(dependency).add(action.getId());
            }
        }

        Optional<List<String>> cycle = findCycle(byId.keySet(), dependencies);
        if (cycle.isPresent()) {
            throw GraphValidationException.cycleDetected(cycle.get());
        }

        List<String> order = topologicalSort(byId.keySet(), dependencies, dependents);
        List<List<String>> tiers = computeTiers(order, dependencies);

        Map<String, Set<String>> frozenDependents = new LinkedHashMap<>();
        dependents.forEach((id, set) -> frozenDependents.put(id, Collections.unmodifiableSet(set)));

        return new DependencyGraph(
                Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(dependencies),
                Collections.unmodifiableMap(frozenDependents),
                List.copyOf(order),
                tiers);
    }

    public ActionDescriptor getDescriptor(String actionId) {
        ActionDescriptor descriptor = descriptors.get(actionId);
        if (descriptor == null) {
            throw new NoSuchElementException("Unknown action: " + actionId);
        }
        return descriptor;
    }

    public boolean contains(String actionId) {
        return descriptors.containsKey(actionId);
    }

    /**
     * Action ids in declaration order.
     */
    public Set<String> getActionIds() {
        return descriptors.keySet();
    }

    public Collection<ActionDescriptor> getDescriptors() {
        return descriptors.values();
    }

    public int size() {
        return descriptors.size();
    }

    public boolean isEmpty() {
        return descriptors.isEmpty();
    }

    /**
     * Direct dependencies (backward edges) of an action.
     */
    public Set<String> getDependencies(String actionId) {
        return dependencies.getOrDefault(actionId, Set.of());
    }

    /**
     * Direct dependents (forward edges) of an action.
     */
    public Set<String> getDependents(String actionId) {
        return dependents.getOrDefault(actionId, Set.of());
    }

    /**
     * Actions with no dependencies.
     */
    public List<String> getRoots() {
        List<String> roots = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().isEmpty()) {
                roots.add(entry.getKey());
            }
        }
        return roots;
    }

    /**
     * A fixed topological order: every action appears after all of its dependencies, and
     * ties are broken by declaration order.
     */
    public List<String> getTopologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Groups of actions that may run side by side. Tier {@code n} holds the actions whose
     * longest dependency chain has length {@code n}.
     */
    public List<List<String>> getExecutionTiers() {
        return executionTiers;
    }

    /**
     * Position of an action in the topological order.
     */
    public int getOrderIndex(String actionId) {
        Integer index = orderIndex.get(actionId);
        if (index == null) {
            throw new NoSuchElementException("Unknown action: " + actionId);
        }
        return index;
    }

    /**
     * Whether {@code dependent} marked its edge to {@code dependency} as strict: the dependent
     * is skipped whenever that dependency does not succeed, whatever the strategy.
     */
    public boolean isStrictDependency(String dependent, String dependency) {
        ActionDescriptor descriptor = descriptors.get(dependent);
        return descriptor != null && descriptor.getStrictDependencies().contains(dependency);
    }

    /**
     * White/gray/black depth-first search. Returns the first cycle met as a path that
     * starts and ends with the same id.
     */
    private static Optional<List<String>> findCycle(Set<String> ids, Map<String, Set<String>> dependencies) {
        Map<String, Color> colors = new HashMap<>();
        for (String id : ids) {
            colors.put(id, Color.WHITE);
        }

        for (String start : ids) {
            if (colors.get(start) != Color.WHITE) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            colors.put(start, Color.GRAY);
            path.addLast(start);
            pending.push(dependencies.get(start).iterator());

            while (!pending.isEmpty()) {
                Iterator<String> edges = pending.peek();
                if (!edges.hasNext()) {
                    pending.pop();
                    colors.put(path.removeLast(), Color.BLACK);
                    continue;
                }
                String next = edges.next();
                Color color = colors.get(next);
                if (color == Color.GRAY) {
                    List<String> cycle = new ArrayList<>();
                    boolean inCycle = false;
                    for (String node : path) {
                        if (node.equals(next)) {
                            inCycle = true;
                        }
                        if (inCycle) {
                            cycle.add(node);
                        }
                    }
                    cycle.add(next);
                    return Optional.of(cycle);
                }
                if (color == Color.WHITE) {
                    colors.put(next, Color.GRAY);
                    path.addLast(next);
                    pending.push(dependencies.get(next).iterator());
                }
            }
        }
        return Optional.empty();
    }

    // Kahn's algorithm, ready set ordered by declaration index
    private static List<String> topologicalSort(Set<String> ids, Map<String, Set<String>> dependencies,
                                                Map<String, Set<String>> dependents) {
        Map<String, Integer> declarationIndex = new HashMap<>();
        for (String id : ids) {
            declarationIndex.put(id, declarationIndex.size());
        }
        Map<String, Integer> inDegree = new HashMap<>();
        PriorityQueue<String> queue = new PriorityQueue<>(Comparator.comparing(declarationIndex::get));
        for (String id : ids) {
            int degree = dependencies.get(id).size();
            inDegree.put(id, degree);
            if (degree == 0) {
                queue.offer(id);
            }
        }

        List<String> result = new ArrayList<>(ids.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);
            for (String dependent : dependents.get(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }
        return result;
    }

    private static List<List<String>> computeTiers(List<String> order, Map<String, Set<String>> dependencies) {
        Map<String, Integer> depth = new HashMap<>();
        List<List<String>> tiers = new ArrayList<>();
        for (String id : order) {
            int level = 0;
            for (String dependency : dependencies.get(id)) {
                level = Math.max(level, depth.get(dependency) + 1);
            }
            depth.put(id, level);
            while (tiers.size() <= level) {
                tiers.add(new ArrayList<>());
            }
            tiers.get(level).add(id);
        }
        List<List<String>> frozen = new ArrayList<>(tiers.size());
        for (List<String> tier : tiers) {
            frozen.add(List.copyOf(tier));
        }
        return List.copyOf(frozen);
    }

    private enum Color { WHITE, GRAY, BLACK }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "actions=" + descriptors.keySet() +
               ", dependencies=" + dependencies +
               '}';
    }
}
