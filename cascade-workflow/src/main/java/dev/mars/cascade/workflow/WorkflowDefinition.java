package dev.mars.cascade.workflow;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A loaded workflow: its actions in declaration order and the user context they render against.
 * Not yet validated as a graph; {@link #toGraph()} does that.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public final class WorkflowDefinition {

    private final String source;
    private final List<ActionDescriptor> actions;
    private final Map<String, Object> context;

    public WorkflowDefinition(String source, List<ActionDescriptor> actions, Map<String, Object> context) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.actions = List.copyOf(actions);
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String getSource() {
        return source;
    }

    public List<ActionDescriptor> getActions() {
        return actions;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Optional<ActionDescriptor> getAction(String id) {
        return actions.stream().filter(action -> action.getId().equals(id)).findFirst();
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public DependencyGraph toGraph() throws GraphValidationException {
        return DependencyGraph.build(actions);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
                "source='" + source + '\'' +
                ", actions=" + actions.size() +
                ", context=" + context.keySet() +
                '}';
    }
}
