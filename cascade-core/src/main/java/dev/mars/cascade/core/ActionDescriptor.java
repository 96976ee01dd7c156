package dev.mars.cascade.core;

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one unit of work in a workflow.
 *
 * <p>The parameter payload is a tree of strings, numbers, booleans, lists and maps. String
 * leaves may contain outcome references that are rendered right before the action is
 * dispatched. Dependencies keep their declaration order; a dependency added with
 * {@link Builder#dependsOnStrictly} also skips this action when it fails under a strategy
 * that otherwise lets dependents run.</p>
 *
 * <pre>{@code
 * ActionDescriptor deploy = ActionDescriptor.builder("deploy")
 *     .kind("shell")
 *     .parameter("command", "deploy.sh @{build.artifact}")
 *     .dependsOn("build")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ActionDescriptor {

    private final String id;
    private final String kind;
    private final Map<String, Object> parameters;
    private final Set<String> dependencies;
    private final Set<String> strictDependencies;
    private final List<String> declaredOutcomes;
    private final String description;
    private final ActionSeverity severity;

    private ActionDescriptor(Builder builder) {
        this.id = requireText(builder.id, "Action id");
        this.kind = requireText(builder.kind, "Action kind for '" + builder.id + "'");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters));
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependencies));
        this.strictDependencies = Collections.unmodifiableSet(new LinkedHashSet<>(builder.strictDependencies));
        this.declaredOutcomes = List.copyOf(builder.declaredOutcomes);
        this.description = builder.description;
        this.severity = Objects.requireNonNull(builder.severity, "Severity cannot be null");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    /**
     * Raw, unrendered parameters. Nested collections are returned as supplied to the builder
     * and must not be mutated.
     */
    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    /**
     * The subset of {@link #getDependencies()} whose failure, skip or warning always skips
     * this action.
     */
    public Set<String> getStrictDependencies() {
        return strictDependencies;
    }

    public ActionSeverity getSeverity() {
        return severity;
    }

    /**
     * Outcome keys this action promises to produce. Empty when the action declares nothing.
     */
    public List<String> getDeclaredOutcomes() {
        return declaredOutcomes;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    private static String requireText(String value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionDescriptor that = (ActionDescriptor) o;
        return id.equals(that.id) && kind.equals(that.kind)
                && parameters.equals(that.parameters)
                && dependencies.equals(that.dependencies)
                && strictDependencies.equals(that.strictDependencies)
                && declaredOutcomes.equals(that.declaredOutcomes)
                && Objects.equals(description, that.description)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, parameters, dependencies, strictDependencies, declaredOutcomes,
                description, severity);
    }

    @Override
    public String toString() {
        return "ActionDescriptor{" +
                "id='" + id + '\'' +
                ", kind='" + kind + '\'' +
                ", dependencies=" + dependencies +
                '}';
    }

    public static final class Builder {
        private final String id;
        private String kind;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final Set<String> strictDependencies = new LinkedHashSet<>();
        private final List<String> declaredOutcomes = new ArrayList<>();
        private String description;
        private ActionSeverity severity = ActionSeverity.NORMAL;

        private Builder(String id) {
            this.id = id;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder parameter(String name, Object value) {
            this.parameters.put(name, value);
            return this;
        }

        public Builder parameters(Map<String, ?> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder dependsOn(String... dependencyIds) {
            Collections.addAll(this.dependencies, dependencyIds);
            return this;
        }

        public Builder dependsOn(Collection<String> dependencyIds) {
            this.dependencies.addAll(dependencyIds);
            return this;
        }

        public Builder dependsOnStrictly(String... dependencyIds) {
            Collections.addAll(this.dependencies, dependencyIds);
            Collections.addAll(this.strictDependencies, dependencyIds);
            return this;
        }

        public Builder dependsOnStrictly(Collection<String> dependencyIds) {
            this.dependencies.addAll(dependencyIds);
            this.strictDependencies.addAll(dependencyIds);
            return this;
        }

        public Builder declaresOutcomes(String... keys) {
            Collections.addAll(this.declaredOutcomes, keys);
            return this;
        }

        public Builder declaresOutcomes(Collection<String> keys) {
            this.declaredOutcomes.addAll(keys);
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder severity(ActionSeverity severity) {
            this.severity = severity;
            return this;
        }

        public ActionDescriptor build() {
            return new ActionDescriptor(this);
        }
    }
}
