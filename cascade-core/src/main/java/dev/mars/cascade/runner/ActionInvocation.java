package dev.mars.cascade.runner;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * One call of a runner: the action identity, its rendered parameters and a sink for
 * progress messages.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public final class ActionInvocation {

    private final String actionId;
    private final String kind;
    private final Map<String, Object> parameters;
    private final List<String> declaredOutcomes;
    private final Consumer<String> messageSink;

    public ActionInvocation(String actionId, String kind, Map<String, Object> parameters,
                            List<String> declaredOutcomes, Consumer<String> messageSink) {
        this.actionId = Objects.requireNonNull(actionId, "Action id cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.declaredOutcomes = List.copyOf(declaredOutcomes);
        this.messageSink = messageSink != null ? messageSink : message -> { };
    }

    public String getActionId() {
        return actionId;
    }

    public String getKind() {
        return kind;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Optional<Object> getParameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    /**
     * String form of a parameter, empty if absent.
     */
    public Optional<String> getStringParameter(String name) {
        return getParameter(name).map(String::valueOf);
    }

    public List<String> getDeclaredOutcomes() {
        return declaredOutcomes;
    }

    /**
     * Forwards a progress message to the execution listeners. Safe to call from any thread.
     */
    public void emit(String message) {
        messageSink.accept(message);
    }
}
