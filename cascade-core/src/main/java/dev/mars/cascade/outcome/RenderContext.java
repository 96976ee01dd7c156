package dev.mars.cascade.outcome;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Everything a reference can be resolved against while rendering one action's parameters.
 */
public final class RenderContext {

    private final OutcomeLedger ledger;
    private final Set<String> actionIds;
    private final Function<String, ActionState> states;
    private final Map<String, Object> variables;
    private final Function<String, String> environment;
    private final RenderingMode mode;

    private RenderContext(Builder builder) {
        this.ledger = Objects.requireNonNull(builder.ledger, "Ledger cannot be null");
        this.actionIds = Set.copyOf(builder.actionIds);
        this.states = builder.states;
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.environment = builder.environment;
        this.mode = builder.mode;
    }

    public static Builder builder(OutcomeLedger ledger) {
        return new Builder(ledger);
    }

    public OutcomeLedger getLedger() {
        return ledger;
    }

    public boolean isKnownAction(String actionId) {
        return actionIds.contains(actionId);
    }

    public ActionState getState(String actionId) {
        return states.apply(actionId);
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public String getEnvironmentVariable(String name) {
        return environment.apply(name);
    }

    public RenderingMode getMode() {
        return mode;
    }

    public static final class Builder {
        private final OutcomeLedger ledger;
        private Set<String> actionIds = Set.of();
        private Function<String, ActionState> states = id -> ActionState.PENDING;
        private Map<String, Object> variables = Map.of();
        private Function<String, String> environment = System::getenv;
        private RenderingMode mode = RenderingMode.LENIENT;

        private Builder(OutcomeLedger ledger) {
            this.ledger = ledger;
        }

        public Builder actionIds(Set<String> actionIds) {
            this.actionIds = actionIds;
            return this;
        }

        public Builder states(Function<String, ActionState> states) {
            this.states = states;
            return this;
        }

        public Builder variables(Map<String, Object> variables) {
            this.variables = variables;
            return this;
        }

        public Builder environment(Function<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder mode(RenderingMode mode) {
            this.mode = mode;
            return this;
        }

        public RenderContext build() {
            return new RenderContext(this);
        }
    }
}
