package dev.mars.cascade.core.exceptions;

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
 * Raised when a set of action descriptors cannot form an executable graph.
 * Always raised before any action starts.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class GraphValidationException extends CascadeException {

    public enum Kind {
        DUPLICATE_ACTION,
        UNKNOWN_DEPENDENCY,
        CYCLE_DETECTED,
        UNKNOWN_ACTION_KIND
    }

    private final Kind kind;
    private final String actionId;
    private final List<String> cycle;

    public GraphValidationException(Kind kind, String actionId, String message) {
        this(kind, actionId, List.of(), message);
    }

    public GraphValidationException(Kind kind, String actionId, List<String> cycle, String message) {
        super(message);
        this.kind = kind;
        this.actionId = actionId;
        this.cycle = List.copyOf(cycle);
    }

    public static GraphValidationException cycleDetected(List<String> cycle) {
        return new GraphValidationException(Kind.CYCLE_DETECTED, cycle.get(0), cycle,
                "Circular dependency detected: " + String.join(" -> ", cycle));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The action the error was found on.
     */
    public String getActionId() {
        return actionId;
    }

    /**
     * For {@link Kind#CYCLE_DETECTED}, the offending path; it starts and ends with the same id.
     * Empty for every other kind.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
