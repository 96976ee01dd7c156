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

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown when an action is asked to move between two lifecycle states that its
 * transition table does not connect.
 *
 * <p>The engine loop is the only component that moves actions between states, so
 * this exception always signals an engine defect and aborts the run.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-20
 * @version 1.0
 */
public class InvalidTransitionException extends CascadeException {

    private final String actionId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;
    private final Set<? extends Enum<?>> validTransitions;

    /**
     * @param actionId         the action whose transition was rejected
     * @param currentState     the state the action is in
     * @param requestedState   the state that was requested
     * @param validTransitions the states reachable from the current state
     */
    public InvalidTransitionException(String actionId, Enum<?> currentState,
                                      Enum<?> requestedState, Set<? extends Enum<?>> validTransitions) {
        super(String.format("Invalid transition for action '%s': %s -> %s. Valid targets: %s",
                actionId, currentState, requestedState, formatTransitions(validTransitions)));
        this.actionId = actionId;
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.validTransitions = Set.copyOf(validTransitions);
    }

    public String getActionId() {
        return actionId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    public Set<? extends Enum<?>> getValidTransitions() {
        return validTransitions;
    }

    private static String formatTransitions(Set<? extends Enum<?>> transitions) {
        if (transitions == null || transitions.isEmpty()) {
            return "[]";
        }
        return transitions.stream()
                .map(Enum::name)
                .sorted()
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
