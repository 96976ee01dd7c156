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

import dev.mars.cascade.core.exceptions.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle state of a single action within a run.
 *
 * <p>
 * <strong>State categories:</strong>
 * </p>
 * <ul>
 * <li><strong>Waiting</strong> ({@code PENDING}, {@code READY}): not yet handed to a runner.</li>
 * <li><strong>Active</strong> ({@code RUNNING}): a runner is executing the action.</li>
 * <li><strong>Terminal</strong> ({@code SUCCESS}, {@code WARNING}, {@code FAILURE},
 * {@code SKIPPED}, {@code CANCELLED}): no further transitions are possible.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public enum ActionState {

    /** Waiting for at least one dependency to terminate. */
    PENDING("pending", "Waiting for dependencies"),

    /** Every dependency is terminal; eligible for dispatch. */
    READY("ready", "Eligible for dispatch"),

    RUNNING("running", "Runner is executing the action"),

    SUCCESS("success", "Completed successfully"),

    /** Failed, but the action has low severity so the run is not failed by it. */
    WARNING("warning", "Failed with low severity"),

    /** Runner failure, runner exception or render error. */
    FAILURE("failure", "Failed"),

    /** Never dispatched because of an upstream failure or a strategy halt. */
    SKIPPED("skipped", "Skipped"),

    CANCELLED("cancelled", "Cancelled");

    private static final Map<ActionState, Set<ActionState>> TRANSITIONS;

    static {
        var map = new EnumMap<ActionState, Set<ActionState>>(ActionState.class);
        map.put(PENDING, EnumSet.of(READY, SKIPPED, CANCELLED));
        map.put(READY, EnumSet.of(RUNNING, WARNING, FAILURE, SKIPPED, CANCELLED));
        map.put(RUNNING, EnumSet.of(SUCCESS, WARNING, FAILURE, CANCELLED));
        map.put(SUCCESS, EnumSet.noneOf(ActionState.class));
        map.put(WARNING, EnumSet.noneOf(ActionState.class));
        map.put(FAILURE, EnumSet.noneOf(ActionState.class));
        map.put(SKIPPED, EnumSet.noneOf(ActionState.class));
        map.put(CANCELLED, EnumSet.noneOf(ActionState.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;

    ActionState(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Terminal states that block dependents under failure-propagating strategies.
     *
     * @return true for {@code FAILURE} and {@code CANCELLED}
     */
    public boolean isUnsuccessful() {
        return this == FAILURE || this == CANCELLED;
    }

    /**
     * Terminal states that skip a dependent over a strict dependency edge.
     *
     * @return true for every terminal state except {@code SUCCESS}
     */
    public boolean blocksStrictDependents() {
        return isTerminal() && this != SUCCESS;
    }

    /**
     * Checks whether a transition from this state to the given target state is valid.
     *
     * <pre>
     *   PENDING   → READY, SKIPPED, CANCELLED
     *   READY     → RUNNING, WARNING, FAILURE, SKIPPED, CANCELLED
     *   RUNNING   → SUCCESS, WARNING, FAILURE, CANCELLED
     *   SUCCESS, WARNING, FAILURE, SKIPPED, CANCELLED → (terminal)
     * </pre>
     *
     * @param target the state to move to
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(ActionState target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<ActionState> getValidTransitions() {
        return TRANSITIONS.get(this);
    }

    /**
     * Validates and returns the target state.
     *
     * @param actionId action being moved, for the error message
     * @param target   the requested state
     * @return {@code target}
     * @throws InvalidTransitionException if the transition is not in the table
     */
    public ActionState transitionTo(String actionId, ActionState target) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(actionId, this, target, getValidTransitions());
        }
        return target;
    }

    public static ActionState fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Action state value must not be null");
        }
        for (ActionState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown action state: " + value);
    }
}
