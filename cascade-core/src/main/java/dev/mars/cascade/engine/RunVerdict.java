package dev.mars.cascade.engine;

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

import java.util.Collection;

/**
 * Overall result of a run.
 */
public enum RunVerdict {

    SUCCESS,
    FAILURE,
    CANCELLED;

    /**
     * @param cancelled   whether the run itself was cancelled
     * @param finalStates terminal state of every action; WARNING counts as success
     */
    public static RunVerdict of(boolean cancelled, Collection<ActionState> finalStates) {
        if (cancelled) {
            return CANCELLED;
        }
        if (finalStates.contains(ActionState.FAILURE)) {
            return FAILURE;
        }
        if (finalStates.contains(ActionState.CANCELLED)) {
            return CANCELLED;
        }
        return SUCCESS;
    }

    public boolean isSuccessful() {
        return this == SUCCESS;
    }
}
