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

/**
 * How much an action's failure matters to the run.
 */
public enum ActionSeverity {

    /** A failure fails the run. */
    NORMAL("normal"),

    /** A failure ends the action in {@link ActionState#WARNING} and leaves the verdict alone. */
    LOW("low");

    private final String value;

    ActionSeverity(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for an unknown value
     */
    public static ActionSeverity fromValue(String value) {
        for (ActionSeverity severity : values()) {
            if (severity.value.equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Invalid severity: '" + value + "' (expected one of: low, normal)");
    }
}
