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


/**
 * How a reference to an outcome that was never recorded is rendered.
 */
public enum RenderingMode {

    /** Missing outcome is a render error. */
    STRICT,

    /** Missing outcome renders as the empty string. */
    LENIENT;

    public static RenderingMode fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rendering mode must not be null");
        }
        for (RenderingMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown rendering mode: " + value);
    }
}
