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


/**
 * Raised on a second write of the same (action, key) outcome pair.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class OutcomeConflictException extends CascadeException {

    private final String actionId;
    private final String key;

    public OutcomeConflictException(String actionId, String key) {
        super("Outcome '" + key + "' of action '" + actionId + "' has already been recorded");
        this.actionId = actionId;
        this.key = key;
    }

    public String getActionId() {
        return actionId;
    }

    public String getKey() {
        return key;
    }
}
