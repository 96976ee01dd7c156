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
 * Raised when an action's parameters cannot be rendered against the outcome ledger.
 * The engine treats it as a failure of the action being rendered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class RenderException extends CascadeException {

    public enum Kind {
        /** Referenced outcome key was never produced (strict rendering only). */
        MISSING_OUTCOME,
        /** Referenced action id is not part of the graph. */
        UNKNOWN_ACTION,
        /** Referenced context variable is not defined. */
        MISSING_CONTEXT_KEY,
        MALFORMED_REFERENCE,
        /** Context entries reference each other too deeply, usually a loop. */
        RECURSION_LIMIT
    }

    private final Kind kind;
    private final String expression;

    public RenderException(Kind kind, String expression, String message) {
        super(message);
        this.kind = kind;
        this.expression = expression;
    }

    public Kind getKind() {
        return kind;
    }

    public String getExpression() {
        return expression;
    }
}
