package dev.mars.cascade.workflow;

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

import dev.mars.cascade.core.exceptions.CascadeException;

/**
 * Exception thrown when a workflow document cannot be read or turned into action descriptors.
 * Carries the source the document came from, the YAML line when known and the path of the
 * offending field, for example {@code actions[2].expects[0]}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-24
 * @version 1.0
 */
public class WorkflowLoadException extends CascadeException {

    private final String source;
    private final int lineNumber;
    private final String fieldPath;

    public WorkflowLoadException(String message) {
        this(null, -1, null, message, null);
    }

    public WorkflowLoadException(String message, Throwable cause) {
        this(null, -1, null, message, cause);
    }

    public WorkflowLoadException(String source, String message) {
        this(source, -1, null, message, null);
    }

    public WorkflowLoadException(String source, String message, Throwable cause) {
        this(source, -1, null, message, cause);
    }

    public WorkflowLoadException(String source, String fieldPath, String message) {
        this(source, -1, fieldPath, message, null);
    }

    public WorkflowLoadException(String source, int lineNumber, String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.lineNumber = lineNumber;
        this.fieldPath = fieldPath;
    }

    /**
     * File name of the document, or {@code <stdin>} / {@code <string>}; null if unknown.
     */
    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    /**
     * The bare problem description, without source, line or field prefixes.
     */
    public String getProblem() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (source != null) {
            sb.append("Workflow '").append(source).append("': ");
        }

        if (lineNumber > 0) {
            sb.append("Line ").append(lineNumber).append(": ");
        }

        if (fieldPath != null) {
            sb.append("Field '").append(fieldPath).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
