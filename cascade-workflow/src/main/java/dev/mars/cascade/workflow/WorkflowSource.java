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

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a workflow document comes from: a file or standard input.
 */
public final class WorkflowSource {

    static final String STDIN_NAME = "<stdin>";

    private final Path path;

    private WorkflowSource(Path path) {
        this.path = path;
    }

    public static WorkflowSource file(Path path) {
        return new WorkflowSource(Objects.requireNonNull(path, "Path cannot be null"));
    }

    public static WorkflowSource stdin() {
        return new WorkflowSource(null);
    }

    public boolean isStdin() {
        return path == null;
    }

    /**
     * @throws IllegalStateException for standard input
     */
    public Path getPath() {
        if (path == null) {
            throw new IllegalStateException("Standard input has no path");
        }
        return path;
    }

    public String getName() {
        return path == null ? STDIN_NAME : path.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(path, ((WorkflowSource) o).path);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(path);
    }

    @Override
    public String toString() {
        return getName();
    }
}
